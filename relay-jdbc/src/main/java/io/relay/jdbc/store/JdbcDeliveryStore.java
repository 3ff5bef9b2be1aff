package io.relay.jdbc.store;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.jdbc.dialect.Dialect;
import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;
import io.relay.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * JDBC delivery store.
 *
 * <p>Every transition after the claim is guarded by {@code status=IN_FLIGHT AND version=?}
 * and bumps {@code version}, so a worker holding an outdated claim updates nothing.
 */
public final class JdbcDeliveryStore implements DeliveryStore {
  private static final List<String> INSERT_COLUMNS = List.of(
      "id", "endpoint_id", "event_id", "event_type", "payload", "status", "attempts",
      "next_attempt_at", "version", "created_at", "updated_at");
  private static final List<String> KEY_COLUMNS = List.of("endpoint_id", "event_id");

  private static final String COLUMNS = "id, endpoint_id, event_id, event_type, payload, status, attempts, "
      + "next_attempt_at, last_response_status, last_response_body, last_error, version, claimed_at, "
      + "created_at, updated_at, delivered_at";

  private static final int IN_FLIGHT = DeliveryStatus.IN_FLIGHT.code();
  private static final String WAITING_STATUS_IN =
      "(" + DeliveryStatus.PENDING.code() + "," + DeliveryStatus.PENDING_RETRY.code() + ")";

  static final JdbcTemplate.RowMapper<WebhookDelivery> ROW_MAPPER = rs -> new WebhookDelivery(
      rs.getString("id"),
      rs.getString("endpoint_id"),
      rs.getString("event_id"),
      rs.getString("event_type"),
      rs.getString("payload"),
      DeliveryStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      JdbcTemplate.nullableInt(rs, "last_response_status"),
      rs.getString("last_response_body"),
      rs.getString("last_error"),
      rs.getLong("version"),
      JdbcTemplate.instant(rs, "claimed_at"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"),
      JdbcTemplate.instant(rs, "delivered_at"));

  private final String table;
  private final String endpointTable;
  private final String insertSql;

  public JdbcDeliveryStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_DELIVERIES, TableNames.DEFAULT_ENDPOINTS);
  }

  /**
   * @param table         deliveries table
   * @param endpointTable endpoints table, joined to skip disabled endpoints
   */
  public JdbcDeliveryStore(Dialect dialect, String table, String endpointTable) {
    Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.endpointTable = TableNames.validate(endpointTable);
    this.insertSql = dialect.insertIfAbsentSql(this.table, INSERT_COLUMNS, KEY_COLUMNS);
  }

  @Override
  public boolean insertPending(Connection conn, WebhookDelivery delivery) {
    return JdbcTemplate.insertIfAbsent(conn, insertSql,
        delivery.id(), delivery.endpointId(), delivery.eventId(), delivery.eventType(), delivery.payload(),
        delivery.status().code(), delivery.attempts(), ts(delivery.nextAttemptAt()), delivery.version(),
        ts(delivery.createdAt()), ts(delivery.updatedAt() != null ? delivery.updatedAt() : delivery.createdAt()));
  }

  @Override
  public List<WebhookDelivery> findDue(Connection conn, Instant now, Instant leaseExpiry, int limit) {
    String sql = "SELECT " + prefixed("d") + " FROM " + table + " d" +
        " JOIN " + endpointTable + " e ON e.id = d.endpoint_id" +
        " WHERE e.enabled=? AND ((d.status IN " + WAITING_STATUS_IN + " AND d.next_attempt_at<=?)" +
        " OR (d.status=" + IN_FLIGHT + " AND d.claimed_at<?))" +
        " ORDER BY d.next_attempt_at, d.created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, true, ts(now), ts(leaseExpiry), limit);
  }

  @Override
  public boolean claim(Connection conn, String deliveryId, long expectedVersion, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + IN_FLIGHT +
        ", version=version+1, claimed_at=?, updated_at=?" +
        " WHERE id=? AND version=? AND status IN (" + DeliveryStatus.PENDING.code() + "," +
        IN_FLIGHT + "," + DeliveryStatus.PENDING_RETRY.code() + ")";
    return JdbcTemplate.update(conn, sql, ts(now), ts(now), deliveryId, expectedVersion) == 1;
  }

  @Override
  public int release(Connection conn, String deliveryId, long version, DeliveryStatus status, Instant now) {
    if (status != DeliveryStatus.PENDING && status != DeliveryStatus.PENDING_RETRY) {
      throw new IllegalArgumentException("Can only release to PENDING or PENDING_RETRY, got: " + status);
    }
    String sql = "UPDATE " + table + " SET status=?, version=version+1, claimed_at=NULL, updated_at=?" +
        " WHERE id=? AND version=? AND status=" + IN_FLIGHT;
    return JdbcTemplate.update(conn, sql, status.code(), ts(now), deliveryId, version);
  }

  @Override
  public int markDelivered(Connection conn, String deliveryId, long version,
      int responseStatus, String responseBody, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + DeliveryStatus.DELIVERED.code() +
        ", attempts=attempts+1, version=version+1, next_attempt_at=NULL, claimed_at=NULL" +
        ", last_response_status=?, last_response_body=?, last_error=NULL, delivered_at=?, updated_at=?" +
        " WHERE id=? AND version=? AND status=" + IN_FLIGHT;
    return JdbcTemplate.update(conn, sql, responseStatus, responseBody, ts(now), ts(now), deliveryId, version);
  }

  @Override
  public int markRetry(Connection conn, String deliveryId, long version, Instant nextAttemptAt,
      Integer responseStatus, String responseBody, String error, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + DeliveryStatus.PENDING_RETRY.code() +
        ", attempts=attempts+1, version=version+1, next_attempt_at=?, claimed_at=NULL" +
        ", last_response_status=?, last_response_body=?, last_error=?, updated_at=?" +
        " WHERE id=? AND version=? AND status=" + IN_FLIGHT;
    return JdbcTemplate.update(conn, sql, ts(nextAttemptAt), responseStatus, responseBody, error,
        ts(now), deliveryId, version);
  }

  @Override
  public int markExhausted(Connection conn, String deliveryId, long version,
      Integer responseStatus, String responseBody, String error, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + DeliveryStatus.FAILED_EXHAUSTED.code() +
        ", attempts=attempts+1, version=version+1, next_attempt_at=NULL, claimed_at=NULL" +
        ", last_response_status=?, last_response_body=?, last_error=?, updated_at=?" +
        " WHERE id=? AND version=? AND status=" + IN_FLIGHT;
    return JdbcTemplate.update(conn, sql, responseStatus, responseBody, error, ts(now), deliveryId, version);
  }

  @Override
  public int cancel(Connection conn, String deliveryId, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + DeliveryStatus.CANCELLED.code() +
        ", version=version+1, next_attempt_at=NULL, updated_at=?" +
        " WHERE id=? AND status IN " + WAITING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, ts(now), deliveryId);
  }

  @Override
  public Optional<WebhookDelivery> findById(Connection conn, String deliveryId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, deliveryId);
  }

  @Override
  public List<WebhookDelivery> listByEvent(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE event_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, eventId);
  }

  @Override
  public List<WebhookDelivery> queryByStatus(Connection conn, DeliveryStatus status, String endpointId, int limit) {
    if (endpointId == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE status=? ORDER BY created_at, id LIMIT ?";
      return JdbcTemplate.query(conn, sql, ROW_MAPPER, status.code(), limit);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table +
        " WHERE status=? AND endpoint_id=? ORDER BY created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, status.code(), endpointId, limit);
  }

  @Override
  public int countByStatus(Connection conn, DeliveryStatus status, String endpointId) {
    if (endpointId == null) {
      return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM " + table + " WHERE status=?", status.code());
    }
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM " + table + " WHERE status=? AND endpoint_id=?",
        status.code(), endpointId);
  }

  private static String prefixed(String alias) {
    StringBuilder sb = new StringBuilder();
    for (String column : COLUMNS.split(",\\s*")) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(alias).append('.').append(column);
    }
    return sb.toString();
  }
}
