package io.relay.jdbc.store;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.jdbc.dialect.Dialect;
import io.relay.model.IncomingEventStatus;
import io.relay.model.IncomingWebhookEvent;
import io.relay.spi.IncomingEventStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * JDBC store for inbound webhook events keyed by {@code (source, event_id)}.
 */
public final class JdbcIncomingEventStore implements IncomingEventStore {
  private static final List<String> INSERT_COLUMNS = List.of(
      "source", "event_id", "payload", "status", "received_at");
  private static final List<String> KEY_COLUMNS = List.of("source", "event_id");

  private static final String COLUMNS = "source, event_id, payload, status, error_message, received_at, processed_at";

  private static final JdbcTemplate.RowMapper<IncomingWebhookEvent> ROW_MAPPER = rs -> new IncomingWebhookEvent(
      rs.getString("source"),
      rs.getString("event_id"),
      rs.getString("payload"),
      IncomingEventStatus.fromCode(rs.getInt("status")),
      rs.getString("error_message"),
      JdbcTemplate.instant(rs, "received_at"),
      JdbcTemplate.instant(rs, "processed_at"));

  private final String table;
  private final String insertSql;

  public JdbcIncomingEventStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_EVENTS);
  }

  public JdbcIncomingEventStore(Dialect dialect, String table) {
    Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.insertSql = dialect.insertIfAbsentSql(this.table, INSERT_COLUMNS, KEY_COLUMNS);
  }

  @Override
  public boolean insertReceived(Connection conn, IncomingWebhookEvent event) {
    return JdbcTemplate.insertIfAbsent(conn, insertSql,
        event.source(), event.eventId(), event.payload(), event.status().code(), ts(event.receivedAt()));
  }

  @Override
  public boolean transition(Connection conn, String source, String eventId,
      IncomingEventStatus from, IncomingEventStatus to) {
    String sql = "UPDATE " + table + " SET status=?, error_message=NULL" +
        " WHERE source=? AND event_id=? AND status=?";
    return JdbcTemplate.update(conn, sql, to.code(), source, eventId, from.code()) == 1;
  }

  @Override
  public boolean claim(Connection conn, String source, String eventId, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + IncomingEventStatus.PROCESSING.code() +
        ", error_message=NULL, claimed_at=? WHERE source=? AND event_id=? AND status=" +
        IncomingEventStatus.RECEIVED.code();
    return JdbcTemplate.update(conn, sql, ts(now), source, eventId) == 1;
  }

  @Override
  public int releaseStalled(Connection conn, Instant claimedBefore) {
    String sql = "UPDATE " + table + " SET status=" + IncomingEventStatus.RECEIVED.code() +
        ", claimed_at=NULL WHERE status=" + IncomingEventStatus.PROCESSING.code() +
        " AND (claimed_at IS NULL OR claimed_at<?)";
    return JdbcTemplate.update(conn, sql, ts(claimedBefore));
  }

  @Override
  public boolean markProcessed(Connection conn, String source, String eventId, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + IncomingEventStatus.PROCESSED.code() +
        ", claimed_at=NULL, processed_at=? WHERE source=? AND event_id=? AND status=" +
        IncomingEventStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql, ts(now), source, eventId) == 1;
  }

  @Override
  public boolean markError(Connection conn, String source, String eventId, String errorMessage, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + IncomingEventStatus.ERROR.code() +
        ", error_message=?, claimed_at=NULL, processed_at=? WHERE source=? AND event_id=? AND status=" +
        IncomingEventStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql, errorMessage, ts(now), source, eventId) == 1;
  }

  @Override
  public Optional<IncomingWebhookEvent> find(Connection conn, String source, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE source=? AND event_id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, source, eventId);
  }

  @Override
  public List<IncomingWebhookEvent> queryByStatus(Connection conn, IncomingEventStatus status,
      String source, int limit) {
    if (source == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE status=? ORDER BY received_at LIMIT ?";
      return JdbcTemplate.query(conn, sql, ROW_MAPPER, status.code(), limit);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table +
        " WHERE status=? AND source=? ORDER BY received_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, status.code(), source, limit);
  }

  @Override
  public int countByStatus(Connection conn, IncomingEventStatus status, String source) {
    if (source == null) {
      return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM " + table + " WHERE status=?", status.code());
    }
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM " + table + " WHERE status=? AND source=?",
        status.code(), source);
  }
}
