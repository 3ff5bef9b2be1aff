package io.relay.jdbc.store;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.model.EventSubscription;
import io.relay.model.WebhookEndpoint;
import io.relay.spi.EndpointStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * JDBC endpoint store. The subscription is stored in one column in its encoded form
 * ({@code *} or comma-separated event type names).
 */
public final class JdbcEndpointStore implements EndpointStore {
  private static final String COLUMNS =
      "id, owner_id, url, secret, subscription, enabled, description, created_at, updated_at";

  static final JdbcTemplate.RowMapper<WebhookEndpoint> ROW_MAPPER = rs -> new WebhookEndpoint(
      rs.getString("id"),
      rs.getString("owner_id"),
      rs.getString("url"),
      rs.getString("secret"),
      EventSubscription.decode(rs.getString("subscription")),
      rs.getBoolean("enabled"),
      rs.getString("description"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String table;

  public JdbcEndpointStore() {
    this(TableNames.DEFAULT_ENDPOINTS);
  }

  public JdbcEndpointStore(String table) {
    this.table = TableNames.validate(table);
  }

  @Override
  public void insert(Connection conn, WebhookEndpoint endpoint) {
    String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        endpoint.id(), endpoint.ownerId(), endpoint.url(), endpoint.secret(),
        endpoint.subscription().encode(), endpoint.enabled(), endpoint.description(),
        ts(endpoint.createdAt()), ts(endpoint.updatedAt() != null ? endpoint.updatedAt() : endpoint.createdAt()));
  }

  @Override
  public Optional<WebhookEndpoint> findById(Connection conn, String endpointId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, endpointId);
  }

  @Override
  public List<WebhookEndpoint> listByOwner(Connection conn, String ownerId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE owner_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, ownerId);
  }

  @Override
  public List<WebhookEndpoint> listEnabled(Connection conn, String ownerId) {
    if (ownerId == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE enabled=? ORDER BY created_at, id";
      return JdbcTemplate.query(conn, sql, ROW_MAPPER, true);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table +
        " WHERE enabled=? AND owner_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, true, ownerId);
  }

  @Override
  public int setEnabled(Connection conn, String endpointId, boolean enabled, Instant now) {
    String sql = "UPDATE " + table + " SET enabled=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, enabled, ts(now), endpointId);
  }

  @Override
  public int updateSecret(Connection conn, String endpointId, String secret, Instant now) {
    String sql = "UPDATE " + table + " SET secret=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, secret, ts(now), endpointId);
  }
}
