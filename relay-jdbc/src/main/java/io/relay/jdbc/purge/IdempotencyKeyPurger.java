package io.relay.jdbc.purge;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * Deletes idempotency records whose {@code expires_at} is before the cutoff, whatever their
 * status. Schedule it with a zero retention: the TTL is already part of {@code expires_at}.
 *
 * <p>The table has a composite key, so each batch selects the keys first and deletes them
 * one by one, re-checking {@code expires_at}.
 */
public final class IdempotencyKeyPurger extends AbstractJdbcPurger {

  public IdempotencyKeyPurger() {
    this(TableNames.DEFAULT_IDEMPOTENCY_KEYS);
  }

  public IdempotencyKeyPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String selectSql = "SELECT scope, idempotency_key FROM " + tableName() +
        " WHERE expires_at<? ORDER BY expires_at LIMIT ?";
    List<String[]> keys = JdbcTemplate.query(conn, selectSql,
        rs -> new String[]{rs.getString("scope"), rs.getString("idempotency_key")}, ts(before), limit);
    String deleteSql = "DELETE FROM " + tableName() + " WHERE scope=? AND idempotency_key=? AND expires_at<?";
    int deleted = 0;
    for (String[] key : keys) {
      deleted += JdbcTemplate.update(conn, deleteSql, key[0], key[1], ts(before));
    }
    return deleted;
  }
}
