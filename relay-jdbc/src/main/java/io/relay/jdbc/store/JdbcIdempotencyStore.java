package io.relay.jdbc.store;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.jdbc.dialect.Dialect;
import io.relay.model.CachedResponse;
import io.relay.model.IdempotencyRecord;
import io.relay.model.IdempotencyStatus;
import io.relay.spi.IdempotencyStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * JDBC idempotency store. Every ownership change is a single conditional statement on
 * {@code (scope, idempotency_key)} and the current {@code lock_token}.
 */
public final class JdbcIdempotencyStore implements IdempotencyStore {
  private static final List<String> INSERT_COLUMNS = List.of(
      "scope", "idempotency_key", "request_hash", "status", "lock_token",
      "locked_at", "created_at", "expires_at");
  private static final List<String> KEY_COLUMNS = List.of("scope", "idempotency_key");

  private static final String SELECT_COLUMNS = "scope, idempotency_key, request_hash, status, lock_token, "
      + "response_status, response_content_type, response_body, locked_at, completed_at, created_at, expires_at";

  private static final JdbcTemplate.RowMapper<IdempotencyRecord> ROW_MAPPER = rs -> {
    Integer responseStatus = JdbcTemplate.nullableInt(rs, "response_status");
    CachedResponse response = responseStatus == null ? null
        : new CachedResponse(responseStatus, rs.getString("response_content_type"), rs.getString("response_body"));
    return new IdempotencyRecord(
        rs.getString("scope"),
        rs.getString("idempotency_key"),
        rs.getString("request_hash"),
        IdempotencyStatus.fromCode(rs.getInt("status")),
        rs.getString("lock_token"),
        response,
        JdbcTemplate.instant(rs, "locked_at"),
        JdbcTemplate.instant(rs, "completed_at"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "expires_at"));
  };

  private final Dialect dialect;
  private final String table;
  private final String insertSql;

  public JdbcIdempotencyStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_IDEMPOTENCY_KEYS);
  }

  public JdbcIdempotencyStore(Dialect dialect, String table) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.insertSql = dialect.insertIfAbsentSql(this.table, INSERT_COLUMNS, KEY_COLUMNS);
  }

  @Override
  public boolean insertLocked(Connection conn, IdempotencyRecord record) {
    return JdbcTemplate.insertIfAbsent(conn, insertSql,
        record.scope(), record.key(), record.requestHash(), record.status().code(), record.lockToken(),
        ts(record.lockedAt()), ts(record.createdAt()), ts(record.expiresAt()));
  }

  @Override
  public Optional<IdempotencyRecord> find(Connection conn, String scope, String key) {
    String sql = "SELECT " + SELECT_COLUMNS + " FROM " + table + " WHERE scope=? AND idempotency_key=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, scope, key);
  }

  @Override
  public boolean stealLock(Connection conn, String scope, String key, String expectedLockToken,
      String newLockToken, Instant now) {
    String sql = "UPDATE " + table + " SET lock_token=?, locked_at=?" +
        " WHERE scope=? AND idempotency_key=? AND status=" + IdempotencyStatus.LOCKED.code() +
        " AND lock_token=?";
    return JdbcTemplate.update(conn, sql, newLockToken, ts(now), scope, key, expectedLockToken) == 1;
  }

  @Override
  public boolean complete(Connection conn, String scope, String key, String lockToken,
      CachedResponse response, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + IdempotencyStatus.COMPLETED.code() +
        ", response_status=?, response_content_type=?, response_body=?, completed_at=?" +
        " WHERE scope=? AND idempotency_key=? AND status=" + IdempotencyStatus.LOCKED.code() +
        " AND lock_token=?";
    return JdbcTemplate.update(conn, sql, response.status(), response.contentType(), response.body(),
        ts(now), scope, key, lockToken) == 1;
  }

  @Override
  public boolean release(Connection conn, String scope, String key, String lockToken) {
    String sql = "DELETE FROM " + table +
        " WHERE scope=? AND idempotency_key=? AND status=" + IdempotencyStatus.LOCKED.code() +
        " AND lock_token=?";
    return JdbcTemplate.update(conn, sql, scope, key, lockToken) == 1;
  }

  @Override
  public boolean deleteExpired(Connection conn, String scope, String key, Instant now) {
    String sql = "DELETE FROM " + table + " WHERE scope=? AND idempotency_key=? AND expires_at<=?";
    return JdbcTemplate.update(conn, sql, scope, key, ts(now)) == 1;
  }

  public Dialect dialect() {
    return dialect;
  }
}
