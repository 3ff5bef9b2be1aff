package io.relay.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING}: a failed statement would abort the caller's
 * transaction, which matters when deliveries are published inside a business transaction.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String databaseProductName() {
    return "PostgreSQL";
  }

  @Override
  public String insertIfAbsentSql(String table, List<String> columns, List<String> keyColumns) {
    return insertSql(table, columns) + " ON CONFLICT (" + String.join(", ", keyColumns) + ") DO NOTHING";
  }
}
