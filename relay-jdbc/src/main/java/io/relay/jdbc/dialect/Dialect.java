package io.relay.jdbc.dialect;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Register custom dialects via {@code META-INF/services/io.relay.jdbc.dialect.Dialect}.
 * Built-in dialects: PostgreSQL, H2.
 *
 * @see Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Value of {@link java.sql.DatabaseMetaData#getDatabaseProductName()} for this database,
   * used when the JDBC URL is wrapped by a proxy driver and matches no prefix.
   */
  String databaseProductName();

  /**
   * SQL inserting one row unless a row with the same key exists. Parameters are the
   * column values in order.
   *
   * <p>Dialects without a skip-on-conflict clause may return a plain INSERT; the resulting
   * integrity violation is then mapped to "not inserted".
   *
   * @param table      validated table name
   * @param columns    columns to insert
   * @param keyColumns columns of the unique key that decides "exists"
   */
  String insertIfAbsentSql(String table, List<String> columns, List<String> keyColumns);
}
