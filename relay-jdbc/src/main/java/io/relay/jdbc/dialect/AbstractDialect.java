package io.relay.jdbc.dialect;

import java.util.Collections;
import java.util.List;

/**
 * Base dialect producing a plain multi-column INSERT.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertIfAbsentSql(String table, List<String> columns, List<String> keyColumns) {
    return insertSql(table, columns);
  }

  protected static String insertSql(String table, List<String> columns) {
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + String.join(",", Collections.nCopies(columns.size(), "?")) + ")";
  }

  @Override
  public String toString() {
    return name();
  }
}
