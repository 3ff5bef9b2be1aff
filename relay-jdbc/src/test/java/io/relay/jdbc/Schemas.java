package io.relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Test databases with the bundled relay schema applied.
 */
public final class Schemas {

  private Schemas() {
  }

  /** A fresh in-memory H2 database named {@code <name>_<uuid>}. */
  public static JdbcDataSource h2(String name) {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + name + "_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    apply(dataSource, "/schema/h2.sql");
    return dataSource;
  }

  public static void apply(DataSource dataSource, String resource) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : load(resource).split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to apply " + resource, e);
    }
  }

  public static void truncateAll(DataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM webhook_deliveries");
      stmt.execute("DELETE FROM webhook_endpoints");
      stmt.execute("DELETE FROM webhook_events");
      stmt.execute("DELETE FROM idempotency_keys");
    }
  }

  private static String load(String resource) {
    try (InputStream is = Schemas.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("Missing resource " + resource);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }
}
