package io.relay.jdbc;

import io.relay.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens a new pooled connection from a {@link DataSource} for every relay operation.
 *
 * <p>Callers close the connection, which returns it to the pool. To publish deliveries in
 * an application transaction, pass that transaction's connection to
 * {@link io.relay.delivery.WebhookPublisher#publish(Connection, io.relay.WebhookEvent)}
 * instead of going through this provider.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    if (conn == null) {
      throw new SQLException("DataSource " + dataSource.getClass().getName() + " returned no connection");
    }
    return conn;
  }
}
