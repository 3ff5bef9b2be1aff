package io.relay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the relay components that run outside a caller's
 * transaction: the idempotency gate, delivery workers, pollers, purgers and the
 * inbound gateway.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.relay.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
