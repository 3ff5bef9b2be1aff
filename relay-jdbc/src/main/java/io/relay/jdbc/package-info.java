/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.relay.jdbc.JdbcRelayStores} builds every store and purger for one
 * {@linkplain io.relay.jdbc.dialect.Dialect dialect} and set of
 * {@linkplain io.relay.jdbc.TableNames table names}. {@link io.relay.jdbc.JdbcTemplate} provides
 * lightweight JDBC helpers, and {@link io.relay.jdbc.DataSourceConnectionProvider} adapts a
 * {@link javax.sql.DataSource} to the {@link io.relay.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.relay.jdbc.dialect} - database-specific SQL (H2, PostgreSQL)</li>
 *   <li>{@code io.relay.jdbc.store} - store SPI implementations</li>
 *   <li>{@code io.relay.jdbc.purge} - {@link io.relay.spi.Purger} implementations</li>
 * </ul>
 *
 * @see io.relay.jdbc.JdbcRelayStores
 * @see io.relay.jdbc.JdbcTemplate
 */
package io.relay.jdbc;
