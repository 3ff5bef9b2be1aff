package io.relay.jdbc;

import io.relay.jdbc.dialect.Dialect;
import io.relay.jdbc.dialect.Dialects;
import io.relay.jdbc.purge.DeliveryRetentionPurger;
import io.relay.jdbc.purge.IdempotencyKeyPurger;
import io.relay.jdbc.purge.IncomingEventRetentionPurger;
import io.relay.jdbc.store.JdbcDeliveryStore;
import io.relay.jdbc.store.JdbcEndpointStore;
import io.relay.jdbc.store.JdbcIdempotencyStore;
import io.relay.jdbc.store.JdbcIncomingEventStore;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The full set of JDBC stores and purgers for one database, sharing a dialect and table names.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcRelayStores stores = JdbcRelayStores.detect(dataSource);
 * Relay relay = Relay.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .idempotencyStore(stores.idempotencyStore())
 *     .endpointStore(stores.endpointStore())
 *     .deliveryStore(stores.deliveryStore())
 *     .incomingEventStore(stores.incomingEventStore())
 *     .purger(stores.idempotencyKeyPurger(), Duration.ZERO)
 *     .build();
 * }</pre>
 */
public final class JdbcRelayStores {
  private final Dialect dialect;
  private final TableNames tables;
  private final JdbcIdempotencyStore idempotencyStore;
  private final JdbcEndpointStore endpointStore;
  private final JdbcDeliveryStore deliveryStore;
  private final JdbcIncomingEventStore incomingEventStore;

  private JdbcRelayStores(Dialect dialect, TableNames tables) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.idempotencyStore = new JdbcIdempotencyStore(dialect, tables.idempotencyKeys());
    this.endpointStore = new JdbcEndpointStore(tables.endpoints());
    this.deliveryStore = new JdbcDeliveryStore(dialect, tables.deliveries(), tables.endpoints());
    this.incomingEventStore = new JdbcIncomingEventStore(dialect, tables.events());
  }

  public static JdbcRelayStores create(Dialect dialect, TableNames tables) {
    return new JdbcRelayStores(dialect, tables);
  }

  /**
   * Detects the dialect from the data source's JDBC URL and uses the default table names.
   *
   * @throws IllegalStateException    if the data source cannot be reached
   * @throws IllegalArgumentException if no registered dialect matches the URL
   */
  public static JdbcRelayStores detect(DataSource dataSource) {
    return detect(dataSource, TableNames.defaults());
  }

  public static JdbcRelayStores detect(DataSource dataSource, TableNames tables) {
    return new JdbcRelayStores(Dialects.detect(dataSource), tables);
  }

  public Dialect dialect() {
    return dialect;
  }

  public TableNames tables() {
    return tables;
  }

  public JdbcIdempotencyStore idempotencyStore() {
    return idempotencyStore;
  }

  public JdbcEndpointStore endpointStore() {
    return endpointStore;
  }

  public JdbcDeliveryStore deliveryStore() {
    return deliveryStore;
  }

  public JdbcIncomingEventStore incomingEventStore() {
    return incomingEventStore;
  }

  public IdempotencyKeyPurger idempotencyKeyPurger() {
    return new IdempotencyKeyPurger(tables.idempotencyKeys());
  }

  public DeliveryRetentionPurger deliveryRetentionPurger() {
    return new DeliveryRetentionPurger(tables.deliveries());
  }

  public IncomingEventRetentionPurger incomingEventRetentionPurger() {
    return new IncomingEventRetentionPurger(tables.events());
  }
}
