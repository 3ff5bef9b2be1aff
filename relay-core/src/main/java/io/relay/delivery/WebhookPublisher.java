package io.relay.delivery;

import io.relay.WebhookEvent;
import io.relay.model.WebhookDelivery;
import io.relay.model.WebhookEndpoint;
import io.relay.registry.SubscriptionMatcher;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.DeliveryStore;
import io.relay.spi.EndpointStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.RelayStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans an event out to one PENDING delivery per matching enabled endpoint.
 *
 * <p>Use {@link #publish(Connection, WebhookEvent)} to write the deliveries inside the
 * caller's own transaction, so they commit or roll back with the business change that
 * produced the event. Publishing the same event id twice creates no additional rows.
 */
public final class WebhookPublisher {
  private static final Logger logger = Logger.getLogger(WebhookPublisher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final EndpointStore endpointStore;
  private final DeliveryStore deliveryStore;
  private final MetricsExporter metrics;
  private final Clock clock;

  public WebhookPublisher(ConnectionProvider connectionProvider, EndpointStore endpointStore,
      DeliveryStore deliveryStore, MetricsExporter metrics, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.endpointStore = Objects.requireNonNull(endpointStore, "endpointStore");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Publishes on a connection of its own in auto-commit mode.
   *
   * @return ids of the deliveries created
   * @throws RelayStoreException if the store is unavailable
   */
  public List<String> publish(WebhookEvent event) {
    Objects.requireNonNull(event, "event");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return publish(conn, event);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to publish event " + event.eventId(), e);
    }
  }

  /**
   * Publishes on the caller's connection. Transaction control stays with the caller.
   *
   * @return ids of the deliveries created, empty if no endpoint matched or the event was
   *     already published
   */
  public List<String> publish(Connection conn, WebhookEvent event) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(event, "event");
    Instant now = clock.instant();
    String eventType = event.eventType().name();

    List<String> created = new ArrayList<>();
    for (WebhookEndpoint endpoint : endpointStore.listEnabled(conn, event.ownerId())) {
      if (!SubscriptionMatcher.matches(endpoint.subscription(), eventType)) {
        continue;
      }
      WebhookDelivery delivery = WebhookDelivery.pending(UUID.randomUUID().toString(),
          endpoint.id(), event.eventId(), eventType, event.payloadJson(), now);
      if (deliveryStore.insertPending(conn, delivery)) {
        created.add(delivery.id());
        metrics.incrementDeliveryEnqueued();
      }
    }
    logger.log(Level.FINE, "Published event {0} type={1} deliveries={2}",
        new Object[]{event.eventId(), eventType, created.size()});
    return Collections.unmodifiableList(created);
  }
}
