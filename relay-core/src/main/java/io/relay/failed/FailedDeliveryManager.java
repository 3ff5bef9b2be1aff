package io.relay.failed;

import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.DeliveryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade over deliveries that gave up (FAILED_EXHAUSTED) and the delivery history
 * of events.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}, like
 * {@link io.relay.purge.PurgeScheduler} does for purgers. Read failures are logged and
 * answered with empty results.
 */
public final class FailedDeliveryManager {
  private static final Logger logger = Logger.getLogger(FailedDeliveryManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final Clock clock;

  public FailedDeliveryManager(ConnectionProvider connectionProvider, DeliveryStore deliveryStore) {
    this(connectionProvider, deliveryStore, Clock.systemUTC());
  }

  public FailedDeliveryManager(ConnectionProvider connectionProvider, DeliveryStore deliveryStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Queries exhausted deliveries, oldest first.
   *
   * @param endpointId optional endpoint filter ({@code null} for all)
   * @param limit      maximum number of rows to return
   */
  public List<WebhookDelivery> query(String endpointId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.queryByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, endpointId, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query exhausted deliveries", e);
      return List.of();
    }
  }

  /**
   * Counts exhausted deliveries.
   *
   * @param endpointId optional endpoint filter ({@code null} for all)
   */
  public int count(String endpointId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.countByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, endpointId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count exhausted deliveries", e);
      return 0;
    }
  }

  public Optional<WebhookDelivery> find(String deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.findById(conn, deliveryId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load delivery: " + deliveryId, e);
      return Optional.empty();
    }
  }

  /** All deliveries created for one event, one per subscribed endpoint. */
  public List<WebhookDelivery> history(String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.listByEvent(conn, eventId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list deliveries for event: " + eventId, e);
      return List.of();
    }
  }

  /**
   * Cancels a delivery that is waiting for its next attempt (PENDING or PENDING_RETRY).
   *
   * @return {@code true} if cancelled, {@code false} if not found, in flight or terminal
   */
  public boolean cancel(String deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean cancelled = deliveryStore.cancel(conn, deliveryId, clock.instant()) > 0;
      if (cancelled) {
        logger.log(Level.INFO, "Cancelled delivery {0}", deliveryId);
      }
      return cancelled;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to cancel delivery: " + deliveryId, e);
      return false;
    }
  }
}
