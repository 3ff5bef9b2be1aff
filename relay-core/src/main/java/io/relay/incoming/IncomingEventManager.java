package io.relay.incoming;

import io.relay.model.IncomingEventStatus;
import io.relay.model.IncomingWebhookEvent;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.IncomingEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade over inbound events whose processing failed.
 *
 * <p>ERROR events are never retried automatically. {@link #retry} moves one back to
 * RECEIVED and submits it to the gateway's processing pool again.
 */
public final class IncomingEventManager {
  private static final Logger logger = Logger.getLogger(IncomingEventManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final IncomingEventStore store;
  private final IncomingWebhookGateway gateway;

  public IncomingEventManager(ConnectionProvider connectionProvider, IncomingEventStore store,
      IncomingWebhookGateway gateway) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  /**
   * Lists ERROR events, oldest first.
   *
   * @param source optional source filter ({@code null} for all)
   * @param limit  maximum number of events to return
   */
  public List<IncomingWebhookEvent> listErrors(String source, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.queryByStatus(conn, IncomingEventStatus.ERROR, source, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query failed inbound events", e);
      return List.of();
    }
  }

  public int countErrors(String source) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.countByStatus(conn, IncomingEventStatus.ERROR, source);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count failed inbound events", e);
      return 0;
    }
  }

  public Optional<IncomingWebhookEvent> find(String source, String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.find(conn, source, eventId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load inbound event " + source + "/" + eventId, e);
      return Optional.empty();
    }
  }

  /**
   * Re-submits an ERROR event for processing.
   *
   * @return {@code true} if the event was in ERROR and has been re-submitted
   */
  public boolean retry(String source, String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (!store.transition(conn, source, eventId, IncomingEventStatus.ERROR, IncomingEventStatus.RECEIVED)) {
        return false;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to reset inbound event " + source + "/" + eventId, e);
      return false;
    }
    logger.log(Level.INFO, "Re-submitting inbound event {0}/{1}", new Object[]{source, eventId});
    gateway.submit(source, eventId);
    return true;
  }

  /**
   * Processes events left in RECEIVED, for instance after a crash between storing and
   * processing. PROCESSING events whose claim outlived the processing lease are released
   * and processed too.
   *
   * @return the number of events processed
   */
  public int recoverReceived(int limit) {
    return gateway.processReceived(limit);
  }
}
