package io.relay.spi;

import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for the outbound delivery queue ({@code webhook_deliveries}).
 *
 * <p>Transitions out of IN_FLIGHT take the {@code version} the caller holds from its
 * claim and return the number of rows changed; {@code 0} means another worker reclaimed
 * the row after the lease expired and the caller's result is discarded.
 *
 * @see io.relay.delivery.DeliveryPoller
 * @see io.relay.delivery.DeliveryDispatcher
 */
public interface DeliveryStore {

    /**
     * Inserts a PENDING delivery unless one exists for {@code (endpointId, eventId)}.
     *
     * @return {@code true} if the row was created
     */
    boolean insertPending(Connection conn, WebhookDelivery delivery);

    /**
     * Selects claim candidates, oldest due first: PENDING and PENDING_RETRY rows with
     * {@code next_attempt_at <= now}, plus IN_FLIGHT rows claimed before {@code leaseExpiry}.
     * Rows whose endpoint is disabled are excluded.
     */
    List<WebhookDelivery> findDue(Connection conn, Instant now, Instant leaseExpiry, int limit);

    /**
     * Moves a row to IN_FLIGHT if its version is still {@code expectedVersion}.
     *
     * @return {@code true} if this caller now owns the delivery
     */
    boolean claim(Connection conn, String deliveryId, long expectedVersion, Instant now);

    /**
     * Returns an IN_FLIGHT row to {@code status} without touching attempts or
     * {@code next_attempt_at}.
     */
    int release(Connection conn, String deliveryId, long version, DeliveryStatus status, Instant now);

    /**
     * Increments attempts and moves the row to DELIVERED. Like every mark method, only
     * applies while the row is IN_FLIGHT at {@code version}.
     *
     * @return the number of rows updated; {@code 0} means the claim was lost
     */
    int markDelivered(Connection conn, String deliveryId, long version,
        int responseStatus, String responseBody, Instant now);

    /** Increments attempts and schedules the next attempt. */
    int markRetry(Connection conn, String deliveryId, long version, Instant nextAttemptAt,
        Integer responseStatus, String responseBody, String error, Instant now);

    /** Increments attempts and moves the row to FAILED_EXHAUSTED. */
    int markExhausted(Connection conn, String deliveryId, long version,
        Integer responseStatus, String responseBody, String error, Instant now);

    /**
     * Cancels a PENDING or PENDING_RETRY delivery.
     *
     * @return the number of rows updated
     */
    int cancel(Connection conn, String deliveryId, Instant now);

    Optional<WebhookDelivery> findById(Connection conn, String deliveryId);

    List<WebhookDelivery> listByEvent(Connection conn, String eventId);

    /**
     * Queries deliveries in {@code status}, oldest first, optionally for one endpoint.
     */
    List<WebhookDelivery> queryByStatus(Connection conn, DeliveryStatus status, String endpointId, int limit);

    int countByStatus(Connection conn, DeliveryStatus status, String endpointId);
}
