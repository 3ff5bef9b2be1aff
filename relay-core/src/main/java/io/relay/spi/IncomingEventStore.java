package io.relay.spi;

import io.relay.model.IncomingEventStatus;
import io.relay.model.IncomingWebhookEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for the inbound dedup table ({@code webhook_events}).
 *
 * @see io.relay.incoming.IncomingWebhookGateway
 */
public interface IncomingEventStore {

    /**
     * Inserts a RECEIVED row unless {@code (source, eventId)} is already stored.
     *
     * @return {@code true} if this call created the row
     */
    boolean insertReceived(Connection conn, IncomingWebhookEvent event);

    /**
     * Moves a row from {@code from} to {@code to}, clearing the error message.
     *
     * @return {@code true} if the row was in {@code from}
     */
    boolean transition(Connection conn, String source, String eventId,
        IncomingEventStatus from, IncomingEventStatus to);

    /**
     * Moves a RECEIVED row to PROCESSING and stamps {@code claimed_at} with {@code now}.
     *
     * @return {@code true} if this call took the row
     */
    boolean claim(Connection conn, String source, String eventId, Instant now);

    /**
     * Returns PROCESSING rows claimed before {@code claimedBefore} (or never stamped) to
     * RECEIVED, so a worker that died mid-processing does not strand them.
     *
     * @return the number of rows reset
     */
    int releaseStalled(Connection conn, Instant claimedBefore);

    boolean markProcessed(Connection conn, String source, String eventId, Instant now);

    boolean markError(Connection conn, String source, String eventId, String errorMessage, Instant now);

    Optional<IncomingWebhookEvent> find(Connection conn, String source, String eventId);

    /**
     * Queries events in {@code status}, oldest first, optionally for one source.
     */
    List<IncomingWebhookEvent> queryByStatus(Connection conn, IncomingEventStatus status, String source, int limit);

    int countByStatus(Connection conn, IncomingEventStatus status, String source);
}
