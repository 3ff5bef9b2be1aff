package io.relay.spi;

import io.relay.model.WebhookEndpoint;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for webhook endpoints ({@code webhook_endpoints}).
 *
 * @see io.relay.registry.WebhookRegistry
 */
public interface EndpointStore {

    void insert(Connection conn, WebhookEndpoint endpoint);

    Optional<WebhookEndpoint> findById(Connection conn, String endpointId);

    List<WebhookEndpoint> listByOwner(Connection conn, String ownerId);

    /**
     * Lists enabled endpoints, restricted to one owner unless {@code ownerId} is {@code null}.
     */
    List<WebhookEndpoint> listEnabled(Connection conn, String ownerId);

    /**
     * @return the number of rows updated (0 if the endpoint does not exist)
     */
    int setEnabled(Connection conn, String endpointId, boolean enabled, Instant now);

    /**
     * @return the number of rows updated (0 if the endpoint does not exist)
     */
    int updateSecret(Connection conn, String endpointId, String secret, Instant now);
}
