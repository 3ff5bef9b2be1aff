package io.relay.model;

import java.time.Instant;

/**
 * Read view of a {@link WebhookEndpoint} without its signing secret.
 */
public record EndpointSummary(
    String id,
    String ownerId,
    String url,
    EventSubscription subscription,
    boolean enabled,
    String description,
    Instant createdAt,
    Instant updatedAt) {
}
