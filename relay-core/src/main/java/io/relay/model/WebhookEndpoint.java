package io.relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A tenant-owned outbound webhook target.
 *
 * <p>The {@code secret} signs every delivery. It leaves the registry only once, in the
 * result of {@link io.relay.registry.WebhookRegistry#register}; read paths expose
 * {@link EndpointSummary} instead.
 */
public record WebhookEndpoint(
    String id,
    String ownerId,
    String url,
    String secret,
    EventSubscription subscription,
    boolean enabled,
    String description,
    Instant createdAt,
    Instant updatedAt) {

  public WebhookEndpoint {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(subscription, "subscription");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public EndpointSummary toSummary() {
    return new EndpointSummary(id, ownerId, url, subscription, enabled, description, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "WebhookEndpoint[id=" + id + ", ownerId=" + ownerId + ", url=" + url
        + ", subscription=" + subscription.encode() + ", enabled=" + enabled + "]";
  }
}
