package io.relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An inbound webhook accepted from an external {@code source}. The pair
 * {@code (source, eventId)} is unique.
 */
public record IncomingWebhookEvent(
    String source,
    String eventId,
    String payload,
    IncomingEventStatus status,
    String errorMessage,
    Instant receivedAt,
    Instant processedAt) {

  public IncomingWebhookEvent {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  public static IncomingWebhookEvent received(String source, String eventId, String payload, Instant now) {
    return new IncomingWebhookEvent(source, eventId, payload, IncomingEventStatus.RECEIVED, null, now, null);
  }
}
