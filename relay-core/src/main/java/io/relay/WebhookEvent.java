package io.relay;

import java.time.Instant;
import java.util.Objects;

/**
 * A business event to fan out to subscribed webhook endpoints.
 *
 * <p>{@code eventId} is the dedup key: publishing the same id twice never creates a
 * second delivery for an endpoint. {@code ownerId} restricts fan-out to one tenant's
 * endpoints; {@code null} targets every enabled endpoint.
 *
 * @param eventId     unique id of the originating business event
 * @param eventType   event type
 * @param ownerId     owning tenant, or {@code null}
 * @param payloadJson JSON body delivered as-is
 * @param occurredAt  when the business event happened
 */
public record WebhookEvent(
    String eventId,
    EventType eventType,
    String ownerId,
    String payloadJson,
    Instant occurredAt) {

  public WebhookEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if (eventId.isBlank()) {
      throw new IllegalArgumentException("eventId cannot be blank");
    }
  }

  public static WebhookEvent of(String eventId, EventType eventType, String ownerId, String payloadJson) {
    return new WebhookEvent(eventId, eventType, ownerId, payloadJson, Instant.now());
  }
}
