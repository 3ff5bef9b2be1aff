package io.relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One outbound delivery of one event to one endpoint. {@code (endpointId, eventId)} is unique.
 *
 * <p>{@code version} is bumped by every state transition; stores update a row only when
 * the caller presents the version it read, so two workers can never both own a delivery.
 *
 * @param id                 delivery id
 * @param endpointId         target endpoint
 * @param eventId            originating business event id (dedup key)
 * @param eventType          event type name
 * @param payload            JSON body sent to the endpoint
 * @param status             current state
 * @param attempts           completed send attempts, never decreases
 * @param nextAttemptAt      earliest next attempt; meaningful in PENDING and PENDING_RETRY only
 * @param lastResponseStatus HTTP status of the last attempt, {@code null} if none was received
 * @param lastResponseBody   truncated body of the last response
 * @param lastError          transport error or failure reason of the last attempt
 * @param version            optimistic lock version
 * @param claimedAt          when the current IN_FLIGHT claim was taken
 * @param createdAt          creation time
 * @param updatedAt          last transition time
 * @param deliveredAt        when a 2xx was received
 */
public record WebhookDelivery(
    String id,
    String endpointId,
    String eventId,
    String eventType,
    String payload,
    DeliveryStatus status,
    int attempts,
    Instant nextAttemptAt,
    Integer lastResponseStatus,
    String lastResponseBody,
    String lastError,
    long version,
    Instant claimedAt,
    Instant createdAt,
    Instant updatedAt,
    Instant deliveredAt) {

  public WebhookDelivery {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(endpointId, "endpointId");
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  public static WebhookDelivery pending(String id, String endpointId, String eventId,
      String eventType, String payload, Instant now) {
    return new WebhookDelivery(id, endpointId, eventId, eventType, payload,
        DeliveryStatus.PENDING, 0, now, null, null, null, 0L, null, now, now, null);
  }

  /** The same delivery as it reads after a successful claim at {@code now}. */
  public WebhookDelivery claimed(Instant now) {
    return new WebhookDelivery(id, endpointId, eventId, eventType, payload,
        DeliveryStatus.IN_FLIGHT, attempts, nextAttemptAt, lastResponseStatus, lastResponseBody,
        lastError, version + 1, now, createdAt, now, deliveredAt);
  }
}
