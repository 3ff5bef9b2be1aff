package io.relay.delivery;

import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;

import java.util.Objects;

/**
 * A claimed delivery waiting for a worker.
 *
 * @param delivery    the row as it reads after the claim (IN_FLIGHT, bumped version)
 * @param claimedFrom status before the claim, restored if the claim is handed back
 */
public record QueuedDelivery(WebhookDelivery delivery, DeliveryStatus claimedFrom) {
  public QueuedDelivery {
    Objects.requireNonNull(delivery, "delivery");
    Objects.requireNonNull(claimedFrom, "claimedFrom");
  }

  /** Status to return the row to when no attempt is made. */
  DeliveryStatus releaseStatus() {
    return claimedFrom == DeliveryStatus.PENDING ? DeliveryStatus.PENDING : DeliveryStatus.PENDING_RETRY;
  }
}
