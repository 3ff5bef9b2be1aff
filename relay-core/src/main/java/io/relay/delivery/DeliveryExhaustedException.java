package io.relay.delivery;

/**
 * A delivery failed on its last allowed attempt and was moved to FAILED_EXHAUSTED.
 * Its message is the recorded reason shown in the failed-delivery view.
 */
public final class DeliveryExhaustedException extends Exception {
  private final String deliveryId;
  private final int attempts;

  public DeliveryExhaustedException(String deliveryId, int attempts, TransientDeliveryException lastFailure) {
    super("Delivery " + deliveryId + " exhausted after " + attempts + " attempts: "
        + lastFailure.getMessage(), lastFailure);
    this.deliveryId = deliveryId;
    this.attempts = attempts;
  }

  public String deliveryId() {
    return deliveryId;
  }

  public int attempts() {
    return attempts;
  }
}
