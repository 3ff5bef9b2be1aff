package io.relay.delivery;

/**
 * A delivery attempt failed in a way worth retrying: timeout, network error or a
 * non-2xx response. Recorded on the delivery row; never raised to the event producer.
 */
public final class TransientDeliveryException extends Exception {
  private final Integer responseStatus;

  public TransientDeliveryException(String message, Integer responseStatus, Throwable cause) {
    super(message, cause);
    this.responseStatus = responseStatus;
  }

  public static TransientDeliveryException ofStatus(int responseStatus) {
    return new TransientDeliveryException("Endpoint responded with HTTP " + responseStatus, responseStatus, null);
  }

  /** HTTP status if a response was received, else {@code null}. */
  public Integer responseStatus() {
    return responseStatus;
  }
}
