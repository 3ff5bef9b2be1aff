package io.relay.model;

/**
 * Lifecycle of an outbound webhook delivery.
 *
 * <pre>
 * PENDING -&gt; IN_FLIGHT -&gt; DELIVERED
 *                      -&gt; PENDING_RETRY -&gt; IN_FLIGHT -&gt; ... -&gt; FAILED_EXHAUSTED
 * PENDING | PENDING_RETRY -&gt; CANCELLED
 * </pre>
 */
public enum DeliveryStatus {
  PENDING(0, false),
  IN_FLIGHT(1, false),
  DELIVERED(2, true),
  PENDING_RETRY(3, false),
  FAILED_EXHAUSTED(4, true),
  CANCELLED(5, true);

  private final int code;
  private final boolean terminal;

  DeliveryStatus(int code, boolean terminal) {
    this.code = code;
    this.terminal = terminal;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
