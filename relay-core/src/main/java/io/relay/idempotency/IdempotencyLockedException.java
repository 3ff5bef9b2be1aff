package io.relay.idempotency;

/**
 * A request with the same idempotency key is still executing. Surfaced as HTTP 409;
 * the client should retry later.
 */
public final class IdempotencyLockedException extends RuntimeException {
  public static final int HTTP_STATUS = 409;
  public static final String ERROR_CODE = "idempotency_request_in_progress";

  private final String key;

  public IdempotencyLockedException(String key) {
    super("Request with idempotency key is already in progress: " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
