package io.relay.idempotency;

/**
 * The idempotency key was already used for a request with a different fingerprint.
 * Surfaced as HTTP 422; the operation is never executed.
 */
public final class IdempotencyConflictException extends RuntimeException {
  public static final int HTTP_STATUS = 422;
  public static final String ERROR_CODE = "idempotency_key_reused";

  private final String key;

  public IdempotencyConflictException(String key) {
    super("Idempotency key reused with different request parameters: " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
