package io.relay.signature;

/**
 * Thrown when a webhook signature is missing, malformed, wrong or too old.
 *
 * <p>Verification failure is terminal for the request: the payload is neither stored
 * nor processed, and HTTP callers answer {@code 400}.
 */
public final class SignatureVerificationException extends RuntimeException {

  /** Why verification failed. */
  public enum Reason {
    /** No signature header was supplied. */
    MISSING,
    /** The header could not be parsed. */
    MALFORMED,
    /** No supplied signature matches the recomputed HMAC. */
    MISMATCH,
    /** The signature matches but its timestamp is outside the tolerance. */
    EXPIRED
  }

  private final Reason reason;

  public SignatureVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
