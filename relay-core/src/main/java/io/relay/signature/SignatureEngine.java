package io.relay.signature;

import io.relay.signature.SignatureVerificationException.Reason;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Timestamped HMAC-SHA256 signatures, shared by outbound delivery and inbound verification.
 *
 * <p>A signature header reads {@code t=<unix seconds>,v1=<hex digest>} where the digest is
 * {@code HMAC-SHA256(secret, "<t>.<payload>")}. Verification recomputes the digest,
 * compares it in constant time against every {@code v1} entry, and rejects timestamps
 * further than the tolerance from now, so a captured request cannot be replayed later.
 *
 * <p>This class is immutable and thread-safe.
 */
public final class SignatureEngine {
  public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(300);

  private static final String TIMESTAMP_KEY = "t";
  private static final String SIGNATURE_KEY = "v1";

  private final Clock clock;

  public SignatureEngine() {
    this(Clock.systemUTC());
  }

  public SignatureEngine(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Signs {@code payload} at the given unix timestamp.
   *
   * @return the signature header value
   */
  public String sign(String payload, String secret, long timestamp) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    String digest = Hmac.sha256Hex(secret, timestamp + "." + payload);
    return TIMESTAMP_KEY + "=" + timestamp + "," + SIGNATURE_KEY + "=" + digest;
  }

  /** Signs {@code payload} at the current time. */
  public String sign(String payload, String secret) {
    return sign(payload, secret, clock.instant().getEpochSecond());
  }

  /** Verifies with the default 300 second tolerance. */
  public boolean verify(String header, String payload, String secret) {
    return verify(header, payload, secret, DEFAULT_TOLERANCE);
  }

  /**
   * Returns whether {@code header} is a valid, fresh signature of {@code payload}.
   */
  public boolean verify(String header, String payload, String secret, Duration tolerance) {
    try {
      verifyOrThrow(header, payload, secret, tolerance);
      return true;
    } catch (SignatureVerificationException e) {
      return false;
    }
  }

  /**
   * Verifies {@code header} against {@code payload}.
   *
   * @throws SignatureVerificationException with the failure {@link Reason}
   */
  public void verifyOrThrow(String header, String payload, String secret, Duration tolerance) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(tolerance, "tolerance");
    if (header == null || header.isBlank()) {
      throw new SignatureVerificationException(Reason.MISSING, "Missing signature header");
    }

    Long timestamp = null;
    List<String> signatures = new ArrayList<>();
    for (String part : header.split(",")) {
      int eq = part.indexOf('=');
      if (eq <= 0) {
        throw new SignatureVerificationException(Reason.MALFORMED, "Malformed signature element");
      }
      String key = part.substring(0, eq).trim();
      String value = part.substring(eq + 1).trim();
      if (TIMESTAMP_KEY.equals(key)) {
        if (timestamp != null) {
          throw new SignatureVerificationException(Reason.MALFORMED, "Duplicate timestamp");
        }
        try {
          timestamp = Long.parseLong(value);
        } catch (NumberFormatException e) {
          throw new SignatureVerificationException(Reason.MALFORMED, "Timestamp is not a number");
        }
      } else if (SIGNATURE_KEY.equals(key)) {
        signatures.add(value);
      }
      // unknown schemes (v0, future versions) are ignored
    }
    if (timestamp == null || signatures.isEmpty()) {
      throw new SignatureVerificationException(Reason.MALFORMED, "Signature header needs t= and v1=");
    }

    String expected = Hmac.sha256Hex(secret, timestamp + "." + payload);
    boolean matched = false;
    for (String candidate : signatures) {
      // no early exit: every candidate is compared
      matched |= Hmac.constantTimeEquals(expected, candidate);
    }
    if (!matched) {
      throw new SignatureVerificationException(Reason.MISMATCH, "Signature does not match payload");
    }

    long now = clock.instant().getEpochSecond();
    long skew = tolerance.getSeconds();
    // compared against the window edges so a far-off timestamp cannot wrap around
    if (timestamp < now - skew || timestamp > now + skew) {
      throw new SignatureVerificationException(Reason.EXPIRED,
          "Signature timestamp outside tolerance of " + tolerance.getSeconds() + "s");
    }
  }
}
