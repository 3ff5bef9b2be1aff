package io.relay.signature;

import java.time.Duration;
import java.util.Objects;

/**
 * Verifies {@code t=<ts>,v1=<hex>} headers through a {@link SignatureEngine}.
 */
public final class TimestampedSignatureVerifier implements SignatureVerifier {
  private final SignatureEngine engine;
  private final Duration tolerance;

  public TimestampedSignatureVerifier() {
    this(new SignatureEngine(), SignatureEngine.DEFAULT_TOLERANCE);
  }

  public TimestampedSignatureVerifier(SignatureEngine engine, Duration tolerance) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    if (tolerance.isNegative()) {
      throw new IllegalArgumentException("tolerance must be >= 0");
    }
  }

  @Override
  public void verify(String rawBody, String signatureHeader, String secret) {
    engine.verifyOrThrow(signatureHeader, rawBody, secret, tolerance);
  }
}
