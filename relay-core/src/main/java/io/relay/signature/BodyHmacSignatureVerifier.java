package io.relay.signature;

import io.relay.signature.SignatureVerificationException.Reason;

/**
 * Verifies a bare hex HMAC-SHA256 of the raw body, optionally prefixed with
 * {@code sha256=} (the form used by GitHub-style senders).
 *
 * <p>This scheme carries no timestamp, so it offers no replay protection beyond
 * the inbound dedup on event id.
 */
public final class BodyHmacSignatureVerifier implements SignatureVerifier {
  private static final String PREFIX = "sha256=";

  @Override
  public void verify(String rawBody, String signatureHeader, String secret) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new SignatureVerificationException(Reason.MISSING, "Missing signature header");
    }
    String candidate = signatureHeader.trim();
    if (candidate.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      candidate = candidate.substring(PREFIX.length());
    }
    if (candidate.isEmpty()) {
      throw new SignatureVerificationException(Reason.MALFORMED, "Empty signature");
    }
    String expected = Hmac.sha256Hex(secret, rawBody);
    if (!Hmac.constantTimeEquals(expected, candidate)) {
      throw new SignatureVerificationException(Reason.MISMATCH, "Signature does not match payload");
    }
  }
}
