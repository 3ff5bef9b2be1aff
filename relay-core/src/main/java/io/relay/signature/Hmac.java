package io.relay.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

final class Hmac {
  static final String ALGORITHM = "HmacSHA256";

  private Hmac() {
  }

  static String sha256Hex(String secret, String message) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      // HmacSHA256 is mandatory on every JRE
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }

  /** Compares two hex digests without short-circuiting on the first differing byte. */
  static boolean constantTimeEquals(String expectedHex, String actualHex) {
    if (expectedHex == null || actualHex == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expectedHex.toLowerCase().getBytes(StandardCharsets.US_ASCII),
        actualHex.toLowerCase().getBytes(StandardCharsets.US_ASCII));
  }
}
