package io.relay.idempotency;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Deterministic SHA-256 digest of a request's method, path and body, used to detect an
 * idempotency key reused for a different operation.
 */
public final class RequestFingerprint {

  private RequestFingerprint() {
  }

  public static String of(String method, String path, String body) {
    return of(method, path, body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @return lowercase hex SHA-256 of {@code METHOD \n path \n body}
   */
  public static String of(String method, String path, byte[] body) {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    MessageDigest digest = sha256();
    digest.update(method.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    digest.update((byte) '\n');
    digest.update(path.getBytes(StandardCharsets.UTF_8));
    digest.update((byte) '\n');
    if (body != null) {
      digest.update(body);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
