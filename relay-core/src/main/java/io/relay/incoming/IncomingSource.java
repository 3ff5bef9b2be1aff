package io.relay.incoming;

import io.relay.signature.SignatureVerifier;
import io.relay.signature.TimestampedSignatureVerifier;

import java.util.Objects;

/**
 * A configured external sender of webhooks.
 *
 * @param name            path segment identifying the source
 * @param secret          shared signing secret
 * @param verifier        signature scheme used by this source
 * @param eventIdExtractor how to find the sender's event id in the body
 */
public record IncomingSource(
    String name,
    String secret,
    SignatureVerifier verifier,
    EventIdExtractor eventIdExtractor) {

  public IncomingSource {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(verifier, "verifier");
    Objects.requireNonNull(eventIdExtractor, "eventIdExtractor");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    if (secret.isEmpty()) {
      throw new IllegalArgumentException("secret cannot be empty");
    }
  }

  /**
   * Source signing with {@code t=<ts>,v1=<hex>} headers and carrying its id in {@code "id"}.
   */
  public static IncomingSource of(String name, String secret) {
    return new IncomingSource(name, secret, new TimestampedSignatureVerifier(), new JsonFieldEventIdExtractor());
  }

  @Override
  public String toString() {
    return "IncomingSource[name=" + name + "]";
  }
}
