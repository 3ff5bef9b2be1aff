package io.relay.idempotency;

import java.util.Objects;

/**
 * Proof of holding the lock on an idempotency key, handed out by
 * {@link IdempotencyGate#acquire} and required to complete or release it.
 */
public record LockToken(String scope, String key, String token) {
  public LockToken {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(token, "token");
  }
}
