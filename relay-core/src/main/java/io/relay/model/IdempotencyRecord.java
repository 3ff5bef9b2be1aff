package io.relay.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persistent state of one idempotency key within its scope.
 *
 * @param scope       owning principal plus request path
 * @param key         client-supplied idempotency key
 * @param requestHash fingerprint of the first request seen under this key
 * @param status      {@link IdempotencyStatus#LOCKED} while executing, then {@link IdempotencyStatus#COMPLETED}
 * @param lockToken   token of the current lock holder
 * @param response    stored response, {@code null} until completed
 * @param lockedAt    when the current holder took the lock
 * @param completedAt when the response was stored, {@code null} until completed
 * @param createdAt   when the key was first used
 * @param expiresAt   after this instant the record is treated as absent
 */
public record IdempotencyRecord(
    String scope,
    String key,
    String requestHash,
    IdempotencyStatus status,
    String lockToken,
    CachedResponse response,
    Instant lockedAt,
    Instant completedAt,
    Instant createdAt,
    Instant expiresAt) {

  public IdempotencyRecord {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(requestHash, "requestHash");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public static IdempotencyRecord locked(String scope, String key, String requestHash,
      String lockToken, Instant now, Duration ttl) {
    return new IdempotencyRecord(scope, key, requestHash, IdempotencyStatus.LOCKED,
        Objects.requireNonNull(lockToken, "lockToken"), null, now, null, now, now.plus(ttl));
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  /** A lock is stale once it has been held longer than the staleness window. */
  public boolean isStale(Instant now, Duration stalenessWindow) {
    return status == IdempotencyStatus.LOCKED
        && lockedAt != null
        && lockedAt.plus(stalenessWindow).isBefore(now);
  }
}
