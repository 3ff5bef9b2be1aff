package io.relay.idempotency;

import io.relay.model.CachedResponse;

import java.util.Objects;

/**
 * Decision returned by {@link IdempotencyGate#acquire}.
 *
 * <ul>
 *   <li>{@link Proceed}: the caller holds the lock and must execute, then
 *       {@link IdempotencyGate#complete complete} or {@link IdempotencyGate#release release}.</li>
 *   <li>{@link Replay}: the request already completed; return the cached response.</li>
 *   <li>{@link Conflict}: the key was used for a different request; never execute.</li>
 *   <li>{@link Locked}: another executor holds the key; the client should retry later.</li>
 * </ul>
 */
public sealed interface AcquireResult
    permits AcquireResult.Proceed, AcquireResult.Replay, AcquireResult.Conflict, AcquireResult.Locked {

  Conflict CONFLICT = new Conflict();
  Locked LOCKED = new Locked();

  record Proceed(LockToken lockToken) implements AcquireResult {
    public Proceed {
      Objects.requireNonNull(lockToken, "lockToken");
    }
  }

  record Replay(CachedResponse response) implements AcquireResult {
    public Replay {
      Objects.requireNonNull(response, "response");
    }
  }

  record Conflict() implements AcquireResult {
  }

  record Locked() implements AcquireResult {
  }
}
