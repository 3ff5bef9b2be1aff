package io.relay.idempotency;

import io.relay.model.CachedResponse;

/**
 * Outcome of {@link IdempotencyGate#execute}: the response and whether it was replayed
 * from an earlier execution.
 */
public record IdempotentResult(CachedResponse response, boolean replayed) {
}
