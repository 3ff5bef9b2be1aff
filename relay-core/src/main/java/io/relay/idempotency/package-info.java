/**
 * Idempotency keys for mutating requests.
 *
 * <p>{@link io.relay.idempotency.IdempotencyGate#acquire} answers with one of the
 * {@link io.relay.idempotency.AcquireResult} variants. The caller that gets
 * {@code Proceed} runs the operation and then either completes the key with the response to
 * replay or releases it so a retry can run again.
 *
 * @see io.relay.idempotency.IdempotencyGate
 * @see io.relay.idempotency.RequestFingerprint
 */
package io.relay.idempotency;
