/**
 * Scheduled removal of expired idempotency keys and old terminal rows.
 *
 * <p>{@link io.relay.purge.PurgeScheduler} runs a {@link io.relay.spi.Purger} in batches until a
 * batch comes back short, so large backlogs never hold long-running locks.
 *
 * @see io.relay.purge.PurgeScheduler
 */
package io.relay.purge;
