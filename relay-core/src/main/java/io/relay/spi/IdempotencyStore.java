package io.relay.spi;

import io.relay.model.CachedResponse;
import io.relay.model.IdempotencyRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence SPI for idempotency records ({@code idempotency_keys}).
 *
 * <p>Every mutating method is a single conditional statement: it applies only when the
 * row is still in the state the caller observed, and reports whether it did. Lock
 * ownership is decided by these compare-and-set results, never by in-process locks.
 *
 * @see io.relay.idempotency.IdempotencyGate
 */
public interface IdempotencyStore {

    /**
     * Inserts a LOCKED record unless one already exists for {@code (scope, key)}.
     *
     * @return {@code true} if this call created the record
     */
    boolean insertLocked(Connection conn, IdempotencyRecord record);

    Optional<IdempotencyRecord> find(Connection conn, String scope, String key);

    /**
     * Replaces the lock token of a LOCKED record still held by {@code expectedLockToken}.
     *
     * @return {@code true} if the lock was taken over
     */
    boolean stealLock(Connection conn, String scope, String key, String expectedLockToken,
        String newLockToken, Instant now);

    /**
     * Stores the response and moves the record to COMPLETED, provided it is still LOCKED
     * by {@code lockToken}.
     *
     * @return {@code true} if the response was stored
     */
    boolean complete(Connection conn, String scope, String key, String lockToken,
        CachedResponse response, Instant now);

    /**
     * Deletes a LOCKED record still held by {@code lockToken}.
     *
     * @return {@code true} if the record was deleted
     */
    boolean release(Connection conn, String scope, String key, String lockToken);

    /**
     * Deletes the record for {@code (scope, key)} if it expired at or before {@code now}.
     *
     * @return {@code true} if an expired record was removed
     */
    boolean deleteExpired(Connection conn, String scope, String key, Instant now);
}
