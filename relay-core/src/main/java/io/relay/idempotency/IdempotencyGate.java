package io.relay.idempotency;

import io.relay.model.CachedResponse;
import io.relay.model.IdempotencyRecord;
import io.relay.model.IdempotencyStatus;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.IdempotencyStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.RelayStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a mutating request carrying an idempotency key may execute.
 *
 * <p>{@link #acquire} inserts a LOCKED record for {@code (scope, key)}. The insert winner
 * proceeds; everyone else reads the existing record and gets:
 * <ul>
 *   <li>{@link AcquireResult.Conflict} if the stored fingerprint differs (checked first),</li>
 *   <li>{@link AcquireResult.Replay} if the record is COMPLETED,</li>
 *   <li>{@link AcquireResult.Proceed} if the lock is older than the staleness window and
 *       this caller wins the compare-and-set that takes it over,</li>
 *   <li>{@link AcquireResult.Locked} otherwise.</li>
 * </ul>
 * A record past {@code expires_at} that the purge has not swept yet is deleted and the
 * insert retried, so an expired key behaves as unused.
 *
 * <p>All ownership decisions are conditional statements in the store; gates in different
 * processes sharing one database exclude each other. This class is thread-safe.
 *
 * @see IdempotencyGate.Builder
 */
public final class IdempotencyGate {
  private static final Logger logger = Logger.getLogger(IdempotencyGate.class.getName());

  private static final int MAX_ACQUIRE_ROUNDS = 3;

  private final ConnectionProvider connectionProvider;
  private final IdempotencyStore store;
  private final Duration ttl;
  private final Duration stalenessWindow;
  private final Clock clock;
  private final MetricsExporter metrics;

  private IdempotencyGate(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.ttl.isNegative() || builder.ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (builder.stalenessWindow.isNegative() || builder.stalenessWindow.isZero()) {
      throw new IllegalArgumentException("stalenessWindow must be positive");
    }
    if (builder.stalenessWindow.compareTo(builder.ttl) >= 0) {
      throw new IllegalArgumentException("stalenessWindow must be shorter than ttl");
    }
    this.ttl = builder.ttl;
    this.stalenessWindow = builder.stalenessWindow;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Attempts to take the key for this request.
   *
   * @param key         client-supplied idempotency key
   * @param scope       owning principal plus request path
   * @param requestHash fingerprint of the request, see {@link RequestFingerprint}
   * @return the gate decision
   * @throws RelayStoreException if the store is unavailable
   */
  public AcquireResult acquire(String key, String scope, String requestHash) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(requestHash, "requestHash");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key cannot be blank");
    }

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      for (int round = 0; round < MAX_ACQUIRE_ROUNDS; round++) {
        Instant now = clock.instant();
        String token = UUID.randomUUID().toString();
        if (store.insertLocked(conn, IdempotencyRecord.locked(scope, key, requestHash, token, now, ttl))) {
          metrics.incrementIdempotencyProceed();
          return new AcquireResult.Proceed(new LockToken(scope, key, token));
        }

        Optional<IdempotencyRecord> existing = store.find(conn, scope, key);
        if (existing.isEmpty()) {
          // released between our insert and read
          continue;
        }
        IdempotencyRecord record = existing.get();
        if (record.isExpired(now)) {
          store.deleteExpired(conn, scope, key, now);
          continue;
        }
        if (!record.requestHash().equals(requestHash)) {
          metrics.incrementIdempotencyConflict();
          return AcquireResult.CONFLICT;
        }
        if (record.status() == IdempotencyStatus.COMPLETED) {
          metrics.incrementIdempotencyReplay();
          return new AcquireResult.Replay(record.response());
        }
        if (record.isStale(now, stalenessWindow)
            && store.stealLock(conn, scope, key, record.lockToken(), token, now)) {
          logger.log(Level.WARNING, "Took over stale idempotency lock scope={0} key={1} lockedAt={2}",
              new Object[]{scope, key, record.lockedAt()});
          metrics.incrementIdempotencyProceed();
          return new AcquireResult.Proceed(new LockToken(scope, key, token));
        }
        metrics.incrementIdempotencyLocked();
        return AcquireResult.LOCKED;
      }
      // the row kept changing under us; let the client come back
      metrics.incrementIdempotencyLocked();
      return AcquireResult.LOCKED;
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to acquire idempotency key " + key, e);
    }
  }

  /**
   * Stores the response for a key this caller still holds and marks it COMPLETED.
   *
   * @return {@code false} if the lock was lost (taken over as stale, or expired)
   */
  public boolean complete(LockToken lockToken, CachedResponse response) {
    Objects.requireNonNull(lockToken, "lockToken");
    Objects.requireNonNull(response, "response");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean stored = store.complete(conn, lockToken.scope(), lockToken.key(),
          lockToken.token(), response, clock.instant());
      if (!stored) {
        logger.log(Level.WARNING, "Idempotency lock lost before completion scope={0} key={1}",
            new Object[]{lockToken.scope(), lockToken.key()});
      }
      return stored;
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to complete idempotency key " + lockToken.key(), e);
    }
  }

  /**
   * Deletes the record of a failed execution so the client can retry cleanly.
   *
   * @return {@code false} if the lock was no longer held by this token
   */
  public boolean release(LockToken lockToken) {
    Objects.requireNonNull(lockToken, "lockToken");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.release(conn, lockToken.scope(), lockToken.key(), lockToken.token());
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to release idempotency key " + lockToken.key(), e);
    }
  }

  /**
   * Runs {@code action} at most once per {@code (scope, key)}.
   *
   * <p>Responses with a status below 500 are stored and replayed to later callers.
   * A 5xx response or an exception from {@code action} releases the key instead, so the
   * client's retry executes again.
   *
   * @return the response and whether it was replayed
   * @throws IdempotencyConflictException if the key was used for a different request
   * @throws IdempotencyLockedException   if the key is held by a running execution
   */
  public IdempotentResult execute(String key, String scope, String requestHash,
      Supplier<CachedResponse> action) {
    Objects.requireNonNull(action, "action");
    AcquireResult result = acquire(key, scope, requestHash);
    if (result instanceof AcquireResult.Replay replay) {
      return new IdempotentResult(replay.response(), true);
    }
    if (result instanceof AcquireResult.Conflict) {
      throw new IdempotencyConflictException(key);
    }
    if (result instanceof AcquireResult.Locked) {
      throw new IdempotencyLockedException(key);
    }
    LockToken lockToken = ((AcquireResult.Proceed) result).lockToken();

    CachedResponse response;
    try {
      response = action.get();
    } catch (RuntimeException | Error e) {
      releaseAfterFailure(lockToken, e);
      throw e;
    }
    if (response == null) {
      releaseAfterFailure(lockToken, null);
      throw new NullPointerException("action returned null response");
    }
    if (response.status() >= 500) {
      releaseAfterFailure(lockToken, null);
    } else {
      complete(lockToken, response);
    }
    return new IdempotentResult(response, false);
  }

  private void releaseAfterFailure(LockToken lockToken, Throwable failure) {
    try {
      release(lockToken);
    } catch (RuntimeException e) {
      if (failure != null) {
        failure.addSuppressed(e);
      } else {
        logger.log(Level.SEVERE, "Failed to release idempotency key " + lockToken.key(), e);
      }
    }
  }

  /** Builder for {@link IdempotencyGate}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private IdempotencyStore store;
    private Duration ttl = Duration.ofHours(24);
    private Duration stalenessWindow = Duration.ofSeconds(30);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the connection provider used for every gate operation.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the idempotency record store.
     *
     * <p><b>Required.</b>
     *
     * @param store the persistence backend
     * @return this builder
     */
    public Builder store(IdempotencyStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets how long a key is remembered after first use.
     *
     * <p>Optional. Defaults to {@code 24 hours}. Must be positive.
     *
     * @param ttl record lifetime
     * @return this builder
     */
    public Builder ttl(Duration ttl) {
      this.ttl = Objects.requireNonNull(ttl, "ttl");
      return this;
    }

    /**
     * Sets how long a LOCKED record may be held before it is treated as abandoned.
     *
     * <p>Optional. Defaults to {@code 30 seconds}. Must be positive and shorter than the TTL.
     *
     * @param stalenessWindow maximum lock age
     * @return this builder
     */
    public Builder stalenessWindow(Duration stalenessWindow) {
      this.stalenessWindow = Objects.requireNonNull(stalenessWindow, "stalenessWindow");
      return this;
    }

    /**
     * Sets the clock. Optional; defaults to the UTC system clock.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional; defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the gate.
     *
     * @return a new {@link IdempotencyGate}
     * @throws NullPointerException     if {@code connectionProvider} or {@code store} is null
     * @throws IllegalArgumentException if the TTL or staleness window is not positive, or the
     *                                  window is not shorter than the TTL
     */
    public IdempotencyGate build() {
      return new IdempotencyGate(this);
    }
  }
}
