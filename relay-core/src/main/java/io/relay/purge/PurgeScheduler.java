package io.relay.purge;

import io.relay.spi.ConnectionProvider;
import io.relay.spi.Purger;
import io.relay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic retention sweep over one relay table.
 *
 * <p>A relay node runs one scheduler per table it owns:
 * <ul>
 *   <li>idempotency keys, retention {@link Duration#ZERO}: the cutoff is now and the purger
 *       matches rows whose {@code expires_at} has passed;</li>
 *   <li>deliveries, default 30 days: DELIVERED, FAILED_EXHAUSTED and CANCELLED rows whose
 *       last update is older than the cutoff;</li>
 *   <li>inbound events, default 30 days: PROCESSED rows processed before the cutoff. ERROR
 *       rows wait for an operator.</li>
 * </ul>
 *
 * <p>A sweep deletes in batches, each on its own auto-committed connection, until a batch
 * comes back short or {@link Builder#maxBatchesPerRun} is reached. Whatever is left waits
 * for the next interval. Failures end the sweep early and are logged; the schedule keeps
 * running.
 *
 * @see PurgeScheduler.Builder
 */
public final class PurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Purger purger;
  private final Duration retention;
  private final int batchSize;
  private final int maxBatchesPerRun;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService sweeper;
  private volatile ScheduledFuture<?> sweep;
  private volatile boolean closed;

  private PurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    this.retention = Objects.requireNonNull(builder.retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.maxBatchesPerRun <= 0) {
      throw new IllegalArgumentException("maxBatchesPerRun must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.maxBatchesPerRun = builder.maxBatchesPerRun;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules the sweep every {@code intervalSeconds}, first run one interval from now.
   * Calling it again while scheduled does nothing.
   *
   * @throws IllegalStateException if the scheduler was closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PurgeScheduler has been closed");
    }
    if (sweep != null) {
      return;
    }
    sweeper = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("relay-purge-" + purger.name() + "-"));
    sweep = sweeper.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one sweep on the calling thread.
   *
   * @return rows deleted by this sweep, {@code 0} once closed
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(retention);
    long swept = 0;
    int batches = 0;
    int deleted = 0;
    try {
      do {
        deleted = deleteBatch(cutoff);
        swept += deleted;
        batches++;
      } while (deleted == batchSize && batches < maxBatchesPerRun);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Sweep of " + purger.name() + " stopped after " + swept + " rows", e);
      return swept;
    }

    if (swept > 0) {
      logger.log(Level.INFO, "Swept {0} rows from {1} in {2} batches, cutoff {3}",
          new Object[]{swept, purger.name(), batches, describe(cutoff)});
    } else {
      logger.log(Level.FINE, "Nothing to sweep from {0}, cutoff {1}",
          new Object[]{purger.name(), describe(cutoff)});
    }
    if (deleted == batchSize && batches == maxBatchesPerRun) {
      logger.log(Level.WARNING, "Sweep of {0} hit {1} batches; the rest waits for the next run",
          new Object[]{purger.name(), maxBatchesPerRun});
    }
    return swept;
  }

  private int deleteBatch(Instant cutoff) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    }
  }

  private String describe(Instant cutoff) {
    return retention.isZero() ? "expired before " + cutoff : cutoff + " (retention " + retention + ")";
  }

  /** Cancels the schedule. A sweep in progress is interrupted. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweep != null) {
      sweep.cancel(false);
      sweep = null;
    }
    if (sweeper != null) {
      sweeper.shutdownNow();
      try {
        sweeper.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link PurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Purger purger;
    private Duration retention = Duration.ofDays(30);
    private int batchSize = 500;
    private int maxBatchesPerRun = 1000;
    private long intervalSeconds = 3600;
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> The table-specific delete. */
    public Builder purger(Purger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Age a row must reach before it is swept. Use {@link Duration#ZERO} for tables whose
     * rows carry their own expiry, such as idempotency keys.
     *
     * <p>Defaults to 30 days.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /** Rows deleted per statement. Defaults to 500. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Upper bound on batches in one sweep, so a large backlog is worked off over several
     * runs. Defaults to 1000.
     */
    public Builder maxBatchesPerRun(int maxBatchesPerRun) {
      this.maxBatchesPerRun = maxBatchesPerRun;
      return this;
    }

    /** Delay between sweeps. Defaults to one hour. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /** Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException     if the connection provider, purger or retention is null
     * @throws IllegalArgumentException if a limit or the retention is out of range
     */
    public PurgeScheduler build() {
      return new PurgeScheduler(this);
    }
  }
}
