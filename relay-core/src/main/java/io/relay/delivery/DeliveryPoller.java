package io.relay.delivery;

import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.DeliveryStore;
import io.relay.spi.MetricsExporter;
import io.relay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled scanner that claims due deliveries and hands them to a {@link DeliveryHandler}.
 *
 * <p>A delivery is due when it is PENDING or PENDING_RETRY with {@code next_attempt_at <= now}
 * and its endpoint is enabled, or when it is IN_FLIGHT with a claim older than the lease
 * (its worker died mid-attempt). Each row is taken with a version compare-and-set, so
 * pollers in several processes never hand the same attempt to two workers.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 *
 * @see DeliveryPoller.Builder
 */
public final class DeliveryPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryPoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final DeliveryStore deliveryStore;
    private final DeliveryHandler handler;
    private final int batchSize;
    private final long intervalMs;
    private final Duration claimLease;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private DeliveryPoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
        this.handler = Objects.requireNonNull(builder.handler, "handler");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.claimLease.isNegative() || builder.claimLease.isZero()) {
            throw new IllegalArgumentException("claimLease must be positive");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.claimLease = builder.claimLease;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DeliveryPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single poll cycle. Called by the scheduler, and directly by tests.
     *
     * @return number of deliveries handed to the handler
     */
    public int poll() {
        if (closed) {
            return 0;
        }
        try {
            int capacity = handler.availableCapacity();
            if (capacity <= 0) {
                return 0;
            }
            Instant now = clock.instant();
            List<WebhookDelivery> due = fetchDue(now, Math.min(batchSize, capacity));
            if (due == null) {
                return 0;
            }
            if (due.isEmpty()) {
                metrics.recordOldestLagMs(0);
                return 0;
            }
            metrics.recordOldestLagMs(Math.max(0L, Duration.between(oldestDueAt(due), now).toMillis()));
            return claimAndDispatch(due, now);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
            return 0;
        }
    }

    private List<WebhookDelivery> fetchDue(Instant now, int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return deliveryStore.findDue(conn, now, now.minus(claimLease), limit);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to fetch due deliveries", e);
            return null;
        }
    }

    private static Instant oldestDueAt(List<WebhookDelivery> rows) {
        Instant oldest = null;
        for (WebhookDelivery row : rows) {
            Instant dueAt = row.nextAttemptAt() != null ? row.nextAttemptAt() : row.createdAt();
            if (oldest == null || dueAt.isBefore(oldest)) {
                oldest = dueAt;
            }
        }
        return oldest;
    }

    private int claimAndDispatch(List<WebhookDelivery> rows, Instant now) throws SQLException {
        int dispatched = 0;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (WebhookDelivery row : rows) {
                if (!deliveryStore.claim(conn, row.id(), row.version(), now)) {
                    // another poller won the row
                    continue;
                }
                if (row.status() == DeliveryStatus.IN_FLIGHT) {
                    logger.log(Level.WARNING, "Reclaimed delivery {0} after lease expiry (claimedAt={1})",
                        new Object[]{row.id(), row.claimedAt()});
                }
                metrics.incrementDeliveryClaimed();
                QueuedDelivery queued = new QueuedDelivery(row.claimed(now), row.status());
                if (!handler.handle(queued)) {
                    deliveryStore.release(conn, row.id(), row.version() + 1, queued.releaseStatus(), now);
                    metrics.incrementDeliverySkipped();
                    break;
                }
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link DeliveryPoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeliveryStore deliveryStore;
        private DeliveryHandler handler;
        private int batchSize = 50;
        private long intervalMs = 1000;
        private Duration claimLease = Duration.ofMinutes(5);
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used for scanning and claiming.
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
         * Sets the delivery store.
         *
         * <p><b>Required.</b>
         *
         * @param deliveryStore the persistence backend
         * @return this builder
         */
        public Builder deliveryStore(DeliveryStore deliveryStore) {
            this.deliveryStore = deliveryStore;
            return this;
        }

        /**
         * Sets the handler that receives claimed deliveries (typically a {@link DeliveryDispatcher}).
         *
         * <p><b>Required.</b>
         *
         * @param handler the callback for claimed deliveries
         * @return this builder
         */
        public Builder handler(DeliveryHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the maximum number of deliveries claimed per cycle.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max deliveries per poll
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the polling interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets how long an IN_FLIGHT claim is honoured before the delivery is reclaimed.
         *
         * <p>Optional. Defaults to {@code 5 minutes}. Must exceed the HTTP timeout.
         *
         * @param claimLease lease duration
         * @return this builder
         */
        public Builder claimLease(Duration claimLease) {
            this.claimLease = Objects.requireNonNull(claimLease, "claimLease");
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
         * Builds the poller. Call {@link DeliveryPoller#start()} to begin the schedule.
         *
         * @return a new {@link DeliveryPoller}
         * @throws NullPointerException     if a required collaborator is null
         * @throws IllegalArgumentException if {@code batchSize}, {@code intervalMs} or the
         *                                  lease is not positive
         */
        public DeliveryPoller build() {
            return new DeliveryPoller(this);
        }
    }
}
