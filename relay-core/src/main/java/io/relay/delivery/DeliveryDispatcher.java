package io.relay.delivery;

import io.relay.model.DeliveryStatus;
import io.relay.model.WebhookDelivery;
import io.relay.model.WebhookEndpoint;
import io.relay.signature.SignatureEngine;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.DeliveryStore;
import io.relay.spi.EndpointStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.WebhookTransport;
import io.relay.util.DaemonThreadFactory;
import io.relay.util.Truncation;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker pool that performs HTTP attempts for claimed deliveries.
 *
 * <p>Each attempt signs the stored payload with the endpoint's current secret and POSTs it.
 * A 2xx response marks the delivery DELIVERED. Any other outcome (non-2xx, timeout,
 * network error) counts as a failed attempt: the delivery is rescheduled according to the
 * {@link RetryPolicy}, or moved to FAILED_EXHAUSTED once {@code maxAttempts} is reached.
 * Every outcome is written with the claim version, so a worker whose claim was taken over
 * after lease expiry cannot overwrite the newer attempt.
 *
 * <p>A claim is handed back with attempts and {@code next_attempt_at} untouched when the
 * endpoint was disabled after the row was claimed (to PENDING_RETRY, so re-enabling the
 * endpoint resumes it), or when the endpoint's concurrency cap is reached (to its previous
 * status).
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see DeliveryDispatcher.Builder
 * @see DeliveryPoller
 */
public final class DeliveryDispatcher implements DeliveryHandler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<QueuedDelivery> queue;
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final EndpointStore endpointStore;
  private final WebhookTransport transport;
  private final SignatureEngine signatureEngine;
  private final RetryPolicy retryPolicy;
  private final EndpointConcurrencyLimiter limiter;
  private final int maxAttempts;
  private final Duration requestTimeout;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;

  private DeliveryDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.endpointStore = Objects.requireNonNull(builder.endpointStore, "endpointStore");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.signatureEngine = builder.signatureEngine != null
        ? builder.signatureEngine : new SignatureEngine(clock);
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new FixedScheduleRetryPolicy();
    this.limiter = builder.limiter != null ? builder.limiter : EndpointConcurrencyLimiter.UNLIMITED;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
    if (builder.requestTimeout.isNegative() || builder.requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    this.maxAttempts = builder.maxAttempts;
    this.requestTimeout = builder.requestTimeout;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);

    QueueSettings queues = builder.queueSettings != null ? builder.queueSettings : QueueSettings.defaults();
    int workerCount = queues.concurrency(QueueSettings.DELIVERIES);
    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("relay-delivery-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // no workers: claims stay queued until process() is called (testing only)
      logger.warning("deliveries concurrency=0: no delivery workers started");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("relay-delivery-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean handle(QueuedDelivery delivery) {
    if (!accepting.get()) return false;
    boolean enqueued = queue.offer(delivery);
    metrics.recordQueueDepth(queue.size());
    return enqueued;
  }

  @Override
  public int availableCapacity() {
    return accepting.get() ? queue.remainingCapacity() : 0;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        QueuedDelivery delivery = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (delivery == null) {
          if (!running.get()) break;
          continue;
        }
        process(delivery);
        metrics.recordQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery worker loop error", t);
      }
    }
  }

  /**
   * Performs one attempt for a claimed delivery and records the outcome. Called by the
   * worker threads, and directly by tests.
   */
  public void process(QueuedDelivery queued) {
    WebhookDelivery delivery = queued.delivery();
    String endpointId = delivery.endpointId();
    if (!limiter.tryAcquire(endpointId)) {
      handBack(queued, queued.releaseStatus(), "endpoint concurrency limit reached");
      return;
    }
    try {
      Optional<WebhookEndpoint> endpoint = loadEndpoint(endpointId);
      if (endpoint.isEmpty() || !endpoint.get().enabled()) {
        handBack(queued, DeliveryStatus.PENDING_RETRY, "endpoint disabled");
        return;
      }
      attempt(delivery, endpoint.get());
    } finally {
      limiter.release(endpointId);
    }
  }

  private void attempt(WebhookDelivery delivery, WebhookEndpoint endpoint) {
    WebhookTransport.Request request = buildRequest(delivery, endpoint);
    long startNanos = System.nanoTime();
    WebhookTransport.Response response;
    try {
      response = transport.send(request);
    } catch (IOException | RuntimeException e) {
      metrics.recordAttemptDurationMs(elapsedMs(startNanos));
      onFailure(delivery, new TransientDeliveryException(describe(e), null, e), null);
      return;
    }
    metrics.recordAttemptDurationMs(elapsedMs(startNanos));

    String body = Truncation.truncate(response.body());
    if (response.isSuccessful()) {
      int updated = update("mark DELIVERED", delivery.id(), conn -> deliveryStore.markDelivered(
          conn, delivery.id(), delivery.version(), response.statusCode(), body, clock.instant()));
      if (updated > 0) {
        metrics.incrementDeliverySuccess();
      }
      return;
    }
    onFailure(delivery, TransientDeliveryException.ofStatus(response.statusCode()), body);
  }

  private WebhookTransport.Request buildRequest(WebhookDelivery delivery, WebhookEndpoint endpoint) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(WebhookHeaders.CONTENT_TYPE, WebhookHeaders.JSON);
    headers.put(WebhookHeaders.SIGNATURE, signatureEngine.sign(delivery.payload(), endpoint.secret()));
    headers.put(WebhookHeaders.EVENT_TYPE, delivery.eventType());
    headers.put(WebhookHeaders.EVENT_ID, delivery.eventId());
    headers.put(WebhookHeaders.DELIVERY_ID, delivery.id());
    return new WebhookTransport.Request(endpoint.url(), headers, delivery.payload(), requestTimeout);
  }

  private void onFailure(WebhookDelivery delivery, TransientDeliveryException failure, String responseBody) {
    int attempts = delivery.attempts() + 1;
    Integer responseStatus = failure.responseStatus();
    Instant now = clock.instant();
    if (attempts >= maxAttempts) {
      DeliveryExhaustedException exhausted = new DeliveryExhaustedException(delivery.id(), attempts, failure);
      String error = Truncation.truncate(exhausted.getMessage());
      int updated = update("mark FAILED_EXHAUSTED", delivery.id(), conn -> deliveryStore.markExhausted(
          conn, delivery.id(), delivery.version(), responseStatus, responseBody, error, now));
      if (updated > 0) {
        metrics.incrementDeliveryExhausted();
        logger.log(Level.WARNING, exhausted.getMessage());
      }
      return;
    }
    Instant nextAttemptAt = now.plus(retryPolicy.delayAfter(attempts));
    String error = Truncation.truncate(failure.getMessage());
    int updated = update("mark PENDING_RETRY", delivery.id(), conn -> deliveryStore.markRetry(
        conn, delivery.id(), delivery.version(), nextAttemptAt, responseStatus, responseBody, error, now));
    if (updated > 0) {
      metrics.incrementDeliveryRetry();
      logger.log(Level.FINE, "Delivery {0} attempt {1} failed ({2}); next attempt at {3}",
          new Object[]{delivery.id(), attempts, failure.getMessage(), nextAttemptAt});
    }
  }

  private void handBack(QueuedDelivery queued, DeliveryStatus status, String reason) {
    WebhookDelivery delivery = queued.delivery();
    update("release", delivery.id(), conn -> deliveryStore.release(
        conn, delivery.id(), delivery.version(), status, clock.instant()));
    metrics.incrementDeliverySkipped();
    logger.log(Level.FINE, "Handed back delivery {0}: {1}", new Object[]{delivery.id(), reason});
  }

  private Optional<WebhookEndpoint> loadEndpoint(String endpointId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return endpointStore.findById(conn, endpointId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load endpoint " + endpointId, e);
      return Optional.empty();
    }
  }

  private int update(String action, String deliveryId, SqlUpdate op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = op.execute(conn);
      if (updated == 0) {
        logger.log(Level.WARNING, "Claim lost before {0} for deliveryId={1}", new Object[]{action, deliveryId});
      }
      return updated;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for deliveryId=" + deliveryId, e);
      return 0;
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
  }

  @FunctionalInterface
  private interface SqlUpdate {
    int execute(Connection conn) throws SQLException;
  }

  /**
   * Initiates graceful shutdown: stops accepting claims, drains queued deliveries within the
   * drain timeout, then shuts down worker threads. Claims still queued after that are
   * recovered by lease expiry.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link DeliveryDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private EndpointStore endpointStore;
    private WebhookTransport transport;
    private SignatureEngine signatureEngine;
    private RetryPolicy retryPolicy;
    private EndpointConcurrencyLimiter limiter;
    private QueueSettings queueSettings;
    private int maxAttempts = 5;
    private int queueCapacity = 1000;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private Clock clock;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection provider used for recording outcomes.
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
     * @param deliveryStore the persistence backend for deliveries
     * @return this builder
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * Sets the endpoint store used to read the URL, secret and enabled flag per attempt.
     *
     * <p><b>Required.</b>
     *
     * @param endpointStore the persistence backend for endpoints
     * @return this builder
     */
    public Builder endpointStore(EndpointStore endpointStore) {
      this.endpointStore = endpointStore;
      return this;
    }

    /**
     * Sets the HTTP transport.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the signature engine. Optional; defaults to one sharing this dispatcher's clock.
     *
     * @param signatureEngine the signature engine
     * @return this builder
     */
    public Builder signatureEngine(SignatureEngine signatureEngine) {
      this.signatureEngine = signatureEngine;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Optional. Defaults to {@link FixedScheduleRetryPolicy} with its default schedule.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the per-endpoint concurrency limiter.
     *
     * <p>Optional. Defaults to {@link EndpointConcurrencyLimiter#UNLIMITED}.
     *
     * @param limiter the limiter
     * @return this builder
     */
    public Builder limiter(EndpointConcurrencyLimiter limiter) {
      this.limiter = limiter;
      return this;
    }

    /**
     * Sets the queue settings; the {@value QueueSettings#DELIVERIES} entry sizes the pool.
     *
     * <p>Optional. Defaults to {@link QueueSettings#defaults()}. A concurrency of 0 starts
     * no workers.
     *
     * @param queueSettings the queue settings
     * @return this builder
     */
    public Builder queueSettings(QueueSettings queueSettings) {
      this.queueSettings = queueSettings;
      return this;
    }

    /**
     * Sets the number of attempts after which a delivery is FAILED_EXHAUSTED.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts max attempts per delivery
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the capacity of the claimed-delivery queue.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity queue capacity
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the per-attempt HTTP timeout.
     *
     * <p>Optional. Defaults to {@code 30 seconds}. Must be positive.
     *
     * @param requestTimeout request timeout
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
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
     * Sets the clock used for signing timestamps and scheduling. Optional.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum time to wait for queued deliveries on {@link #close()}.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the dispatcher and starts its workers.
     *
     * @return a new {@link DeliveryDispatcher}
     * @throws NullPointerException     if a required collaborator is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}, the queue capacity is not
     *                                  positive, or the request timeout is not positive
     */
    public DeliveryDispatcher build() {
      return new DeliveryDispatcher(this);
    }
  }
}
