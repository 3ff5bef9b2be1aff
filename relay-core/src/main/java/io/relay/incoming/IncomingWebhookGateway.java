package io.relay.incoming;

import io.relay.delivery.QueueSettings;
import io.relay.model.IncomingEventStatus;
import io.relay.model.IncomingWebhookEvent;
import io.relay.signature.SignatureVerificationException;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.IncomingEventStore;
import io.relay.spi.MetricsExporter;
import io.relay.util.DaemonThreadFactory;
import io.relay.util.Truncation;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives inbound webhooks: authenticates them, stores each {@code (source, eventId)} once,
 * and processes accepted events asynchronously.
 *
 * <p>{@link #receive} answers without waiting for processing. A duplicate delivery from the
 * sender is acknowledged with 200 and not processed again. A request that fails
 * authentication or carries no event id is answered with 400 and leaves no trace.
 *
 * <p>Processing claims the row RECEIVED to PROCESSING by compare-and-set, so an event is
 * processed by one worker even if it is submitted twice, then records PROCESSED or ERROR.
 * Anything the processor throws, {@link Error}s included, ends in ERROR. A claim older than
 * the processing lease (the worker died, or the outcome could not be written) is returned
 * to RECEIVED by the recovery sweep and processed again, so processing is at-least-once.
 *
 * @see IncomingWebhookGateway.Builder
 * @see IncomingEventManager
 */
public final class IncomingWebhookGateway implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(IncomingWebhookGateway.class.getName());

  private final ConnectionProvider connectionProvider;
  private final IncomingEventStore store;
  private final Map<String, IncomingSource> sources;
  private final IncomingEventProcessor processor;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;
  private final Duration processingLease;
  private final long recoveryIntervalMs;
  private final int recoveryBatchSize;

  private ScheduledExecutorService recoveryScheduler;
  private ScheduledFuture<?> recoveryTask;

  private IncomingWebhookGateway(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sources));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.processingLease = Objects.requireNonNull(builder.processingLease, "processingLease");
    if (processingLease.isNegative() || processingLease.isZero()) {
      throw new IllegalArgumentException("processingLease must be > 0");
    }
    if (builder.recoveryIntervalMs < 0) {
      throw new IllegalArgumentException("recoveryIntervalMs must be >= 0");
    }
    if (builder.recoveryBatchSize <= 0) {
      throw new IllegalArgumentException("recoveryBatchSize must be > 0");
    }
    this.recoveryIntervalMs = builder.recoveryIntervalMs;
    this.recoveryBatchSize = builder.recoveryBatchSize;

    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownedExecutor = null;
    } else {
      QueueSettings queues = builder.queueSettings != null ? builder.queueSettings : QueueSettings.defaults();
      int workerCount = queues.concurrency(QueueSettings.INCOMING);
      if (workerCount <= 0) {
        throw new IllegalArgumentException("incoming concurrency must be > 0 when no executor is supplied");
      }
      this.ownedExecutor = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("relay-incoming-"));
      this.executor = ownedExecutor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the recovery sweep if a recovery interval was configured. Each run returns
   * stalled claims to RECEIVED and submits up to the batch size of RECEIVED events to the
   * processing pool. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (recoveryIntervalMs == 0 || recoveryScheduler != null) {
      return;
    }
    recoveryScheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("relay-incoming-recovery-"));
    recoveryTask = recoveryScheduler.scheduleWithFixedDelay(
        this::recover, recoveryIntervalMs, recoveryIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Handles one inbound request.
   *
   * @param sourceName      source path segment
   * @param rawBody         request body exactly as received
   * @param signatureHeader signature header value, may be {@code null}
   * @return the response to send
   */
  public ReceiveResult receive(String sourceName, String rawBody, String signatureHeader) {
    IncomingSource source = sourceName == null ? null : sources.get(sourceName);
    if (source == null) {
      metrics.incrementIncomingRejected();
      return ReceiveResult.of(ReceiveResult.Outcome.UNKNOWN_SOURCE, "unknown source");
    }
    String body = rawBody == null ? "" : rawBody;
    try {
      source.verifier().verify(body, signatureHeader, source.secret());
    } catch (SignatureVerificationException e) {
      metrics.incrementIncomingRejected();
      logger.log(Level.FINE, "Rejected webhook from {0}: {1}", new Object[]{sourceName, e.reason()});
      return ReceiveResult.of(ReceiveResult.Outcome.INVALID_SIGNATURE, "invalid signature");
    }

    String eventId;
    try {
      eventId = source.eventIdExtractor().extract(body);
    } catch (IllegalArgumentException e) {
      eventId = null;
    }
    if (eventId == null) {
      metrics.incrementIncomingRejected();
      return ReceiveResult.of(ReceiveResult.Outcome.MISSING_EVENT_ID, "missing event id");
    }

    boolean inserted;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      inserted = store.insertReceived(conn, IncomingWebhookEvent.received(sourceName, eventId, body, clock.instant()));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to store webhook " + sourceName + "/" + eventId, e);
      return ReceiveResult.of(ReceiveResult.Outcome.STORE_UNAVAILABLE, "temporarily unavailable");
    }
    if (!inserted) {
      metrics.incrementIncomingDuplicate();
      return ReceiveResult.of(ReceiveResult.Outcome.DUPLICATE, "duplicate");
    }
    metrics.incrementIncomingAccepted();
    submit(sourceName, eventId);
    return ReceiveResult.of(ReceiveResult.Outcome.ACCEPTED, "accepted");
  }

  /**
   * Handles one inbound request whose body is still raw bytes. The body must be valid UTF-8;
   * anything else is answered with 400 before the signature is checked, since the
   * signature would otherwise be computed over different bytes than the sender signed.
   *
   * @param sourceName      source path segment
   * @param rawBody         request body bytes, may be {@code null}
   * @param signatureHeader signature header value, may be {@code null}
   * @return the response to send
   */
  public ReceiveResult receive(String sourceName, byte[] rawBody, String signatureHeader) {
    String body;
    try {
      body = rawBody == null ? "" : StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(rawBody))
          .toString();
    } catch (CharacterCodingException e) {
      metrics.incrementIncomingRejected();
      logger.log(Level.FINE, "Rejected webhook from {0}: body is not valid UTF-8", sourceName);
      return ReceiveResult.of(ReceiveResult.Outcome.INVALID_BODY, "body is not valid UTF-8");
    }
    return receive(sourceName, body, signatureHeader);
  }

  /** Names of the configured sources. */
  public Collection<String> sourceNames() {
    return sources.keySet();
  }

  /**
   * Submits a RECEIVED event for asynchronous processing. If the pool rejects the task the
   * row stays RECEIVED and can be picked up by {@link #processReceived(int)}.
   */
  void submit(String source, String eventId) {
    try {
      executor.execute(() -> process(source, eventId));
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Processing of {0}/{1} rejected; event stays RECEIVED",
          new Object[]{source, eventId});
    }
  }

  /**
   * Returns PROCESSING events whose claim is older than the processing lease to RECEIVED.
   *
   * @return the number of events released
   */
  public int releaseStalled() {
    Instant claimedBefore = clock.instant().minus(processingLease);
    int released;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      released = store.releaseStalled(conn, claimedBefore);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to release stalled inbound events", e);
      return 0;
    }
    if (released > 0) {
      logger.log(Level.WARNING, "Released {0} inbound events claimed before {1}",
          new Object[]{released, claimedBefore});
    }
    return released;
  }

  /**
   * Processes up to {@code limit} events still in RECEIVED on the calling thread, for
   * example rows whose processing was lost to a crash. Stalled claims are released first.
   *
   * @return the number of events this call moved out of RECEIVED
   */
  public int processReceived(int limit) {
    releaseStalled();
    List<IncomingWebhookEvent> pending = queryReceived(limit);
    int processed = 0;
    for (IncomingWebhookEvent event : new ArrayList<>(pending)) {
      if (process(event.source(), event.eventId())) {
        processed++;
      }
    }
    return processed;
  }

  void recover() {
    try {
      releaseStalled();
      for (IncomingWebhookEvent event : queryReceived(recoveryBatchSize)) {
        submit(event.source(), event.eventId());
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Inbound recovery sweep failed", e);
    }
  }

  private List<IncomingWebhookEvent> queryReceived(int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.queryByStatus(conn, IncomingEventStatus.RECEIVED, null, limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query RECEIVED events", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if this call took the event out of RECEIVED
   */
  boolean process(String source, String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (!store.claim(conn, source, eventId, clock.instant())) {
        // another worker has it, or it is no longer RECEIVED
        return false;
      }
      Optional<IncomingWebhookEvent> event = store.find(conn, source, eventId);
      if (event.isEmpty()) {
        return false;
      }
      try {
        processor.process(event.get());
      } catch (Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        store.markError(conn, source, eventId, Truncation.truncate(message), clock.instant());
        metrics.incrementIncomingFailed();
        logger.log(Level.WARNING, "Processing failed for " + source + "/" + eventId, t);
        if (t instanceof VirtualMachineError) {
          throw (VirtualMachineError) t;
        }
        return true;
      }
      store.markProcessed(conn, source, eventId, clock.instant());
      metrics.incrementIncomingProcessed();
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to process webhook " + source + "/" + eventId, e);
      return false;
    }
  }

  /**
   * Stops the recovery sweep and the owned processing pool, waiting up to the drain timeout
   * for running events.
   * A caller-supplied executor is left to its owner.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (recoveryTask != null) {
        recoveryTask.cancel(false);
      }
      if (recoveryScheduler != null) {
        recoveryScheduler.shutdownNow();
      }
    }
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown of inbound processing");
        ownedExecutor.shutdownNow();
        ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link IncomingWebhookGateway}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private IncomingEventStore store;
    private final Map<String, IncomingSource> sources = new LinkedHashMap<>();
    private IncomingEventProcessor processor;
    private Executor executor;
    private QueueSettings queueSettings;
    private MetricsExporter metrics;
    private Clock clock;
    private long drainTimeoutMs = 5000;
    private Duration processingLease = Duration.ofMinutes(5);
    private long recoveryIntervalMs;
    private int recoveryBatchSize = 50;

    private Builder() {}

    /**
     * Sets the connection provider.
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
     * Sets the inbound event store.
     *
     * <p><b>Required.</b>
     *
     * @param store the persistence backend
     * @return this builder
     */
    public Builder store(IncomingEventStore store) {
      this.store = store;
      return this;
    }

    /**
     * Adds an accepted source. Requests naming any other source are rejected.
     *
     * @param source the source
     * @return this builder
     * @throws IllegalArgumentException if a source with the same name was already added
     */
    public Builder source(IncomingSource source) {
      Objects.requireNonNull(source, "source");
      if (sources.putIfAbsent(source.name(), source) != null) {
        throw new IllegalArgumentException("Duplicate source: " + source.name());
      }
      return this;
    }

    /**
     * Sets the application callback for accepted events.
     *
     * <p><b>Required.</b>
     *
     * @param processor the processor
     * @return this builder
     */
    public Builder processor(IncomingEventProcessor processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Sets an executor for processing. The gateway does not shut it down.
     *
     * <p>Optional. Defaults to a pool sized by the {@value QueueSettings#INCOMING} queue.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the queue settings used to size the default processing pool.
     *
     * <p>Optional. Defaults to {@link QueueSettings#defaults()}.
     *
     * @param queueSettings the queue settings
     * @return this builder
     */
    public Builder queueSettings(QueueSettings queueSettings) {
      this.queueSettings = queueSettings;
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
     * Sets the maximum time to wait for running events on {@link #close()}.
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
     * Sets how long a PROCESSING claim is honoured before the event is released back to
     * RECEIVED. Must exceed the longest expected processing time.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param processingLease the lease
     * @return this builder
     */
    public Builder processingLease(Duration processingLease) {
      this.processingLease = processingLease;
      return this;
    }

    /**
     * Sets the delay between recovery sweeps started by {@link IncomingWebhookGateway#start()}.
     *
     * <p>Optional. Defaults to {@code 0}, no sweep.
     *
     * @param recoveryIntervalMs interval in milliseconds
     * @return this builder
     */
    public Builder recoveryIntervalMs(long recoveryIntervalMs) {
      this.recoveryIntervalMs = recoveryIntervalMs;
      return this;
    }

    /**
     * Sets how many RECEIVED events one recovery sweep submits. Optional; defaults to 50.
     *
     * @param recoveryBatchSize batch size
     * @return this builder
     */
    public Builder recoveryBatchSize(int recoveryBatchSize) {
      this.recoveryBatchSize = recoveryBatchSize;
      return this;
    }

    /**
     * Builds the gateway.
     *
     * @return a new {@link IncomingWebhookGateway}
     * @throws NullPointerException     if a required collaborator is null
     * @throws IllegalArgumentException if no executor is supplied and the incoming queue
     *                                  concurrency is 0, or a recovery setting is out of range
     */
    public IncomingWebhookGateway build() {
      return new IncomingWebhookGateway(this);
    }
  }
}
