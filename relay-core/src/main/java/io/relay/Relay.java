package io.relay;

import io.relay.delivery.DefaultEndpointConcurrencyLimiter;
import io.relay.delivery.DeliveryDispatcher;
import io.relay.delivery.DeliveryPoller;
import io.relay.delivery.QueueSettings;
import io.relay.delivery.RetryPolicy;
import io.relay.delivery.WebhookPublisher;
import io.relay.failed.FailedDeliveryManager;
import io.relay.idempotency.IdempotencyGate;
import io.relay.incoming.IncomingEventManager;
import io.relay.incoming.IncomingEventProcessor;
import io.relay.incoming.IncomingSource;
import io.relay.incoming.IncomingWebhookGateway;
import io.relay.purge.PurgeScheduler;
import io.relay.registry.WebhookRegistry;
import io.relay.signature.SignatureEngine;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.DeliveryStore;
import io.relay.spi.EndpointStore;
import io.relay.spi.IdempotencyStore;
import io.relay.spi.IncomingEventStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.Purger;
import io.relay.spi.WebhookTransport;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the idempotency gate, endpoint registry, delivery
 * pipeline, inbound gateway and purge schedulers into a single {@link AutoCloseable} unit.
 *
 * <p>Without a {@link Builder#transport transport} the relay only records deliveries
 * (publish-only node); another node with a transport sends them. Without a
 * {@link Builder#incomingProcessor processor} no inbound gateway is created.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Relay relay = Relay.builder()
 *     .connectionProvider(connProvider)
 *     .idempotencyStore(idempotencyStore)
 *     .endpointStore(endpointStore)
 *     .deliveryStore(deliveryStore)
 *     .transport(transport)
 *     .build()) {
 *   relay.registry().register("acct_1", "https://example.com/hook", EventSubscription.all(), null);
 *   relay.publisher().publish(WebhookEvent.of("evt_1", StringEventType.of("order.created"), "acct_1", "{}"));
 * }
 * }</pre>
 */
public final class Relay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Relay.class.getName());

  private final IdempotencyGate idempotencyGate;
  private final WebhookRegistry registry;
  private final WebhookPublisher publisher;
  private final FailedDeliveryManager failedDeliveries;
  private final DeliveryDispatcher dispatcher;
  private final DeliveryPoller poller;
  private final IncomingWebhookGateway incomingGateway;
  private final IncomingEventManager incomingEvents;
  private final List<PurgeScheduler> purgeSchedulers;
  private final MetricsExporter metrics;

  private Relay(Builder builder, IdempotencyGate idempotencyGate, DeliveryDispatcher dispatcher,
      DeliveryPoller poller, IncomingWebhookGateway incomingGateway, List<PurgeScheduler> purgeSchedulers) {
    this.idempotencyGate = idempotencyGate;
    this.registry = new WebhookRegistry(builder.connectionProvider, builder.endpointStore, builder.clock);
    this.publisher = new WebhookPublisher(builder.connectionProvider, builder.endpointStore,
        builder.deliveryStore, builder.metrics, builder.clock);
    this.failedDeliveries = new FailedDeliveryManager(builder.connectionProvider, builder.deliveryStore, builder.clock);
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.incomingGateway = incomingGateway;
    this.incomingEvents = incomingGateway == null ? null
        : new IncomingEventManager(builder.connectionProvider, builder.incomingEventStore, incomingGateway);
    this.purgeSchedulers = List.copyOf(purgeSchedulers);
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The gate, or {@code null} if no idempotency store was configured. */
  public IdempotencyGate idempotencyGate() {
    return idempotencyGate;
  }

  public WebhookRegistry registry() {
    return registry;
  }

  public WebhookPublisher publisher() {
    return publisher;
  }

  public FailedDeliveryManager failedDeliveries() {
    return failedDeliveries;
  }

  /** The poller, or {@code null} on a publish-only node. */
  public DeliveryPoller poller() {
    return poller;
  }

  /** The dispatcher, or {@code null} on a publish-only node. */
  public DeliveryDispatcher dispatcher() {
    return dispatcher;
  }

  /** The inbound gateway, or {@code null} if no processor was configured. */
  public IncomingWebhookGateway incomingGateway() {
    return incomingGateway;
  }

  /** The inbound operator view, or {@code null} if no processor was configured. */
  public IncomingEventManager incomingEvents() {
    return incomingEvents;
  }

  /**
   * Shuts down components in order: purge schedulers, poller, dispatcher, inbound gateway,
   * then the metrics exporter if it is closeable. Failures are collected; the first is
   * thrown with the rest suppressed.
   */
  @Override
  public void close() {
    List<AutoCloseable> components = new ArrayList<>(purgeSchedulers);
    components.add(poller);
    components.add(dispatcher);
    components.add(incomingGateway);
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    RuntimeException first = null;
    for (AutoCloseable component : components) {
      if (component == null) {
        continue;
      }
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Relay}. */
  public static final class Builder {
    ConnectionProvider connectionProvider;
    IdempotencyStore idempotencyStore;
    EndpointStore endpointStore;
    DeliveryStore deliveryStore;
    IncomingEventStore incomingEventStore;
    WebhookTransport transport;
    MetricsExporter metrics = MetricsExporter.NOOP;
    Clock clock = Clock.systemUTC();
    QueueSettings queueSettings = QueueSettings.defaults();
    RetryPolicy retryPolicy;
    int maxAttempts = 5;
    Duration requestTimeout = Duration.ofSeconds(30);
    int maxConcurrentPerEndpoint;
    long pollIntervalMs = 1000;
    int pollBatchSize = 50;
    Duration claimLease = Duration.ofMinutes(5);
    Duration idempotencyTtl = Duration.ofHours(24);
    Duration stalenessWindow = Duration.ofSeconds(30);
    final Map<String, IncomingSource> sources = new LinkedHashMap<>();
    IncomingEventProcessor incomingProcessor;
    Duration incomingProcessingLease = Duration.ofMinutes(5);
    long incomingRecoveryIntervalMs = 60_000;
    final Map<Purger, Duration> purgers = new LinkedHashMap<>();
    long purgeIntervalSeconds = 3600;
    long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the connection provider shared by all components.
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
     * Sets the idempotency store. Optional; without it no gate is created.
     *
     * @param idempotencyStore the store
     * @return this builder
     */
    public Builder idempotencyStore(IdempotencyStore idempotencyStore) {
      this.idempotencyStore = idempotencyStore;
      return this;
    }

    /**
     * Sets the endpoint store.
     *
     * <p><b>Required.</b>
     *
     * @param endpointStore the store
     * @return this builder
     */
    public Builder endpointStore(EndpointStore endpointStore) {
      this.endpointStore = endpointStore;
      return this;
    }

    /**
     * Sets the delivery store.
     *
     * <p><b>Required.</b>
     *
     * @param deliveryStore the store
     * @return this builder
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * Sets the inbound event store. Required when a processor is set.
     *
     * @param incomingEventStore the store
     * @return this builder
     */
    public Builder incomingEventStore(IncomingEventStore incomingEventStore) {
      this.incomingEventStore = incomingEventStore;
      return this;
    }

    /**
     * Sets the outbound HTTP transport. Optional; without it this node does not send.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional; defaults to {@link MetricsExporter#NOOP}.
     * Closed with the relay if it implements {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
      return this;
    }

    /**
     * Sets the clock shared by all components. Optional; defaults to the UTC system clock.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Sets the queue settings that size the delivery and inbound pools.
     *
     * <p>Optional. Defaults to {@link QueueSettings#defaults()}.
     *
     * @param queueSettings the queue settings
     * @return this builder
     */
    public Builder queueSettings(QueueSettings queueSettings) {
      this.queueSettings = Objects.requireNonNull(queueSettings, "queueSettings");
      return this;
    }

    /**
     * Sets the retry policy. Optional; defaults to the fixed {@code 1m, 5m, 30m, 2h, 24h} schedule.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of attempts per delivery. Optional; defaults to {@code 5}.
     *
     * @param maxAttempts max attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the per-attempt HTTP timeout. Optional; defaults to {@code 30 seconds}.
     *
     * @param requestTimeout the timeout
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Caps concurrent attempts per endpoint within this process.
     *
     * <p>Optional. Defaults to {@code 0} (no cap).
     *
     * @param maxConcurrentPerEndpoint the cap, or {@code 0} for none
     * @return this builder
     */
    public Builder maxConcurrentPerEndpoint(int maxConcurrentPerEndpoint) {
      this.maxConcurrentPerEndpoint = maxConcurrentPerEndpoint;
      return this;
    }

    /**
     * Sets the delivery polling interval. Optional; defaults to {@code 1000} ms.
     *
     * @param pollIntervalMs interval in milliseconds
     * @return this builder
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Sets the maximum deliveries claimed per poll. Optional; defaults to {@code 50}.
     *
     * @param pollBatchSize batch size
     * @return this builder
     */
    public Builder pollBatchSize(int pollBatchSize) {
      this.pollBatchSize = pollBatchSize;
      return this;
    }

    /**
     * Sets the IN_FLIGHT claim lease. Optional; defaults to {@code 5 minutes}.
     *
     * @param claimLease lease duration
     * @return this builder
     */
    public Builder claimLease(Duration claimLease) {
      this.claimLease = claimLease;
      return this;
    }

    /**
     * Sets the idempotency record lifetime. Optional; defaults to {@code 24 hours}.
     *
     * @param idempotencyTtl record lifetime
     * @return this builder
     */
    public Builder idempotencyTtl(Duration idempotencyTtl) {
      this.idempotencyTtl = idempotencyTtl;
      return this;
    }

    /**
     * Sets the idempotency lock staleness window. Optional; defaults to {@code 30 seconds}.
     *
     * @param stalenessWindow maximum lock age
     * @return this builder
     */
    public Builder stalenessWindow(Duration stalenessWindow) {
      this.stalenessWindow = stalenessWindow;
      return this;
    }

    /**
     * Adds an inbound source.
     *
     * @param source the source
     * @return this builder
     */
    public Builder incomingSource(IncomingSource source) {
      Objects.requireNonNull(source, "source");
      this.sources.put(source.name(), source);
      return this;
    }

    /**
     * Sets the inbound event processor. Optional; without it no inbound gateway is created.
     *
     * @param incomingProcessor the processor
     * @return this builder
     */
    public Builder incomingProcessor(IncomingEventProcessor incomingProcessor) {
      this.incomingProcessor = incomingProcessor;
      return this;
    }

    /**
     * Sets how long an inbound event may stay PROCESSING before it is released for another
     * attempt. Optional; defaults to {@code 5 minutes}.
     *
     * @param incomingProcessingLease lease duration
     * @return this builder
     */
    public Builder incomingProcessingLease(Duration incomingProcessingLease) {
      this.incomingProcessingLease = incomingProcessingLease;
      return this;
    }

    /**
     * Sets the delay between inbound recovery sweeps, {@code 0} to disable them.
     * Optional; defaults to {@code 60000} ms.
     *
     * @param incomingRecoveryIntervalMs interval in milliseconds
     * @return this builder
     */
    public Builder incomingRecoveryIntervalMs(long incomingRecoveryIntervalMs) {
      this.incomingRecoveryIntervalMs = incomingRecoveryIntervalMs;
      return this;
    }

    /**
     * Adds a purger run on its own schedule with the given retention.
     *
     * @param purger    the purger
     * @param retention age subtracted from now to form the cutoff
     * @return this builder
     */
    public Builder purger(Purger purger, Duration retention) {
      this.purgers.put(Objects.requireNonNull(purger, "purger"), Objects.requireNonNull(retention, "retention"));
      return this;
    }

    /**
     * Sets the interval between purge cycles. Optional; defaults to {@code 3600} seconds.
     *
     * @param purgeIntervalSeconds interval in seconds
     * @return this builder
     */
    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * Sets the drain timeout applied to the worker pools on close. Optional; defaults to
     * {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the relay: the poller and purge schedulers begin their schedules.
     * If a later component fails to build, the ones already built are closed before
     * rethrowing.
     *
     * @return a running {@link Relay}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a setting is out of range
     * @throws IllegalStateException    if {@code build()} was already called
     */
    public Relay build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(endpointStore, "endpointStore");
      Objects.requireNonNull(deliveryStore, "deliveryStore");
      if (incomingProcessor != null) {
        Objects.requireNonNull(incomingEventStore, "incomingEventStore");
      }

      IdempotencyGate gate = idempotencyStore == null ? null : IdempotencyGate.builder()
          .connectionProvider(connectionProvider)
          .store(idempotencyStore)
          .ttl(idempotencyTtl)
          .stalenessWindow(stalenessWindow)
          .clock(clock)
          .metrics(metrics)
          .build();

      List<AutoCloseable> started = new ArrayList<>();
      try {
        DeliveryDispatcher dispatcher = null;
        DeliveryPoller poller = null;
        if (transport != null) {
          DeliveryDispatcher.Builder db = DeliveryDispatcher.builder()
              .connectionProvider(connectionProvider)
              .deliveryStore(deliveryStore)
              .endpointStore(endpointStore)
              .transport(transport)
              .signatureEngine(new SignatureEngine(clock))
              .retryPolicy(retryPolicy)
              .queueSettings(queueSettings)
              .maxAttempts(maxAttempts)
              .requestTimeout(requestTimeout)
              .metrics(metrics)
              .clock(clock)
              .drainTimeoutMs(drainTimeoutMs);
          if (maxConcurrentPerEndpoint > 0) {
            db.limiter(new DefaultEndpointConcurrencyLimiter(maxConcurrentPerEndpoint));
          }
          dispatcher = db.build();
          started.add(dispatcher);
          poller = DeliveryPoller.builder()
              .connectionProvider(connectionProvider)
              .deliveryStore(deliveryStore)
              .handler(dispatcher)
              .batchSize(pollBatchSize)
              .intervalMs(pollIntervalMs)
              .claimLease(claimLease)
              .metrics(metrics)
              .clock(clock)
              .build();
          started.add(poller);
        } else {
          logger.log(Level.INFO, "No transport configured; deliveries are recorded but not sent by this node");
        }

        IncomingWebhookGateway gateway = null;
        if (incomingProcessor != null) {
          IncomingWebhookGateway.Builder gb = IncomingWebhookGateway.builder()
              .connectionProvider(connectionProvider)
              .store(incomingEventStore)
              .processor(incomingProcessor)
              .queueSettings(queueSettings)
              .metrics(metrics)
              .clock(clock)
              .drainTimeoutMs(drainTimeoutMs)
              .processingLease(incomingProcessingLease)
              .recoveryIntervalMs(incomingRecoveryIntervalMs);
          sources.values().forEach(gb::source);
          gateway = gb.build();
          started.add(gateway);
        }

        List<PurgeScheduler> schedulers = new ArrayList<>();
        for (Map.Entry<Purger, Duration> entry : purgers.entrySet()) {
          PurgeScheduler scheduler = PurgeScheduler.builder()
              .connectionProvider(connectionProvider)
              .purger(entry.getKey())
              .retention(entry.getValue())
              .intervalSeconds(purgeIntervalSeconds)
              .clock(clock)
              .build();
          schedulers.add(scheduler);
          started.add(scheduler);
        }

        Relay relay = new Relay(this, gate, dispatcher, poller, gateway, schedulers);
        if (poller != null) {
          poller.start();
        }
        if (gateway != null) {
          gateway.start();
        }
        schedulers.forEach(PurgeScheduler::start);
        return relay;
      } catch (RuntimeException e) {
        for (AutoCloseable component : started) {
          try {
            component.close();
          } catch (Exception suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        throw e;
      }
    }
  }
}
