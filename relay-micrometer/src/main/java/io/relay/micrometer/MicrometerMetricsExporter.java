package io.relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.delivery.enqueued}, {@code .claimed}, {@code .success},
 *       {@code .retry}, {@code .exhausted}, {@code .skipped}</li>
 *   <li>{@code relay.idempotency.proceed}, {@code .replay}, {@code .conflict}, {@code .locked}</li>
 *   <li>{@code relay.incoming.accepted}, {@code .duplicate}, {@code .rejected},
 *       {@code .processed}, {@code .failed}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code relay.delivery.queue.depth}: claimed deliveries waiting for a worker</li>
 *   <li>{@code relay.delivery.lag.oldest.ms}: lateness of the oldest due delivery</li>
 *   <li>{@code relay.delivery.attempt.duration}: HTTP attempt time</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();

  private final Counter deliveryEnqueued;
  private final Counter deliveryClaimed;
  private final Counter deliverySuccess;
  private final Counter deliveryRetry;
  private final Counter deliveryExhausted;
  private final Counter deliverySkipped;
  private final Counter idempotencyProceed;
  private final Counter idempotencyReplay;
  private final Counter idempotencyConflict;
  private final Counter idempotencyLocked;
  private final Counter incomingAccepted;
  private final Counter incomingDuplicate;
  private final Counter incomingRejected;
  private final Counter incomingProcessed;
  private final Counter incomingFailed;
  private final Timer attemptDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    this.deliveryEnqueued = counter(namePrefix + ".delivery.enqueued", "Deliveries created by publishing");
    this.deliveryClaimed = counter(namePrefix + ".delivery.claimed", "Deliveries claimed by the poller");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Attempts answered with 2xx");
    this.deliveryRetry = counter(namePrefix + ".delivery.retry", "Failed attempts scheduled for retry");
    this.deliveryExhausted = counter(namePrefix + ".delivery.exhausted", "Deliveries that used every attempt");
    this.deliverySkipped = counter(namePrefix + ".delivery.skipped", "Claims handed back without an attempt");
    this.idempotencyProceed = counter(namePrefix + ".idempotency.proceed", "Requests allowed to execute");
    this.idempotencyReplay = counter(namePrefix + ".idempotency.replay", "Requests answered from cache");
    this.idempotencyConflict = counter(namePrefix + ".idempotency.conflict", "Keys reused with a different request");
    this.idempotencyLocked = counter(namePrefix + ".idempotency.locked", "Requests rejected while locked");
    this.incomingAccepted = counter(namePrefix + ".incoming.accepted", "Inbound webhooks accepted");
    this.incomingDuplicate = counter(namePrefix + ".incoming.duplicate", "Inbound webhooks already seen");
    this.incomingRejected = counter(namePrefix + ".incoming.rejected", "Inbound webhooks rejected");
    this.incomingProcessed = counter(namePrefix + ".incoming.processed", "Inbound events processed");
    this.incomingFailed = counter(namePrefix + ".incoming.failed", "Inbound events that failed processing");

    this.attemptDuration = Timer.builder(namePrefix + ".delivery.attempt.duration")
        .description("Webhook HTTP attempt time")
        .register(registry);
    meters.add(attemptDuration);
    meters.add(Gauge.builder(namePrefix + ".delivery.queue.depth", queueDepth, AtomicInteger::get)
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".delivery.lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .register(registry));
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(name).description(description).register(registry);
    meters.add(counter);
    return counter;
  }

  private void increment(Counter counter) {
    if (closed) return;
    counter.increment();
  }

  @Override
  public void incrementDeliveryEnqueued() {
    increment(deliveryEnqueued);
  }

  @Override
  public void incrementDeliveryClaimed() {
    increment(deliveryClaimed);
  }

  @Override
  public void incrementDeliverySuccess() {
    increment(deliverySuccess);
  }

  @Override
  public void incrementDeliveryRetry() {
    increment(deliveryRetry);
  }

  @Override
  public void incrementDeliveryExhausted() {
    increment(deliveryExhausted);
  }

  @Override
  public void incrementDeliverySkipped() {
    increment(deliverySkipped);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  @Override
  public void recordAttemptDurationMs(long durationMs) {
    if (closed) return;
    attemptDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementIdempotencyProceed() {
    increment(idempotencyProceed);
  }

  @Override
  public void incrementIdempotencyReplay() {
    increment(idempotencyReplay);
  }

  @Override
  public void incrementIdempotencyConflict() {
    increment(idempotencyConflict);
  }

  @Override
  public void incrementIdempotencyLocked() {
    increment(idempotencyLocked);
  }

  @Override
  public void incrementIncomingAccepted() {
    increment(incomingAccepted);
  }

  @Override
  public void incrementIncomingDuplicate() {
    increment(incomingDuplicate);
  }

  @Override
  public void incrementIncomingRejected() {
    increment(incomingRejected);
  }

  @Override
  public void incrementIncomingProcessed() {
    increment(incomingProcessed);
  }

  @Override
  public void incrementIncomingFailed() {
    increment(incomingFailed);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.relay.Relay#close()} calls this, so a closed relay leaves no stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
