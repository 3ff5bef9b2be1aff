package io.relay.delivery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named work queues and their concurrency, fixed at startup.
 *
 * <p>{@value #DELIVERIES} sizes the outbound delivery worker pool and {@value #INCOMING}
 * the inbound processing pool. Other names may be declared for application use.
 */
public final class QueueSettings {
  public static final String DELIVERIES = "deliveries";
  public static final String INCOMING = "incoming";

  private static final QueueSettings DEFAULTS = new QueueSettings(Map.of(DELIVERIES, 4, INCOMING, 2));

  private final Map<String, Integer> concurrency;

  private QueueSettings(Map<String, Integer> concurrency) {
    Map<String, Integer> copy = new LinkedHashMap<>();
    concurrency.forEach((name, limit) -> {
      Objects.requireNonNull(name, "queue name");
      Objects.requireNonNull(limit, "concurrency of " + name);
      if (name.isBlank()) {
        throw new IllegalArgumentException("queue name must not be blank");
      }
      if (limit < 0) {
        throw new IllegalArgumentException("concurrency of " + name + " must be >= 0, got: " + limit);
      }
      copy.put(name, limit);
    });
    this.concurrency = Collections.unmodifiableMap(copy);
  }

  public static QueueSettings defaults() {
    return DEFAULTS;
  }

  /**
   * Creates settings from {@code {queue: concurrency}}, filling in defaults for the
   * built-in queues that are not named.
   */
  public static QueueSettings of(Map<String, Integer> concurrency) {
    Map<String, Integer> merged = new LinkedHashMap<>(DEFAULTS.concurrency);
    merged.putAll(Objects.requireNonNull(concurrency, "concurrency"));
    return new QueueSettings(merged);
  }

  /**
   * @throws IllegalArgumentException if the queue is not declared
   */
  public int concurrency(String queueName) {
    Integer limit = concurrency.get(queueName);
    if (limit == null) {
      throw new IllegalArgumentException("Unknown queue: " + queueName + ". Declared: " + concurrency.keySet());
    }
    return limit;
  }

  public Map<String, Integer> asMap() {
    return concurrency;
  }

  @Override
  public String toString() {
    return "QueueSettings" + concurrency;
  }
}
