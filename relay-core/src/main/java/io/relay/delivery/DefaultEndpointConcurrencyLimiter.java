package io.relay.delivery;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConcurrentHashMap}-based per-endpoint slot counter.
 *
 * <p>The cap is local to this process. Across processes the effective cap is
 * {@code maxPerEndpoint * processes}.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultEndpointConcurrencyLimiter implements EndpointConcurrencyLimiter {
  private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
  private final int maxPerEndpoint;

  /**
   * @param maxPerEndpoint maximum concurrent attempts per endpoint; must be &gt; 0
   */
  public DefaultEndpointConcurrencyLimiter(int maxPerEndpoint) {
    if (maxPerEndpoint <= 0) {
      throw new IllegalArgumentException("maxPerEndpoint must be > 0, got: " + maxPerEndpoint);
    }
    this.maxPerEndpoint = maxPerEndpoint;
  }

  @Override
  public boolean tryAcquire(String endpointId) {
    boolean[] acquired = new boolean[1];
    inFlight.compute(endpointId, (id, count) -> {
      AtomicInteger current = count != null ? count : new AtomicInteger();
      if (current.get() < maxPerEndpoint) {
        current.incrementAndGet();
        acquired[0] = true;
      }
      return current;
    });
    return acquired[0];
  }

  @Override
  public void release(String endpointId) {
    // drop the entry at zero so idle endpoints do not accumulate
    inFlight.computeIfPresent(endpointId, (id, count) -> count.decrementAndGet() <= 0 ? null : count);
  }

  /** Current number of attempts holding a slot for {@code endpointId}. */
  public int inFlight(String endpointId) {
    AtomicInteger count = inFlight.get(endpointId);
    return count == null ? 0 : count.get();
  }
}
