package io.relay.delivery;

/**
 * Caps the number of simultaneous attempts per endpoint so one slow receiver cannot occupy
 * every delivery worker.
 *
 * @see DefaultEndpointConcurrencyLimiter
 */
public interface EndpointConcurrencyLimiter {

  /** Limiter that never refuses. */
  EndpointConcurrencyLimiter UNLIMITED = new EndpointConcurrencyLimiter() {
    @Override
    public boolean tryAcquire(String endpointId) {
      return true;
    }

    @Override
    public void release(String endpointId) {
    }
  };

  /**
   * @return {@code true} if a slot was taken; the caller must {@link #release} it
   */
  boolean tryAcquire(String endpointId);

  void release(String endpointId);
}
