package io.relay.delivery;

import java.time.Duration;

/**
 * Strategy for computing the wait before the next attempt of a failed delivery.
 *
 * @see FixedScheduleRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempts the number of attempts made so far, including the one that just failed (1-based)
     * @return delay (non-negative)
     */
    Duration delayAfter(int attempts);
}
