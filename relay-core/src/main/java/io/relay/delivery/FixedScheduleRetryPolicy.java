package io.relay.delivery;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Retry policy that walks a fixed list of delays, indexed by attempt number.
 *
 * <p>The default schedule is {@code 1m, 5m, 30m, 2h, 24h}: the first failure waits one
 * minute, the second five, and so on. Attempts beyond the end of the schedule reuse its
 * last entry. There is no jitter; the schedule is exact.
 */
public final class FixedScheduleRetryPolicy implements RetryPolicy {
  public static final List<Duration> DEFAULT_SCHEDULE = List.of(
      Duration.ofMinutes(1),
      Duration.ofMinutes(5),
      Duration.ofMinutes(30),
      Duration.ofHours(2),
      Duration.ofHours(24));

  private final List<Duration> schedule;

  public FixedScheduleRetryPolicy() {
    this(DEFAULT_SCHEDULE);
  }

  public FixedScheduleRetryPolicy(List<Duration> schedule) {
    Objects.requireNonNull(schedule, "schedule");
    if (schedule.isEmpty()) {
      throw new IllegalArgumentException("schedule must not be empty");
    }
    for (Duration delay : schedule) {
      Objects.requireNonNull(delay, "schedule entry");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("schedule entries must be >= 0, got: " + delay);
      }
    }
    this.schedule = List.copyOf(schedule);
  }

  @Override
  public Duration delayAfter(int attempts) {
    if (attempts <= 0) {
      return Duration.ZERO;
    }
    return schedule.get(Math.min(attempts, schedule.size()) - 1);
  }

  public List<Duration> schedule() {
    return schedule;
  }
}
