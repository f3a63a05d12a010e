package outreach.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code base * 2^(attempt-2)}, capped at {@code max},
 * multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseMs;
  private final long maxMs;

  public ExponentialBackoffRetryPolicy(Duration base, Duration max) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(max, "max");
    if (base.isZero() || base.isNegative()) {
      throw new IllegalArgumentException("base must be > 0, got: " + base);
    }
    if (max.compareTo(base) < 0) {
      throw new IllegalArgumentException("max must be >= base, got: " + max);
    }
    this.baseMs = base.toMillis();
    this.maxMs = max.toMillis();
  }

  @Override
  public Duration delayBefore(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    int doublings = attempt - 2;
    long exp = doublings >= 62 || (1L << doublings) > maxMs / baseMs
        ? maxMs : Math.min(maxMs, baseMs << doublings);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Duration.ofMillis(Math.min(maxMs, (long) (exp * jitter)));
  }
}
