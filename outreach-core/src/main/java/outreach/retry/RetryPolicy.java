package outreach.retry;

import java.time.Duration;

/**
 * Computes how long a failed notification waits before its next attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /** Retries on the next drain cycle. */
  RetryPolicy NEXT_CYCLE = attempt -> Duration.ZERO;

  /**
   * @param attempt the attempt about to be scheduled (2 for the first retry)
   * @return delay before that attempt, never negative
   */
  Duration delayBefore(int attempt);
}
