package outreach.ops;

import java.util.Map;

/**
 * Point-in-time view of queue depths and funnel counters.
 *
 * @param queueDepth      events waiting in the inbound queue
 * @param processingDepth events popped by this owner and not yet acknowledged
 * @param pendingPayments subjects with an open payment
 * @param dueFollowups    outstanding due entries
 * @param retryDepth      notifications waiting for a retry
 * @param counters        funnel counters by event name
 */
public record OpsSnapshot(
    long queueDepth,
    long processingDepth,
    long pendingPayments,
    long dueFollowups,
    long retryDepth,
    Map<String, Long> counters) {

  public OpsSnapshot {
    counters = counters == null ? Map.of() : Map.copyOf(counters);
  }
}
