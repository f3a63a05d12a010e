package outreach.retry;

import outreach.spi.CallResult;
import outreach.spi.NotificationSink;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends a notification right away and hands it to the {@link RetryQueue} if the send fails.
 */
public final class NotificationPublisher {
  private static final Logger logger = Logger.getLogger(NotificationPublisher.class.getName());

  private final Map<String, NotificationSink> sinks;
  private final RetryQueue retryQueue;

  public NotificationPublisher(Map<String, NotificationSink> sinks, RetryQueue retryQueue) {
    this.sinks = Map.copyOf(Objects.requireNonNull(sinks, "sinks"));
    this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
  }

  /**
   * @return {@code true} if the notification was delivered now, {@code false} if it was queued
   *     for a retry or no sink is registered under that name
   */
  public boolean publish(String sink, String payload) {
    Objects.requireNonNull(payload, "payload");
    NotificationSink target = sinks.get(sink);
    if (target == null) {
      logger.log(Level.FINE, "No sink registered as {0}; notification skipped", sink);
      return false;
    }
    String reason;
    try {
      CallResult<Void> result = target.send(payload);
      if (result.isSuccess()) {
        return true;
      }
      CallResult.Failure<Void> failure = (CallResult.Failure<Void>) result;
      reason = failure.kind() + ": " + failure.message();
    } catch (RuntimeException e) {
      reason = e.toString();
    }
    logger.log(Level.INFO, "Send to {0} failed, queued for retry: {1}", new Object[] {sink, reason});
    retryQueue.enqueue(sink, payload, reason);
    return false;
  }

  /**
   * Queues a notification without attempting it now.
   */
  public void defer(String sink, String payload, String reason) {
    retryQueue.enqueue(sink, payload, reason);
  }
}
