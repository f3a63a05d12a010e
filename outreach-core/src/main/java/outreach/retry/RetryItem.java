package outreach.retry;

import outreach.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Notification waiting for another delivery attempt.
 *
 * @param sink          name of the target sink
 * @param payload       serialized notification
 * @param reason        why the previous attempt failed
 * @param attempt       number of the next attempt, starting at 1
 * @param enqueuedAt    epoch seconds of the first enqueue
 * @param notBeforeMs   epoch millis before which the item is not attempted, 0 for no delay
 */
public record RetryItem(String sink, String payload, String reason, int attempt, long enqueuedAt, long notBeforeMs) {

  public RetryItem {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(payload, "payload");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }

  RetryItem nextAttempt(String failureReason, long notBeforeMs) {
    return new RetryItem(sink, payload, failureReason, attempt + 1, enqueuedAt, notBeforeMs);
  }

  String toJson(JsonCodec codec) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("sink", sink);
    fields.put("payload", payload);
    fields.put("reason", reason == null ? "" : reason);
    fields.put("attempt", Integer.toString(attempt));
    fields.put("ts", Long.toString(enqueuedAt));
    fields.put("not_before_ms", Long.toString(notBeforeMs));
    return codec.toJson(fields);
  }

  /**
   * @throws IllegalArgumentException if the stored item cannot be read
   */
  static RetryItem fromJson(JsonCodec codec, String json) {
    Map<String, String> f = codec.parseObject(json);
    String sink = f.get("sink");
    String payload = f.get("payload");
    if (sink == null || payload == null) {
      throw new IllegalArgumentException("Retry item requires sink and payload");
    }
    try {
      return new RetryItem(
          sink,
          payload,
          f.get("reason"),
          Integer.parseInt(f.getOrDefault("attempt", "1")),
          Long.parseLong(f.getOrDefault("ts", "0")),
          Long.parseLong(f.getOrDefault("not_before_ms", "0")));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Retry item has a non-numeric counter", e);
    }
  }
}
