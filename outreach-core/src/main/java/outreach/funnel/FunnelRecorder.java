package outreach.funnel;

import outreach.spi.KeyValueStore;
import outreach.store.StoreKeys;
import outreach.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records funnel events: a capped list of recent events, global counters and per-day counters.
 *
 * <p>Recording is best effort. Store failures are logged and never reach the caller, so a
 * metrics hiccup cannot fail a handler.
 */
public final class FunnelRecorder {
  private static final Logger logger = Logger.getLogger(FunnelRecorder.class.getName());

  public static final String TOTAL = "events_total";
  static final int MAX_EVENTS = 2000;
  static final Duration DAY_TTL = Duration.ofDays(60);

  private final KeyValueStore store;
  private final StoreKeys keys;
  private final Clock clock;
  private final JsonCodec jsonCodec;

  public FunnelRecorder(KeyValueStore store, StoreKeys keys, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jsonCodec = JsonCodec.getDefault();
  }

  public void record(String event, String subjectId) {
    record(event, subjectId, Map.of());
  }

  public void record(String event, String subjectId, Map<String, String> extra) {
    Objects.requireNonNull(event, "event");
    try {
      Map<String, String> entry = new LinkedHashMap<>();
      entry.put("event", event);
      entry.put("subject_id", subjectId);
      entry.put("ts", Long.toString(clock.instant().getEpochSecond()));
      entry.putAll(extra);
      store.listPushHead(keys.funnelEvents(), jsonCodec.toJson(entry));
      store.listTrim(keys.funnelEvents(), 0, MAX_EVENTS - 1);

      store.hashIncrement(keys.funnelCounters(), TOTAL, 1);
      store.hashIncrement(keys.funnelCounters(), event, 1);

      String dayKey = keys.funnelDay(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
      store.hashIncrement(dayKey, TOTAL, 1);
      store.hashIncrement(dayKey, event, 1);
      store.expire(dayKey, DAY_TTL);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record funnel event " + event + " for subject " + subjectId, e);
    }
  }

  /**
   * @return global counters by event name, including {@link #TOTAL}
   */
  public Map<String, Long> counters() {
    Map<String, Long> result = new LinkedHashMap<>();
    store.hashGetAll(keys.funnelCounters()).forEach((name, value) -> {
      try {
        result.put(name, Long.parseLong(value));
      } catch (NumberFormatException e) {
        logger.log(Level.FINE, "Ignoring non-numeric funnel counter {0}", name);
      }
    });
    return result;
  }
}
