package outreach.retry;

/**
 * Names of the built-in notification sinks, as stored in retry items.
 */
public final class SinkNames {
  public static final String ANALYTICS_ORDER = "analytics-order";
  public static final String ANALYTICS_EVENT = "analytics-event";
  /** Payload is a subject id; delivery re-sends the access link. */
  public static final String ACCESS_DELIVERY = "access-delivery";

  private SinkNames() {
  }
}
