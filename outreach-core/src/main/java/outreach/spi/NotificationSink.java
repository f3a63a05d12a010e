package outreach.spi;

/**
 * Outbound notification sink (analytics order sink, analytics event sink).
 *
 * <p>Payloads are opaque serialized strings; failures are retried through
 * {@link outreach.retry.RetryQueue}.
 */
@FunctionalInterface
public interface NotificationSink {

  CallResult<Void> send(String payload);
}
