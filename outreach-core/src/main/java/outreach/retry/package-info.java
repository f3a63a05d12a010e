/**
 * At-least-once delivery of outbound notifications.
 *
 * <p>{@link outreach.retry.NotificationPublisher} tries a sink once and, on failure, appends a
 * {@link outreach.retry.RetryItem} to the {@link outreach.retry.RetryQueue}, which a periodic
 * drain retries up to a fixed number of attempts. Sinks are looked up by name
 * (see {@link outreach.retry.SinkNames}), so queued items survive restarts.
 */
package outreach.retry;
