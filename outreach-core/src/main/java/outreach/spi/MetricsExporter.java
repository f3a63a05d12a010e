package outreach.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events handled without error.
     */
    void incrementEventsDispatched();

    /**
     * Increments the count of events whose handler threw.
     */
    void incrementEventsFailed();

    /**
     * Increments the count of events dropped because they could not be decoded or routed.
     */
    void incrementEventsDropped();

    /**
     * Records the number of handler tasks currently holding an admission slot.
     *
     * @param inFlight tasks in flight (always non-negative)
     */
    void recordInFlight(int inFlight);

    /**
     * Increments the count of one-shot actions that ran.
     */
    void incrementFollowupsFired();

    /**
     * Increments the count of due entries consumed without running the action
     * (already fired, or the action declined).
     */
    default void incrementFollowupsSkipped() {
    }

    /**
     * Increments the count of payments confirmed for the first time.
     */
    void incrementPaymentsConfirmed();

    /**
     * Increments the count of payments that reached a terminal failure status.
     */
    void incrementPaymentsFailed();

    /**
     * Increments the count of gateway webhooks rejected for a bad signature.
     */
    default void incrementWebhooksRejected() {
    }

    /**
     * Increments the count of retry items delivered.
     */
    void incrementRetryDelivered();

    /**
     * Increments the count of retry items re-enqueued after another failure.
     */
    void incrementRetryRequeued();

    /**
     * Increments the count of retry items dropped (max attempts, malformed, unknown sink).
     */
    void incrementRetryDropped();

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsDispatched() {
        }

        @Override
        public void incrementEventsFailed() {
        }

        @Override
        public void incrementEventsDropped() {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }

        @Override
        public void incrementFollowupsFired() {
        }

        @Override
        public void incrementPaymentsConfirmed() {
        }

        @Override
        public void incrementPaymentsFailed() {
        }

        @Override
        public void incrementRetryDelivered() {
        }

        @Override
        public void incrementRetryRequeued() {
        }

        @Override
        public void incrementRetryDropped() {
        }
    }
}
