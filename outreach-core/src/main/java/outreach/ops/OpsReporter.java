package outreach.ops;

import outreach.funnel.FunnelRecorder;
import outreach.spi.KeyValueStore;
import outreach.store.StoreKeys;

import java.util.Objects;

/**
 * Reads the operational counters exposed on the admin surface.
 */
public final class OpsReporter {

  private final KeyValueStore store;
  private final StoreKeys keys;
  private final String consumerId;
  private final FunnelRecorder funnel;

  public OpsReporter(KeyValueStore store, StoreKeys keys, String consumerId, FunnelRecorder funnel) {
    this.store = Objects.requireNonNull(store, "store");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.consumerId = Objects.requireNonNull(consumerId, "consumerId");
    this.funnel = Objects.requireNonNull(funnel, "funnel");
  }

  public OpsSnapshot snapshot() {
    return new OpsSnapshot(
        store.listSize(keys.eventQueue()),
        store.listSize(keys.processing(consumerId)),
        store.setSize(keys.pendingPayments()),
        store.sortedSetSize(keys.dueIndex()),
        store.listSize(keys.retryQueue()),
        funnel.counters());
  }
}
