package outreach.store;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Key layout in the shared store.
 *
 * <p>All keys share a configurable prefix so several deployments can use one store.
 * With the default prefix {@code "outreach:"} the layout is:
 * <ul>
 *   <li>{@code outreach:updates}: inbound event queue (list)</li>
 *   <li>{@code outreach:updates:processing:<consumer>}: events popped but not yet acknowledged</li>
 *   <li>{@code outreach:user:<id>}: subject hash</li>
 *   <li>{@code outreach:utm:<id>}: campaign attribution hash</li>
 *   <li>{@code outreach:campaign:due}: due-time index (sorted set, epoch seconds)</li>
 *   <li>{@code outreach:pay:<id>}: payment record hash</li>
 *   <li>{@code outreach:pay:pending}: subjects with an open payment (set)</li>
 *   <li>{@code outreach:pay:identifier_map}: external id to subject (hash)</li>
 *   <li>{@code outreach:payerr:<id>}: last checkout creation error</li>
 *   <li>{@code outreach:retry:notifications}: retry queue (list)</li>
 *   <li>{@code outreach:access:delivery:<id>}: delivery record hash</li>
 *   <li>{@code outreach:portal:key:<key>}: access key index hash</li>
 *   <li>{@code outreach:funnel:*}: funnel events and counters</li>
 * </ul>
 */
public final class StoreKeys {
  public static final String DEFAULT_PREFIX = "outreach:";

  private final String prefix;

  public StoreKeys() {
    this(DEFAULT_PREFIX);
  }

  public StoreKeys(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (prefix.isEmpty()) {
      throw new IllegalArgumentException("prefix must not be empty");
    }
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public String eventQueue() {
    return prefix + "updates";
  }

  public String processing(String consumerId) {
    return prefix + "updates:processing:" + Objects.requireNonNull(consumerId, "consumerId");
  }

  public String subject(String subjectId) {
    return prefix + "user:" + subjectId;
  }

  public String attribution(String subjectId) {
    return prefix + "utm:" + subjectId;
  }

  public String dueIndex() {
    return prefix + "campaign:due";
  }

  public String payment(String subjectId) {
    return prefix + "pay:" + subjectId;
  }

  public String pendingPayments() {
    return prefix + "pay:pending";
  }

  public String identifierMap() {
    return prefix + "pay:identifier_map";
  }

  public String paymentError(String subjectId) {
    return prefix + "payerr:" + subjectId;
  }

  public String retryQueue() {
    return prefix + "retry:notifications";
  }

  public String delivery(String subjectId) {
    return prefix + "access:delivery:" + subjectId;
  }

  public String accessKey(String key) {
    return prefix + "portal:key:" + key;
  }

  public String funnelEvents() {
    return prefix + "funnel:events";
  }

  public String funnelCounters() {
    return prefix + "funnel:counters";
  }

  public String funnelDay(LocalDate day) {
    return prefix + "funnel:day:" + day;
  }
}
