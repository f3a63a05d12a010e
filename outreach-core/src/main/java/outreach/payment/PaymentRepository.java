package outreach.payment;

import outreach.spi.ErrorKind;
import outreach.spi.KeyValueStore;
import outreach.spi.PaymentGateway;
import outreach.store.StoreKeys;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Payment hashes, the pending index and the identifier map.
 *
 * <p>The {@code confirmed_at} field is written once with a put-if-absent and never removed;
 * the effective status of a record that carries it is {@link PaymentStatus#OK} whatever
 * status a slower signal wrote afterwards.
 */
public final class PaymentRepository {
  static final String TRANSACTION_ID = "transaction_id";
  static final String IDENTIFIER = "identifier";
  static final String STATUS = "status";
  static final String RAW_STATUS = "raw_status";
  static final String AMOUNT = "amount";
  static final String CHECKOUT_URL = "checkout_url";
  static final String CREATED_AT = "created_at";
  static final String LAST_SEEN_AT = "last_seen_at";
  static final String CONFIRMED_AT = "confirmed_at";

  private static final Duration ERROR_TTL = Duration.ofDays(1);

  private final KeyValueStore store;
  private final StoreKeys keys;
  private final Clock clock;

  public PaymentRepository(KeyValueStore store, StoreKeys keys, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Optional<PaymentRecord> find(String subjectId) {
    Map<String, String> h = store.hashGetAll(keys.payment(subjectId));
    if (h.isEmpty()) {
      return Optional.empty();
    }
    Instant confirmedAt = instant(h.get(CONFIRMED_AT));
    return Optional.of(new PaymentRecord(
        subjectId,
        h.get(TRANSACTION_ID),
        h.get(IDENTIFIER),
        confirmedAt != null ? PaymentStatus.OK : storedStatus(h),
        h.get(RAW_STATUS),
        amount(h.get(AMOUNT)),
        h.get(CHECKOUT_URL),
        instant(h.get(CREATED_AT)),
        confirmedAt));
  }

  /**
   * Stores a freshly created checkout, maps both identifiers to the subject and adds the
   * subject to the pending index.
   */
  public void saveCheckout(String subjectId, String identifier, BigDecimal amount,
      PaymentGateway.Checkout checkout) {
    PaymentStatus status = StatusNormalizer.normalize(checkout.rawStatus());
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(TRANSACTION_ID, checkout.transactionId());
    fields.put(IDENTIFIER, identifier);
    fields.put(STATUS, status.name());
    fields.put(RAW_STATUS, checkout.rawStatus() == null ? "" : checkout.rawStatus());
    fields.put(AMOUNT, amount.toPlainString());
    fields.put(CHECKOUT_URL, checkout.checkoutUrl());
    fields.put(CREATED_AT, Long.toString(clock.instant().getEpochSecond()));
    store.hashPutAll(keys.payment(subjectId), fields);
    mapIdentifier(checkout.transactionId(), subjectId);
    mapIdentifier(identifier, subjectId);
    store.setAdd(keys.pendingPayments(), subjectId);
  }

  /**
   * Writes the latest observed status.
   */
  public void recordStatus(String subjectId, PaymentStatus status, String rawStatus) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(STATUS, status.name());
    fields.put(RAW_STATUS, rawStatus == null ? "" : rawStatus);
    fields.put(LAST_SEEN_AT, Long.toString(clock.instant().getEpochSecond()));
    store.hashPutAll(keys.payment(subjectId), fields);
  }

  /**
   * Records external identifiers learned from a signal, if not known yet.
   */
  public void recordIdentifiers(String subjectId, ExternalIds ids) {
    String key = keys.payment(subjectId);
    if (ids.transactionId() != null) {
      store.hashPutIfAbsent(key, TRANSACTION_ID, ids.transactionId());
    }
    for (String id : ids.all()) {
      mapIdentifier(id, subjectId);
    }
  }

  /**
   * Claims the one-time confirmation of the subject's payment.
   *
   * @return {@code true} for exactly one caller per record
   */
  public boolean claimConfirmation(String subjectId) {
    return store.hashPutIfAbsent(keys.payment(subjectId), CONFIRMED_AT,
        Long.toString(clock.instant().getEpochSecond()));
  }

  public boolean isConfirmed(String subjectId) {
    return store.hashGet(keys.payment(subjectId), CONFIRMED_AT) != null;
  }

  public void mapIdentifier(String externalId, String subjectId) {
    if (externalId != null && !externalId.isEmpty()) {
      store.hashPut(keys.identifierMap(), externalId, subjectId);
    }
  }

  /**
   * @return the subject owning {@code externalId}, or {@code null}
   */
  public String resolve(String externalId) {
    if (externalId == null || externalId.isEmpty()) {
      return null;
    }
    return store.hashGet(keys.identifierMap(), externalId);
  }

  public void addPending(String subjectId) {
    store.setAdd(keys.pendingPayments(), subjectId);
  }

  public boolean removePending(String subjectId) {
    return store.setRemove(keys.pendingPayments(), subjectId);
  }

  public boolean isPending(String subjectId) {
    return store.setContains(keys.pendingPayments(), subjectId);
  }

  public Set<String> samplePending(int count) {
    return store.setSample(keys.pendingPayments(), count);
  }

  public long pendingCount() {
    return store.setSize(keys.pendingPayments());
  }

  /**
   * Keeps the last checkout creation failure for a day, for support lookups.
   */
  public void recordError(String subjectId, ErrorKind kind, String message) {
    String key = keys.paymentError(subjectId);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("kind", kind.name());
    fields.put("message", message == null ? "" : message);
    fields.put("at", Long.toString(clock.instant().getEpochSecond()));
    store.hashPutAll(key, fields);
    store.expire(key, ERROR_TTL);
  }

  public Map<String, String> lastError(String subjectId) {
    return store.hashGetAll(keys.paymentError(subjectId));
  }

  private static PaymentStatus storedStatus(Map<String, String> h) {
    String status = h.get(STATUS);
    for (PaymentStatus candidate : PaymentStatus.values()) {
      if (candidate.name().equals(status)) {
        return candidate;
      }
    }
    return StatusNormalizer.normalize(h.get(RAW_STATUS));
  }

  private static Instant instant(String epochSeconds) {
    if (epochSeconds == null || epochSeconds.isEmpty()) {
      return null;
    }
    try {
      return Instant.ofEpochSecond(Long.parseLong(epochSeconds));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static BigDecimal amount(String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(value);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
