package outreach.subject;

import outreach.spi.KeyValueStore;
import outreach.store.StoreKeys;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and mutates subject hashes. Every mutation is a single-key write and safe to repeat.
 *
 * <p>Each write refreshes the record's time-to-live, so a write to an expired subject never
 * leaves a record that lives forever; records of subjects that stop interacting expire on
 * their own.
 */
public final class SubjectRepository {
  static final String CHAT_ID = "chat_id";
  static final String PAID = "paid";
  static final String FOLLOWUP_FIRED = "followup_fired";
  static final String BLOCKED = "blocked";
  static final String OWNER_TAG = "owner_tag";
  static final String CREATED_AT = "created_at";
  static final String ATTRIBUTED_AT = "ts";

  private final KeyValueStore store;
  private final StoreKeys keys;
  private final String ownerTag;
  private final Duration ttl;
  private final Clock clock;

  public SubjectRepository(KeyValueStore store, StoreKeys keys, String ownerTag, Duration ttl, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.ownerTag = Objects.requireNonNull(ownerTag, "ownerTag");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be > 0");
    }
  }

  /**
   * The owner tag this process writes into records it registers.
   */
  public String ownerTag() {
    return ownerTag;
  }

  /**
   * Records the chat address and claims the subject for this deployment.
   */
  public void register(String subjectId, String chatId) {
    String key = keys.subject(subjectId);
    Map<String, String> fields = new LinkedHashMap<>();
    if (chatId != null) {
      fields.put(CHAT_ID, chatId);
    }
    fields.put(OWNER_TAG, ownerTag);
    store.hashPutAll(key, fields);
    store.hashPutIfAbsent(key, CREATED_AT, Long.toString(clock.instant().getEpochSecond()));
    store.expire(key, ttl);
  }

  public Optional<Subject> find(String subjectId) {
    Map<String, String> h = store.hashGetAll(keys.subject(subjectId));
    if (h.isEmpty()) {
      return Optional.empty();
    }
    String created = h.get(CREATED_AT);
    return Optional.of(new Subject(
        subjectId,
        h.get(CHAT_ID),
        "1".equals(h.get(PAID)),
        parseLong(h.get(FOLLOWUP_FIRED)),
        "1".equals(h.get(BLOCKED)),
        h.get(OWNER_TAG),
        created == null ? null : Instant.ofEpochSecond(parseLong(created))));
  }

  public String chatId(String subjectId) {
    return store.hashGet(keys.subject(subjectId), CHAT_ID);
  }

  public void markPaid(String subjectId) {
    String key = keys.subject(subjectId);
    store.hashPut(key, PAID, "1");
    store.expire(key, ttl);
  }

  public boolean isPaid(String subjectId) {
    return "1".equals(store.hashGet(keys.subject(subjectId), PAID));
  }

  public void markBlocked(String subjectId) {
    String key = keys.subject(subjectId);
    store.hashPut(key, BLOCKED, "1");
    store.expire(key, ttl);
  }

  /**
   * Clears the blocked flag; a subject that writes again can be reached again.
   */
  public void clearBlocked(String subjectId) {
    store.hashDelete(keys.subject(subjectId), BLOCKED);
  }

  public boolean isBlocked(String subjectId) {
    return "1".equals(store.hashGet(keys.subject(subjectId), BLOCKED));
  }

  public long followupFired(String subjectId) {
    return parseLong(store.hashGet(keys.subject(subjectId), FOLLOWUP_FIRED));
  }

  /**
   * Atomically claims one firing of the followup.
   *
   * @return the fired count including this claim
   */
  public long claimFollowup(String subjectId) {
    String key = keys.subject(subjectId);
    long fired = store.hashIncrement(key, FOLLOWUP_FIRED, 1);
    store.expire(key, ttl);
    return fired;
  }

  /**
   * Starts a new followup cycle.
   */
  public void resetFollowup(String subjectId) {
    String key = keys.subject(subjectId);
    store.hashPut(key, FOLLOWUP_FIRED, "0");
    store.expire(key, ttl);
  }

  /**
   * Stores campaign attribution beside the subject record, with the same time-to-live. Fields
   * from a later start overwrite earlier ones of the same name.
   */
  public void saveAttribution(String subjectId, Map<String, String> fields) {
    if (fields.isEmpty()) {
      return;
    }
    String key = keys.attribution(subjectId);
    Map<String, String> values = new LinkedHashMap<>(fields);
    values.put(ATTRIBUTED_AT, Long.toString(clock.instant().getEpochSecond()));
    store.hashPutAll(key, values);
    store.expire(key, ttl);
  }

  /**
   * @return the stored attribution fields, empty when the subject has none
   */
  public Map<String, String> attribution(String subjectId) {
    Map<String, String> fields = new LinkedHashMap<>(store.hashGetAll(keys.attribution(subjectId)));
    fields.remove(ATTRIBUTED_AT);
    return fields;
  }

  private static long parseLong(String value) {
    if (value == null || value.isEmpty()) {
      return 0L;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return 0L;
    }
  }
}
