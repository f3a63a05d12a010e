package outreach.spi;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared state store used as durable queue, due-time index, dedup ledger and retry buffer.
 *
 * <p>Every method is a single-key atomic operation. No operation spans keys except the list
 * moves, which the backing store performs atomically. Implementations must be thread-safe
 * and must translate backend failures into {@link StoreException}.
 *
 * <p>Sorted-set scores are epoch seconds. Missing keys behave as empty structures.
 *
 * @see outreach.store.InMemoryKeyValueStore
 */
public interface KeyValueStore {

  // ── Hashes ──────────────────────────────────────────────────────

  /**
   * @return the field value, or {@code null} if the key or field is absent
   */
  String hashGet(String key, String field);

  /**
   * @return a snapshot of all fields (never {@code null}, empty when absent)
   */
  Map<String, String> hashGetAll(String key);

  void hashPut(String key, String field, String value);

  void hashPutAll(String key, Map<String, String> fields);

  /**
   * Sets the field only if it does not exist yet.
   *
   * @return {@code true} if this call created the field
   */
  boolean hashPutIfAbsent(String key, String field, String value);

  /**
   * Atomically adds {@code delta} to an integer field, treating a missing field as zero.
   *
   * @return the value after the increment
   */
  long hashIncrement(String key, String field, long delta);

  void hashDelete(String key, String field);

  // ── Sets ────────────────────────────────────────────────────────

  /**
   * @return {@code true} if the member was not present before
   */
  boolean setAdd(String key, String member);

  /**
   * @return {@code true} if the member was present and is now removed
   */
  boolean setRemove(String key, String member);

  boolean setContains(String key, String member);

  long setSize(String key);

  /**
   * Returns up to {@code count} distinct members chosen at random.
   */
  Set<String> setSample(String key, int count);

  // ── Sorted sets ─────────────────────────────────────────────────

  /**
   * Adds the member or moves it to the new score.
   */
  void sortedSetAdd(String key, String member, double score);

  /**
   * @return {@code true} if the member was present and is now removed
   */
  boolean sortedSetRemove(String key, String member);

  /**
   * Returns up to {@code limit} members with {@code min <= score <= max}, lowest score first.
   */
  List<String> sortedSetRangeByScore(String key, double min, double max, int limit);

  /**
   * @return the member's score, or {@code null} if absent
   */
  Double sortedSetScore(String key, String member);

  long sortedSetSize(String key);

  // ── Lists ───────────────────────────────────────────────────────

  /**
   * Appends to the tail.
   *
   * @return the list length after the push
   */
  long listPush(String key, String value);

  /**
   * Prepends to the head.
   *
   * @return the list length after the push
   */
  long listPushHead(String key, String value);

  /**
   * Removes and returns the head, or {@code null} when empty.
   */
  String listPop(String key);

  /**
   * Atomically moves the head of {@code source} to the tail of {@code destination}.
   *
   * @return the moved value, or {@code null} when the source is empty
   */
  String listMove(String source, String destination);

  /**
   * Atomically moves the tail of {@code source} to the head of {@code destination}. Repeating
   * it until the source is empty puts the source's elements in front of the destination in
   * their original order.
   *
   * @return the moved value, or {@code null} when the source is empty
   */
  String listMoveToHead(String source, String destination);

  /**
   * Like {@link #listMove} but waits up to {@code timeout} for an element to arrive.
   *
   * @return the moved value, or {@code null} on timeout
   */
  String listBlockingMove(String source, String destination, Duration timeout);

  /**
   * Removes up to {@code count} occurrences of {@code value}, scanning from the head.
   *
   * @return the number of removed elements
   */
  long listRemove(String key, String value, int count);

  /**
   * Returns elements {@code start..stop} inclusive; negative indexes count from the tail.
   */
  List<String> listRange(String key, long start, long stop);

  /**
   * Keeps only elements {@code start..stop} inclusive.
   */
  void listTrim(String key, long start, long stop);

  long listSize(String key);

  // ── Keys ────────────────────────────────────────────────────────

  /**
   * Sets a time-to-live on an existing key. No-op if the key is absent.
   */
  void expire(String key, Duration ttl);

  void delete(String key);
}
