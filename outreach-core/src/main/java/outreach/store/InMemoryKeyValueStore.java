package outreach.store;

import outreach.spi.KeyValueStore;
import outreach.spi.StoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Process-local {@link KeyValueStore} for tests, demos and single-process deployments.
 *
 * <p>All operations synchronize on one monitor, which makes every call atomic and lets
 * {@link #listBlockingMove} wait for pushes. Expiry is evaluated lazily against the supplied
 * {@link Clock}, so tests can advance time without sleeping.
 *
 * <p>State does not survive a restart.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

  private final Clock clock;
  private final Map<String, Entry> entries = new HashMap<>();

  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  public InMemoryKeyValueStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  // ── Hashes ──────────────────────────────────────────────────────

  @Override
  public synchronized String hashGet(String key, String field) {
    Map<String, String> hash = read(key, Type.HASH);
    return hash == null ? null : hash.get(field);
  }

  @Override
  public synchronized Map<String, String> hashGetAll(String key) {
    Map<String, String> hash = read(key, Type.HASH);
    return hash == null ? Map.of() : new LinkedHashMap<>(hash);
  }

  @Override
  public synchronized void hashPut(String key, String field, String value) {
    Map<String, String> hash = write(key, Type.HASH);
    hash.put(field, Objects.requireNonNull(value, "value"));
  }

  @Override
  public synchronized void hashPutAll(String key, Map<String, String> fields) {
    if (fields.isEmpty()) {
      return;
    }
    Map<String, String> hash = write(key, Type.HASH);
    fields.forEach((f, v) -> hash.put(f, Objects.requireNonNull(v, f)));
  }

  @Override
  public synchronized boolean hashPutIfAbsent(String key, String field, String value) {
    Map<String, String> hash = write(key, Type.HASH);
    return hash.putIfAbsent(field, Objects.requireNonNull(value, "value")) == null;
  }

  @Override
  public synchronized long hashIncrement(String key, String field, long delta) {
    Map<String, String> hash = write(key, Type.HASH);
    String current = hash.get(field);
    long value;
    try {
      value = current == null ? 0L : Long.parseLong(current);
    } catch (NumberFormatException e) {
      throw new StoreException(StoreException.Kind.WRONG_TYPE,
          "Hash field " + key + "/" + field + " is not an integer", e);
    }
    long next = value + delta;
    hash.put(field, Long.toString(next));
    return next;
  }

  @Override
  public synchronized void hashDelete(String key, String field) {
    Map<String, String> hash = read(key, Type.HASH);
    if (hash != null) {
      hash.remove(field);
      dropIfEmpty(key, hash.isEmpty());
    }
  }

  // ── Sets ────────────────────────────────────────────────────────

  @Override
  public synchronized boolean setAdd(String key, String member) {
    Set<String> set = write(key, Type.SET);
    return set.add(Objects.requireNonNull(member, "member"));
  }

  @Override
  public synchronized boolean setRemove(String key, String member) {
    Set<String> set = read(key, Type.SET);
    if (set == null) {
      return false;
    }
    boolean removed = set.remove(member);
    dropIfEmpty(key, set.isEmpty());
    return removed;
  }

  @Override
  public synchronized boolean setContains(String key, String member) {
    Set<String> set = read(key, Type.SET);
    return set != null && set.contains(member);
  }

  @Override
  public synchronized long setSize(String key) {
    Set<String> set = read(key, Type.SET);
    return set == null ? 0 : set.size();
  }

  @Override
  public synchronized Set<String> setSample(String key, int count) {
    Set<String> set = read(key, Type.SET);
    if (set == null || count <= 0) {
      return Set.of();
    }
    List<String> members = new ArrayList<>(set);
    Collections.shuffle(members, ThreadLocalRandom.current());
    return new LinkedHashSet<>(members.subList(0, Math.min(count, members.size())));
  }

  // ── Sorted sets ─────────────────────────────────────────────────

  @Override
  public synchronized void sortedSetAdd(String key, String member, double score) {
    Map<String, Double> zset = write(key, Type.SORTED_SET);
    zset.put(Objects.requireNonNull(member, "member"), score);
  }

  @Override
  public synchronized boolean sortedSetRemove(String key, String member) {
    Map<String, Double> zset = read(key, Type.SORTED_SET);
    if (zset == null) {
      return false;
    }
    boolean removed = zset.remove(member) != null;
    dropIfEmpty(key, zset.isEmpty());
    return removed;
  }

  @Override
  public synchronized List<String> sortedSetRangeByScore(String key, double min, double max, int limit) {
    Map<String, Double> zset = read(key, Type.SORTED_SET);
    if (zset == null || limit <= 0) {
      return List.of();
    }
    return zset.entrySet().stream()
        .filter(e -> e.getValue() >= min && e.getValue() <= max)
        .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
        .limit(limit)
        .map(Map.Entry::getKey)
        .toList();
  }

  @Override
  public synchronized Double sortedSetScore(String key, String member) {
    Map<String, Double> zset = read(key, Type.SORTED_SET);
    return zset == null ? null : zset.get(member);
  }

  @Override
  public synchronized long sortedSetSize(String key) {
    Map<String, Double> zset = read(key, Type.SORTED_SET);
    return zset == null ? 0 : zset.size();
  }

  // ── Lists ───────────────────────────────────────────────────────

  @Override
  public synchronized long listPush(String key, String value) {
    LinkedList<String> list = write(key, Type.LIST);
    list.addLast(Objects.requireNonNull(value, "value"));
    notifyAll();
    return list.size();
  }

  @Override
  public synchronized long listPushHead(String key, String value) {
    LinkedList<String> list = write(key, Type.LIST);
    list.addFirst(Objects.requireNonNull(value, "value"));
    notifyAll();
    return list.size();
  }

  @Override
  public synchronized String listPop(String key) {
    LinkedList<String> list = read(key, Type.LIST);
    if (list == null) {
      return null;
    }
    String value = list.pollFirst();
    dropIfEmpty(key, list.isEmpty());
    return value;
  }

  @Override
  public synchronized String listMove(String source, String destination) {
    String value = listPop(source);
    if (value != null) {
      LinkedList<String> target = write(destination, Type.LIST);
      target.addLast(value);
    }
    return value;
  }

  @Override
  public synchronized String listMoveToHead(String source, String destination) {
    LinkedList<String> list = read(source, Type.LIST);
    if (list == null) {
      return null;
    }
    String value = list.pollLast();
    dropIfEmpty(source, list.isEmpty());
    if (value != null) {
      LinkedList<String> target = write(destination, Type.LIST);
      target.addFirst(value);
      notifyAll();
    }
    return value;
  }

  @Override
  public synchronized String listBlockingMove(String source, String destination, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      String value = listMove(source, destination);
      if (value != null) {
        return value;
      }
      long remainingNanos = deadline - System.nanoTime();
      if (remainingNanos <= 0) {
        return null;
      }
      try {
        long millis = Math.max(1L, remainingNanos / 1_000_000L);
        wait(millis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StoreException(StoreException.Kind.UNAVAILABLE, "Interrupted while waiting on " + source, e);
      }
    }
  }

  @Override
  public synchronized long listRemove(String key, String value, int count) {
    LinkedList<String> list = read(key, Type.LIST);
    if (list == null) {
      return 0;
    }
    long removed = 0;
    var it = list.iterator();
    while (it.hasNext() && (count <= 0 || removed < count)) {
      if (it.next().equals(value)) {
        it.remove();
        removed++;
      }
    }
    dropIfEmpty(key, list.isEmpty());
    return removed;
  }

  @Override
  public synchronized List<String> listRange(String key, long start, long stop) {
    LinkedList<String> list = read(key, Type.LIST);
    if (list == null) {
      return List.of();
    }
    int size = list.size();
    int from = (int) Math.max(0, start < 0 ? size + start : start);
    int to = (int) Math.min(size - 1L, stop < 0 ? size + stop : stop);
    if (from > to) {
      return List.of();
    }
    return new ArrayList<>(list.subList(from, to + 1));
  }

  @Override
  public synchronized void listTrim(String key, long start, long stop) {
    LinkedList<String> list = read(key, Type.LIST);
    if (list == null) {
      return;
    }
    List<String> kept = listRange(key, start, stop);
    list.clear();
    list.addAll(kept);
    dropIfEmpty(key, list.isEmpty());
  }

  @Override
  public synchronized long listSize(String key) {
    LinkedList<String> list = read(key, Type.LIST);
    return list == null ? 0 : list.size();
  }

  // ── Keys ────────────────────────────────────────────────────────

  @Override
  public synchronized void expire(String key, Duration ttl) {
    Entry entry = live(key);
    if (entry != null) {
      entry.expiresAt = clock.instant().plus(ttl);
    }
  }

  @Override
  public synchronized void delete(String key) {
    entries.remove(key);
  }

  /**
   * @return the instant the key expires, or {@code null} if it is absent or has no TTL
   */
  public synchronized Instant expiresAt(String key) {
    Entry entry = live(key);
    return entry == null ? null : entry.expiresAt;
  }

  // ── Internals ───────────────────────────────────────────────────

  private Entry live(String key) {
    Entry entry = entries.get(key);
    if (entry != null && entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
      entries.remove(key);
      return null;
    }
    return entry;
  }

  @SuppressWarnings("unchecked")
  private <T> T read(String key, Type type) {
    Entry entry = live(Objects.requireNonNull(key, "key"));
    if (entry == null) {
      return null;
    }
    if (entry.type != type) {
      throw new StoreException(StoreException.Kind.WRONG_TYPE,
          "Key " + key + " holds a " + entry.type + ", not a " + type);
    }
    return (T) entry.value;
  }

  private <T> T write(String key, Type type) {
    T existing = read(key, type);
    if (existing != null) {
      return existing;
    }
    Entry entry = new Entry(type, type.create());
    entries.put(key, entry);
    @SuppressWarnings("unchecked")
    T created = (T) entry.value;
    return created;
  }

  private void dropIfEmpty(String key, boolean empty) {
    if (empty) {
      entries.remove(key);
    }
  }

  private enum Type {
    HASH, SET, SORTED_SET, LIST;

    Object create() {
      return switch (this) {
        case HASH -> new LinkedHashMap<String, String>();
        case SET -> new LinkedHashSet<String>();
        case SORTED_SET -> new HashMap<String, Double>();
        case LIST -> new LinkedList<String>();
      };
    }
  }

  private static final class Entry {
    private final Type type;
    private final Object value;
    private Instant expiresAt;

    private Entry(Type type, Object value) {
      this.type = type;
      this.value = value;
    }
  }
}
