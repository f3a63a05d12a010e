package outreach.redis;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.ListOperations.MoveFrom;
import org.springframework.data.redis.core.ListOperations.MoveTo;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import outreach.spi.KeyValueStore;
import outreach.spi.StoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} backed by Redis through Spring Data's {@link StringRedisTemplate}.
 *
 * <p>Each method maps to one Redis command: hashes to {@code HGET/HSET/HSETNX/HINCRBY},
 * sets to {@code SADD/SREM/SRANDMEMBER}, sorted sets to {@code ZADD/ZRANGEBYSCORE}, lists to
 * {@code RPUSH/LPOP/LMOVE/BLMOVE/LREM/LTRIM}. Moves use {@code LMOVE ... LEFT RIGHT}, so the
 * pop-and-park of the dispatch loop is atomic on the server.
 *
 * <p>Blocking moves hold a connection for up to the timeout; size the connection pool for
 * one blocked connection per dispatch loop on top of regular traffic.
 */
public final class RedisKeyValueStore implements KeyValueStore {

  private final StringRedisTemplate template;
  private final HashOperations<String, String, String> hashes;
  private final SetOperations<String, String> sets;
  private final ZSetOperations<String, String> sortedSets;
  private final ListOperations<String, String> lists;

  public RedisKeyValueStore(StringRedisTemplate template) {
    this.template = Objects.requireNonNull(template, "template");
    this.hashes = template.opsForHash();
    this.sets = template.opsForSet();
    this.sortedSets = template.opsForZSet();
    this.lists = template.opsForList();
  }

  // ── Hashes ──────────────────────────────────────────────────────

  @Override
  public String hashGet(String key, String field) {
    return execute("HGET", key, () -> hashes.get(key, field));
  }

  @Override
  public Map<String, String> hashGetAll(String key) {
    Map<String, String> entries = execute("HGETALL", key, () -> hashes.entries(key));
    return entries == null ? Map.of() : new LinkedHashMap<>(entries);
  }

  @Override
  public void hashPut(String key, String field, String value) {
    execute("HSET", key, () -> {
      hashes.put(key, field, value);
      return null;
    });
  }

  @Override
  public void hashPutAll(String key, Map<String, String> fields) {
    if (fields.isEmpty()) {
      return;
    }
    execute("HSET", key, () -> {
      hashes.putAll(key, fields);
      return null;
    });
  }

  @Override
  public boolean hashPutIfAbsent(String key, String field, String value) {
    return Boolean.TRUE.equals(execute("HSETNX", key, () -> hashes.putIfAbsent(key, field, value)));
  }

  @Override
  public long hashIncrement(String key, String field, long delta) {
    return orZero(execute("HINCRBY", key, () -> hashes.increment(key, field, delta)));
  }

  @Override
  public void hashDelete(String key, String field) {
    execute("HDEL", key, () -> hashes.delete(key, field));
  }

  // ── Sets ────────────────────────────────────────────────────────

  @Override
  public boolean setAdd(String key, String member) {
    return orZero(execute("SADD", key, () -> sets.add(key, member))) > 0;
  }

  @Override
  public boolean setRemove(String key, String member) {
    return orZero(execute("SREM", key, () -> sets.remove(key, member))) > 0;
  }

  @Override
  public boolean setContains(String key, String member) {
    return Boolean.TRUE.equals(execute("SISMEMBER", key, () -> sets.isMember(key, member)));
  }

  @Override
  public long setSize(String key) {
    return orZero(execute("SCARD", key, () -> sets.size(key)));
  }

  @Override
  public Set<String> setSample(String key, int count) {
    if (count <= 0) {
      return Set.of();
    }
    Set<String> members = execute("SRANDMEMBER", key, () -> sets.distinctRandomMembers(key, count));
    return members == null ? Set.of() : new LinkedHashSet<>(members);
  }

  // ── Sorted sets ─────────────────────────────────────────────────

  @Override
  public void sortedSetAdd(String key, String member, double score) {
    execute("ZADD", key, () -> sortedSets.add(key, member, score));
  }

  @Override
  public boolean sortedSetRemove(String key, String member) {
    return orZero(execute("ZREM", key, () -> sortedSets.remove(key, member))) > 0;
  }

  @Override
  public List<String> sortedSetRangeByScore(String key, double min, double max, int limit) {
    Set<String> members = execute("ZRANGEBYSCORE", key,
        () -> sortedSets.rangeByScore(key, min, max, 0, limit));
    return members == null ? List.of() : new ArrayList<>(members);
  }

  @Override
  public Double sortedSetScore(String key, String member) {
    return execute("ZSCORE", key, () -> sortedSets.score(key, member));
  }

  @Override
  public long sortedSetSize(String key) {
    return orZero(execute("ZCARD", key, () -> sortedSets.zCard(key)));
  }

  // ── Lists ───────────────────────────────────────────────────────

  @Override
  public long listPush(String key, String value) {
    return orZero(execute("RPUSH", key, () -> lists.rightPush(key, value)));
  }

  @Override
  public long listPushHead(String key, String value) {
    return orZero(execute("LPUSH", key, () -> lists.leftPush(key, value)));
  }

  @Override
  public String listPop(String key) {
    return execute("LPOP", key, () -> lists.leftPop(key));
  }

  @Override
  public String listMove(String source, String destination) {
    return execute("LMOVE", source,
        () -> lists.move(MoveFrom.fromHead(source), MoveTo.toTail(destination)));
  }

  @Override
  public String listMoveToHead(String source, String destination) {
    return execute("LMOVE", source,
        () -> lists.move(MoveFrom.fromTail(source), MoveTo.toHead(destination)));
  }

  @Override
  public String listBlockingMove(String source, String destination, Duration timeout) {
    return execute("BLMOVE", source,
        () -> lists.move(MoveFrom.fromHead(source), MoveTo.toTail(destination), timeout));
  }

  @Override
  public long listRemove(String key, String value, int count) {
    return orZero(execute("LREM", key, () -> lists.remove(key, count, value)));
  }

  @Override
  public List<String> listRange(String key, long start, long stop) {
    List<String> values = execute("LRANGE", key, () -> lists.range(key, start, stop));
    return values == null ? List.of() : values;
  }

  @Override
  public void listTrim(String key, long start, long stop) {
    execute("LTRIM", key, () -> {
      lists.trim(key, start, stop);
      return null;
    });
  }

  @Override
  public long listSize(String key) {
    return orZero(execute("LLEN", key, () -> lists.size(key)));
  }

  // ── Keys ────────────────────────────────────────────────────────

  @Override
  public void expire(String key, Duration ttl) {
    execute("EXPIRE", key, () -> template.expire(key, ttl));
  }

  @Override
  public void delete(String key) {
    execute("DEL", key, () -> template.delete(key));
  }

  private static <T> T execute(String command, String key, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException e) {
      throw translate(command, key, e);
    }
  }

  static StoreException translate(String command, String key, DataAccessException e) {
    String message = command + " " + key + " failed: " + e.getMessage();
    if (e instanceof RedisConnectionFailureException || e instanceof QueryTimeoutException) {
      return new StoreException(StoreException.Kind.UNAVAILABLE, message, e);
    }
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t.getMessage() != null && t.getMessage().contains("WRONGTYPE")) {
        return new StoreException(StoreException.Kind.WRONG_TYPE, message, e);
      }
    }
    return new StoreException(StoreException.Kind.FAILURE, message, e);
  }

  private static long orZero(Long value) {
    return value == null ? 0L : value;
  }
}
