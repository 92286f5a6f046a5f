package com.flamingo.ai.constitution.cache;

import com.flamingo.ai.constitution.exception.CacheUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.PatternMatchUtils;

/** Process-local {@link KeyValueStore} backed by a Caffeine cache with per-entry expiry. */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Cache<String, Entry> cache;

  public InMemoryKeyValueStore(long maximumSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .build();
    log.info("In-memory cache backend initialized (maximumSize={})", maximumSize);
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    cache.put(key, new Entry(value, toNanos(ttl), false));
  }

  @Override
  public boolean delete(String key) {
    return cache.asMap().remove(key) != null;
  }

  @Override
  public boolean exists(String key) {
    return cache.getIfPresent(key) != null;
  }

  @Override
  public long incrementBy(String key, long amount) {
    try {
      Entry updated =
          cache
              .asMap()
              .compute(
                  key,
                  (k, current) ->
                      current == null
                          ? new Entry(String.valueOf(amount), 0L, false)
                          : new Entry(
                              String.valueOf(Long.parseLong(current.value()) + amount),
                              current.ttlNanos(),
                              true));
      return Long.parseLong(updated.value());
    } catch (NumberFormatException e) {
      throw new CacheUnavailableException("incrementBy", e);
    }
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return cache
            .asMap()
            .computeIfPresent(key, (k, current) -> new Entry(current.value(), toNanos(ttl), false))
        != null;
  }

  @Override
  public long deleteMatching(String pattern) {
    List<String> matching =
        cache.asMap().keySet().stream()
            .filter(key -> PatternMatchUtils.simpleMatch(pattern, key))
            .toList();
    matching.forEach(cache::invalidate);
    return matching.size();
  }

  @Override
  public void close() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  private static long toNanos(Duration ttl) {
    return ttl == null || ttl.isZero() || ttl.isNegative() ? 0L : ttl.toNanos();
  }

  /** Stored value with its own time to live; {@code keepTtl} marks in-place counter updates. */
  private record Entry(String value, long ttlNanos, boolean keepTtl) {}

  private static final class EntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttlNanos() > 0 ? entry.ttlNanos() : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      if (entry.keepTtl()) {
        return currentDuration;
      }
      return entry.ttlNanos() > 0 ? entry.ttlNanos() : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
