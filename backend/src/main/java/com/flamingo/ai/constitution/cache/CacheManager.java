package com.flamingo.ai.constitution.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Namespaced JSON cache over a {@link KeyValueStore}.
 *
 * <p>Every key is prefixed with the configured namespace. Backend failures never propagate: reads
 * degrade to a miss, writes to a no-op, counters to zero, and each failure is logged and counted in
 * {@code constitution.cache.errors}.
 */
@Component
@Slf4j
public class CacheManager {

  private final KeyValueStore store;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final String prefix;

  public CacheManager(
      KeyValueStore store,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      ConstitutionProperties properties) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.prefix = properties.getCache().getPrefix();
  }

  /** Returns the namespaced key actually stored in the backend. */
  public String fullKey(String key) {
    return prefix + ":" + key;
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    return read(key, json -> objectMapper.readValue(json, type));
  }

  public <T> Optional<T> get(String key, TypeReference<T> type) {
    return read(key, json -> objectMapper.readValue(json, type));
  }

  /**
   * Serializes and stores a value.
   *
   * @return true if the value was written
   */
  public boolean set(String key, Object value, Duration ttl) {
    String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      log.warn("Cannot serialize value for cache key {}: {}", key, e.getOriginalMessage());
      recordError("serialize");
      return false;
    }
    try {
      store.set(fullKey(key), json, ttl);
      log.debug("Cached {} (ttl={})", key, ttl);
      return true;
    } catch (RuntimeException e) {
      degraded("set", key, e);
      return false;
    }
  }

  public boolean delete(String key) {
    try {
      return store.delete(fullKey(key));
    } catch (RuntimeException e) {
      degraded("delete", key, e);
      return false;
    }
  }

  public boolean exists(String key) {
    try {
      return store.exists(fullKey(key));
    } catch (RuntimeException e) {
      degraded("exists", key, e);
      return false;
    }
  }

  public long increment(String key) {
    return increment(key, 1L);
  }

  /**
   * Adds to a counter, creating it at zero when missing.
   *
   * @return the new value, or 0 when the backend is unavailable
   */
  public long increment(String key, long amount) {
    try {
      return store.incrementBy(fullKey(key), amount);
    } catch (RuntimeException e) {
      degraded("increment", key, e);
      return 0L;
    }
  }

  /** Reads a counter written by {@link #increment(String)}; missing counters read as zero. */
  public long getCounter(String key) {
    try {
      return store.get(fullKey(key)).map(Long::parseLong).orElse(0L);
    } catch (RuntimeException e) {
      degraded("getCounter", key, e);
      return 0L;
    }
  }

  public boolean expire(String key, Duration ttl) {
    try {
      return store.expire(fullKey(key), ttl);
    } catch (RuntimeException e) {
      degraded("expire", key, e);
      return false;
    }
  }

  /**
   * Deletes every key matching a pattern relative to the namespace, e.g. {@code search:*}.
   *
   * @return number of deleted keys, or 0 when the backend is unavailable
   */
  public long clearPattern(String pattern) {
    try {
      long deleted = store.deleteMatching(fullKey(pattern));
      log.info("Cleared {} cache entries matching {}", deleted, pattern);
      return deleted;
    } catch (RuntimeException e) {
      degraded("clearPattern", pattern, e);
      return 0L;
    }
  }

  /** Writes, reads back and deletes a probe key. */
  public boolean healthCheck() {
    String probe = "ok-" + System.nanoTime();
    if (!set(CacheKeys.HEALTH_CHECK, probe, Duration.ofSeconds(10))) {
      return false;
    }
    boolean healthy = get(CacheKeys.HEALTH_CHECK, String.class).map(probe::equals).orElse(false);
    delete(CacheKeys.HEALTH_CHECK);
    return healthy;
  }

  private <T> Optional<T> read(String key, JsonReader<T> reader) {
    Optional<String> raw;
    try {
      raw = store.get(fullKey(key));
    } catch (RuntimeException e) {
      degraded("get", key, e);
      return Optional.empty();
    }
    if (raw.isEmpty()) {
      log.debug("Cache miss: {}", key);
      recordLookup(key, "miss");
      return Optional.empty();
    }
    try {
      T value = reader.read(raw.get());
      log.debug("Cache hit: {}", key);
      recordLookup(key, "hit");
      return Optional.ofNullable(value);
    } catch (JsonProcessingException e) {
      log.warn("Discarding undecodable cache entry {}: {}", key, e.getOriginalMessage());
      recordError("deserialize");
      return Optional.empty();
    }
  }

  private void degraded(String operation, String key, RuntimeException e) {
    log.warn(
        "Cache {} failed for {}, continuing without cache: {}", operation, key, e.getMessage());
    recordError(operation);
  }

  private void recordLookup(String key, String result) {
    meterRegistry
        .counter("constitution.cache.lookups", "namespace", namespaceOf(key), "result", result)
        .increment();
  }

  private void recordError(String operation) {
    meterRegistry.counter("constitution.cache.errors", "operation", operation).increment();
  }

  private static String namespaceOf(String key) {
    int colon = key.indexOf(':');
    return colon < 0 ? key : key.substring(0, colon);
  }

  @FunctionalInterface
  private interface JsonReader<T> {
    T read(String json) throws JsonProcessingException;
  }
}
