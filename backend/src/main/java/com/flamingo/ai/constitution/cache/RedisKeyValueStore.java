package com.flamingo.ai.constitution.cache;

import com.flamingo.ai.constitution.exception.CacheUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Redis {@link KeyValueStore} using a pooled Jedis client. Calls go through the {@code redis}
 * circuit breaker so an outage fails fast instead of blocking on socket timeouts.
 */
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

  private static final int SCAN_BATCH_SIZE = 500;

  private final JedisPooled jedis;

  public RedisKeyValueStore(JedisPooled jedis) {
    this.jedis = jedis;
  }

  @Override
  @CircuitBreaker(name = "redis")
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(jedis.get(key));
    } catch (JedisException e) {
      throw new CacheUnavailableException("get", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public void set(String key, String value, Duration ttl) {
    try {
      if (ttl == null || ttl.isZero() || ttl.isNegative()) {
        jedis.set(key, value);
      } else {
        jedis.setex(key, Math.max(1L, ttl.toSeconds()), value);
      }
    } catch (JedisException e) {
      throw new CacheUnavailableException("set", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public boolean delete(String key) {
    try {
      return jedis.del(key) > 0;
    } catch (JedisException e) {
      throw new CacheUnavailableException("delete", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public boolean exists(String key) {
    try {
      return jedis.exists(key);
    } catch (JedisException e) {
      throw new CacheUnavailableException("exists", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public long incrementBy(String key, long amount) {
    try {
      return jedis.incrBy(key, amount);
    } catch (JedisException e) {
      throw new CacheUnavailableException("incrementBy", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public boolean expire(String key, Duration ttl) {
    try {
      return jedis.expire(key, Math.max(1L, ttl.toSeconds())) == 1L;
    } catch (JedisException e) {
      throw new CacheUnavailableException("expire", e);
    }
  }

  @Override
  @CircuitBreaker(name = "redis")
  public long deleteMatching(String pattern) {
    try {
      ScanParams params = new ScanParams().match(pattern).count(SCAN_BATCH_SIZE);
      String cursor = ScanParams.SCAN_POINTER_START;
      long deleted = 0;
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        List<String> keys = page.getResult();
        if (!keys.isEmpty()) {
          deleted += jedis.del(keys.toArray(new String[0]));
        }
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
      return deleted;
    } catch (JedisException e) {
      throw new CacheUnavailableException("deleteMatching", e);
    }
  }

  @Override
  public void close() {
    log.info("Closing Redis connection pool");
    jedis.close();
  }
}
