package com.flamingo.ai.constitution.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Low-level string key-value backend behind the {@link CacheManager}.
 *
 * <p>Implementations raise {@link com.flamingo.ai.constitution.exception.CacheUnavailableException}
 * when the backend cannot serve a request. Keys passed in are already namespaced.
 */
public interface KeyValueStore extends AutoCloseable {

  /**
   * Reads a raw value.
   *
   * @param key the full key
   * @return the stored value, or empty when absent or expired
   */
  Optional<String> get(String key);

  /**
   * Stores a value, replacing any previous one and its expiry.
   *
   * @param key the full key
   * @param value the value
   * @param ttl time to live; {@code null} or zero stores without expiry
   */
  void set(String key, String value, Duration ttl);

  /**
   * Removes a key.
   *
   * @param key the full key
   * @return true if a value was removed
   */
  boolean delete(String key);

  /**
   * Checks whether a live value exists.
   *
   * @param key the full key
   * @return true if present and not expired
   */
  boolean exists(String key);

  /**
   * Atomically adds to an integer counter. A missing key starts at zero and is created without
   * expiry; an existing key keeps its expiry.
   *
   * @param key the full key
   * @param amount the delta
   * @return the value after the increment
   */
  long incrementBy(String key, long amount);

  /**
   * Sets a new expiry on an existing key.
   *
   * @param key the full key
   * @param ttl time to live
   * @return true if the key existed
   */
  boolean expire(String key, Duration ttl);

  /**
   * Deletes every key matching a glob pattern.
   *
   * <p>Only {@code *} (any run of characters, including none) is portable. The in-memory store
   * matches {@code ?} and {@code [...]} literally, while Redis applies its full glob syntax, so
   * callers build patterns from literal text and {@code *} alone.
   *
   * @param pattern the full-key pattern
   * @return the number of deleted keys
   */
  long deleteMatching(String pattern);

  @Override
  default void close() {}
}
