package com.flamingo.ai.constitution.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.constitution.exception.CacheUnavailableException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest {

  private final AtomicLong nanos = new AtomicLong();
  private InMemoryKeyValueStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyValueStore(1_000, nanos::get);
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  @Nested
  @DisplayName("expiry")
  class Expiry {

    @Test
    @DisplayName("should return value before ttl and nothing after")
    void shouldExpireAfterTtl() {
      store.set("k", "v", Duration.ofMinutes(10));

      advance(Duration.ofMinutes(9));
      assertThat(store.get("k")).contains("v");

      advance(Duration.ofMinutes(2));
      assertThat(store.get("k")).isEmpty();
      assertThat(store.exists("k")).isFalse();
    }

    @Test
    @DisplayName("should keep values without ttl")
    void shouldKeepValuesWithoutTtl() {
      store.set("k", "v", null);

      advance(Duration.ofDays(365));

      assertThat(store.get("k")).contains("v");
    }

    @Test
    @DisplayName("should apply a new ttl with expire")
    void shouldApplyNewTtl() {
      store.set("k", "v", null);

      assertThat(store.expire("k", Duration.ofSeconds(30))).isTrue();
      advance(Duration.ofSeconds(31));

      assertThat(store.get("k")).isEmpty();
      assertThat(store.expire("missing", Duration.ofSeconds(30))).isFalse();
    }
  }

  @Nested
  @DisplayName("counters")
  class Counters {

    @Test
    @DisplayName("should start missing counters at zero")
    void shouldStartAtZero() {
      assertThat(store.incrementBy("c", 1)).isEqualTo(1);
      assertThat(store.incrementBy("c", 1)).isEqualTo(2);
      assertThat(store.incrementBy("c", 5)).isEqualTo(7);
      assertThat(store.get("c")).contains("7");
    }

    @Test
    @DisplayName("should keep the existing ttl on increment")
    void shouldKeepTtlOnIncrement() {
      store.incrementBy("c", 1);
      store.expire("c", Duration.ofMinutes(1));

      advance(Duration.ofSeconds(40));
      store.incrementBy("c", 1);
      advance(Duration.ofSeconds(30));

      assertThat(store.get("c")).isEmpty();
    }

    @Test
    @DisplayName("should reject incrementing a non-numeric value")
    void shouldRejectNonNumeric() {
      store.set("k", "\"text\"", null);

      assertThatThrownBy(() -> store.incrementBy("k", 1))
          .isInstanceOf(CacheUnavailableException.class);
    }
  }

  @Test
  @DisplayName("should delete only keys matching the pattern")
  void shouldDeleteMatching() {
    store.set("constitution:search:a", "1", null);
    store.set("constitution:search:b", "2", null);
    store.set("constitution:chapter:1", "3", null);

    long deleted = store.deleteMatching("constitution:search:*");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.exists("constitution:search:a")).isFalse();
    assertThat(store.exists("constitution:chapter:1")).isTrue();
  }

  @Test
  @DisplayName("should treat ? and [...] in patterns as literal characters")
  void shouldMatchOnlyStarWildcards() {
    store.set("user:abc:last", "1", null);
    store.set("user:a?c:last", "2", null);
    store.set("user:[ab]:last", "3", null);

    assertThat(store.deleteMatching("user:a?c:*")).isEqualTo(1);
    assertThat(store.deleteMatching("user:[ab]:*")).isEqualTo(1);
    assertThat(store.exists("user:abc:last")).isTrue();
    assertThat(store.exists("user:a?c:last")).isFalse();
  }

  @Test
  @DisplayName("should report whether delete removed a value")
  void shouldReportDelete() {
    store.set("k", "v", null);

    assertThat(store.delete("k")).isTrue();
    assertThat(store.delete("k")).isFalse();
  }
}
