package com.flamingo.ai.constitution.config;

import com.flamingo.ai.constitution.cache.InMemoryKeyValueStore;
import com.flamingo.ai.constitution.cache.KeyValueStore;
import com.flamingo.ai.constitution.cache.RedisKeyValueStore;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

/** Selects the key-value backend used by the cache manager. */
@Configuration
@Slf4j
public class CacheConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "constitution.cache",
      name = "backend",
      havingValue = "memory",
      matchIfMissing = true)
  public KeyValueStore inMemoryKeyValueStore(ConstitutionProperties properties) {
    return new InMemoryKeyValueStore(
        properties.getCache().getMaximumSize(), Ticker.systemTicker());
  }

  @Bean
  @ConditionalOnProperty(prefix = "constitution.cache", name = "backend", havingValue = "redis")
  public KeyValueStore redisKeyValueStore(ConstitutionProperties properties) {
    ConstitutionProperties.Redis redis = properties.getCache().getRedis();
    log.info("Connecting cache to Redis at {}:{}", redis.getHost(), redis.getPort());
    DefaultJedisClientConfig clientConfig =
        DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(redis.getTimeoutMillis())
            .socketTimeoutMillis(redis.getTimeoutMillis())
            .password(
                redis.getPassword() == null || redis.getPassword().isBlank()
                    ? null
                    : redis.getPassword())
            .database(redis.getDatabase())
            .build();
    return new RedisKeyValueStore(
        new JedisPooled(new HostAndPort(redis.getHost(), redis.getPort()), clientConfig));
  }
}
