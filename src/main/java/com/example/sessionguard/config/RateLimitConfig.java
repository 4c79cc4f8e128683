package com.example.sessionguard.config;

import com.example.sessionguard.adapter.counter.CounterStore;
import com.example.sessionguard.adapter.counter.FailoverCounterStore;
import com.example.sessionguard.adapter.counter.InMemoryCounterStore;
import com.example.sessionguard.adapter.counter.RedisCounterStore;
import com.example.sessionguard.properties.ApplicationProperties;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the counter store backing the rate limiter.
 *
 * <p>{@code redis} counts in Redis and falls back to the in-process counter while Redis is
 * unreachable; {@code memory} counts in-process only.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RateLimitConfig {

  private static final String STORE_MEMORY = "memory";

  private final ApplicationProperties properties;

  @Bean
  public InMemoryCounterStore inMemoryCounterStore() {
    return new InMemoryCounterStore(properties.rateLimit().fallback().maxEntries());
  }

  @Bean
  @Primary
  public CounterStore counterStore(
      InMemoryCounterStore inMemoryCounterStore,
      @Qualifier(RedisConfig.RATE_LIMIT_TEMPLATE) ObjectProvider<StringRedisTemplate> rateLimitRedisTemplate) {
    if (STORE_MEMORY.equalsIgnoreCase(properties.rateLimit().store())) {
      log.info("Rate limit counters held in memory (max {} keys)", properties.rateLimit().fallback().maxEntries());
      return inMemoryCounterStore;
    }
    StringRedisTemplate template = rateLimitRedisTemplate.getObject();
    Duration retryInterval = properties.rateLimit().fallback().retryInterval();
    log.info("Rate limit counters held in Redis with in-memory fallback (retry every {})", retryInterval);
    return new FailoverCounterStore(new RedisCounterStore(template), inMemoryCounterStore, retryInterval);
  }
}
