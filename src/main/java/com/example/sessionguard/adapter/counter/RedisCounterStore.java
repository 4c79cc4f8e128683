package com.example.sessionguard.adapter.counter;

import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import com.example.sessionguard.exception.CounterStoreUnavailableException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Shared fixed-window counter backed by Redis.
 * Increment and expiry arming run in one script so concurrent first requests cannot extend the window twice.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

  static final String INCREMENT_SCRIPT_SOURCE = """
      local count = redis.call('INCR', KEYS[1])
      if count == 1 then
        redis.call('PEXPIRE', KEYS[1], ARGV[1])
      end
      local ttl = redis.call('PTTL', KEYS[1])
      if ttl < 0 then
        redis.call('PEXPIRE', KEYS[1], ARGV[1])
        ttl = tonumber(ARGV[1])
      end
      return {count, ttl}
      """;

  @SuppressWarnings("rawtypes")
  static final RedisScript<List> INCREMENT_SCRIPT =
      new DefaultRedisScript<>(INCREMENT_SCRIPT_SOURCE, List.class);

  private final StringRedisTemplate redisTemplate;

  @Override
  @SuppressWarnings("unchecked")
  public CounterWindow incrementWithExpiry(RateLimitKey key, Duration window, Instant now) {
    String storeKey = key.storeKey();
    List<Object> result;
    try {
      result = redisTemplate.execute(INCREMENT_SCRIPT, List.of(storeKey), String.valueOf(window.toMillis()));
    } catch (RuntimeException e) {
      throw new CounterStoreUnavailableException("Redis increment failed for " + storeKey, e);
    }

    if (result == null || result.size() != 2) {
      throw new CounterStoreUnavailableException(
          "Unexpected Redis increment reply for " + storeKey + ": " + result, null);
    }

    long count = ((Number) result.get(0)).longValue();
    long ttlMillis = ((Number) result.get(1)).longValue();
    Instant resetAt = count == 1 ? now.plus(window) : now.plusMillis(ttlMillis);

    log.trace("Redis counter {} = {} (resets at {})", storeKey, count, resetAt);
    return new CounterWindow(count, resetAt);
  }

  @Override
  public String name() {
    return "redis";
  }
}
