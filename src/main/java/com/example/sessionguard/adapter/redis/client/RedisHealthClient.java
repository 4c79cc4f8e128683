package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.adapter.redis.dto.RedisHealthResponse;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis health check client for the session store connection
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String PONG = "PONG";

  private final StringRedisTemplate redisTemplate;

  /**
   * PING plus a few INFO fields. Never throws; failures come back as an unhealthy response.
   */
  public RedisHealthResponse checkHealth() {
    long startTime = System.nanoTime();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());

      if (!PONG.equals(pingResponse)) {
        return RedisHealthResponse.down(elapsedMillis(startTime), "Invalid PING response: " + pingResponse);
      }

      long responseTime = elapsedMillis(startTime);
      Properties info = getRedisInfo();

      return RedisHealthResponse.up(
          responseTime,
          info.getProperty("redis_version", "unknown"),
          parseLong(info.getProperty("used_memory", "0")),
          (int) parseLong(info.getProperty("connected_clients", "0")));

    } catch (RuntimeException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.down(elapsedMillis(startTime), e.getMessage());
    }
  }

  private Properties getRedisInfo() {
    try {
      Properties props = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());
      return props != null ? props : new Properties();
    } catch (RuntimeException e) {
      log.warn("Failed to get Redis INFO: {}", e.getMessage());
      return new Properties();
    }
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
