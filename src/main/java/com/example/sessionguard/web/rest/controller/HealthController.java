package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.adapter.counter.CounterStore;
import com.example.sessionguard.adapter.counter.FailoverCounterStore;
import com.example.sessionguard.adapter.redis.client.RedisHealthClient;
import com.example.sessionguard.adapter.redis.dto.RedisHealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_DEGRADED = "DEGRADED";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final RedisHealthClient redisHealthClient;
  private final CounterStore counterStore;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.millis()));
  }

  /**
   * Liveness probe - checks JVM health
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - session store must answer; the rate limiter may run degraded.
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    RedisHealthResponse redisHealth = redisHealthClient.checkHealth();

    Map<String, Object> redisStatus = new LinkedHashMap<>();
    redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
    if (redisHealth.version() != null) {
      redisStatus.put("version", redisHealth.version());
      redisStatus.put("usedMemoryBytes", redisHealth.usedMemoryBytes());
      redisStatus.put("connectedClients", redisHealth.connectedClients());
    }
    if (redisHealth.error() != null) {
      redisStatus.put("error", redisHealth.error());
    }

    Map<String, Object> rateLimitStatus = new LinkedHashMap<>();
    rateLimitStatus.put("store", counterStore.name());
    boolean degraded = counterStore instanceof FailoverCounterStore failover && failover.isDegraded();
    rateLimitStatus.put("status", degraded ? STATUS_DEGRADED : STATUS_UP);

    boolean ready = redisHealth.healthy();
    if (!ready) {
      log.warn("Readiness check failed: session store unreachable ({})", redisHealth.error());
    }

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("ready", ready);
    status.put("redis", redisStatus);
    status.put("rateLimit", rateLimitStatus);
    status.put("timestamp", clock.millis());

    return ResponseEntity.status(ready ? 200 : 503).body(status);
  }
}
