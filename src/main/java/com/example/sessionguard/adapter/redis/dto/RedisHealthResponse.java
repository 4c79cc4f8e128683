package com.example.sessionguard.adapter.redis.dto;

/**
 * Result of probing the session store Redis.
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    long usedMemoryBytes,
    int connectedClients,
    String error
) {
  public static RedisHealthResponse up(long responseTimeMs, String version,
                                       long usedMemoryBytes, int connectedClients) {
    return new RedisHealthResponse(true, responseTimeMs, version, usedMemoryBytes, connectedClients, null);
  }

  public static RedisHealthResponse down(long responseTimeMs, String error) {
    return new RedisHealthResponse(false, responseTimeMs, null, 0, 0, error);
  }
}
