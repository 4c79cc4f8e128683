package com.example.sessionguard.domain.ratelimit;

import java.util.Objects;

/**
 * Identifies one rate limit budget: a client calling one endpoint.
 */
public record RateLimitKey(String endpoint, String clientKey) {

  public static final String KEY_PREFIX = "ratelimit:";

  public RateLimitKey {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(clientKey, "clientKey");
  }

  public String storeKey() {
    return KEY_PREFIX + endpoint + ":" + clientKey;
  }
}
