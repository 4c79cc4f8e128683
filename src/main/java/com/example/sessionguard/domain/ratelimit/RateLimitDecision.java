package com.example.sessionguard.domain.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a rate limit check. A denial is an expected result, not an error.
 */
public record RateLimitDecision(
    boolean allowed,
    int limit,
    long remaining,
    Instant resetAt,
    long retryAfterSeconds
) {

  public static RateLimitDecision evaluate(CounterWindow window, int limit, Instant now) {
    if (window.count() > limit) {
      long retryAfter = Math.max(0, Duration.between(now, window.resetAt()).toSeconds());
      return new RateLimitDecision(false, limit, 0, window.resetAt(), retryAfter);
    }
    return new RateLimitDecision(true, limit, Math.max(0, limit - window.count()), window.resetAt(), 0);
  }

  /**
   * Used when the limiter itself fails; requests are never rejected for infrastructure reasons.
   */
  public static RateLimitDecision unchecked(int limit, Instant resetAt) {
    return new RateLimitDecision(true, limit, limit, resetAt, 0);
  }

  public long resetEpochSecond() {
    return resetAt.getEpochSecond();
  }
}
