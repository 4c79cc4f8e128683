package com.example.sessionguard.exception;

import com.example.sessionguard.domain.ratelimit.RateLimitDecision;

/**
 * Carries a denied {@link RateLimitDecision} to the web layer.
 */
public class RateLimitExceededException extends RuntimeException {

  private final transient RateLimitDecision decision;

  public RateLimitExceededException(RateLimitDecision decision) {
    super("Rate limit exceeded. Try again in " + decision.retryAfterSeconds() + " seconds.");
    this.decision = decision;
  }

  public RateLimitDecision getDecision() {
    return decision;
  }
}
