package com.example.sessionguard.service;

import com.example.sessionguard.adapter.counter.CounterStore;
import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitDecision;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import com.example.sessionguard.domain.ratelimit.RateLimitRule;
import com.example.sessionguard.exception.RateLimitExceededException;
import com.example.sessionguard.properties.ApplicationProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;

/**
 * Fixed-window rate limiting per (client, endpoint).
 *
 * <p>Counting is delegated to the configured {@link CounterStore}. Infrastructure failures never
 * turn into a denial: if counting fails outright the request is let through.
 */
@Slf4j
@Service
public class RateLimitService {

  private final CounterStore counterStore;
  private final FingerprintService fingerprintService;
  private final Clock clock;
  private final RateLimitRule defaultRule;
  private final List<RateLimitRule> rules;
  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public RateLimitService(
      CounterStore counterStore,
      FingerprintService fingerprintService,
      ApplicationProperties properties,
      Clock clock) {
    this.counterStore = counterStore;
    this.fingerprintService = fingerprintService;
    this.clock = clock;

    ApplicationProperties.RateLimitProperties rateLimitProps = properties.rateLimit();
    this.defaultRule = new RateLimitRule("/**", rateLimitProps.defaultLimit(), rateLimitProps.defaultWindow());
    this.rules = rateLimitProps.rules().stream()
        .map(rule -> new RateLimitRule(rule.pattern(), rule.limit(), rule.window()))
        .toList();
  }

  /**
   * Count one request for {@code clientKey} on {@code endpoint} and report the remaining budget.
   */
  public RateLimitDecision check(String clientKey, String endpoint, int limit, Duration window) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Rate limit must be positive: " + limit);
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("Rate limit window must be positive: " + window);
    }

    RateLimitKey key = new RateLimitKey(endpoint, clientKey != null ? clientKey : "unknown");
    Instant now = clock.instant();

    try {
      CounterWindow counter = counterStore.incrementWithExpiry(key, window, now);
      RateLimitDecision decision = RateLimitDecision.evaluate(counter, limit, now);
      if (!decision.allowed()) {
        log.info("Rate limit exceeded for {} on {} ({}/{}), retry in {}s",
                 maskIpAddress(key.clientKey()), endpoint, counter.count(), limit,
                 decision.retryAfterSeconds());
      }
      return decision;
    } catch (RuntimeException e) {
      log.error("Rate limiting failed for {}, allowing request", key.storeKey(), e);
      return RateLimitDecision.unchecked(limit, now.plus(window));
    }
  }

  /**
   * Same as {@link #check(String, String, int, Duration)} but raises when over the limit.
   *
   * @throws RateLimitExceededException if the budget for the window is spent
   */
  public RateLimitDecision checkOrThrow(String clientKey, String endpoint, int limit, Duration window) {
    RateLimitDecision decision = check(clientKey, endpoint, limit, window);
    if (!decision.allowed()) {
      throw new RateLimitExceededException(decision);
    }
    return decision;
  }

  /**
   * Check a request against the rule matching its path.
   */
  public RateLimitDecision check(HttpServletRequest request) {
    String path = request.getRequestURI();
    RateLimitRule rule = resolveRule(path);
    return check(fingerprintService.getClientIpAddress(request), path, rule.limit(), rule.window());
  }

  /**
   * First configured rule whose pattern matches, else the default rule.
   */
  public RateLimitRule resolveRule(String path) {
    for (RateLimitRule rule : rules) {
      if (pathMatcher.match(rule.pattern(), path)) {
        return rule;
      }
    }
    return defaultRule;
  }

  private String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
