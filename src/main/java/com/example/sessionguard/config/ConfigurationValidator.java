package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails application startup on the first invalid configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive, but was: %s";
  private static final String ERROR_MUST_BE_LESS = "%s (%s) must be less than %s (%s)";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final int MIN_SECRET_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate(properties);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  static List<String> validate(ApplicationProperties properties) {
    List<String> errors = new ArrayList<>();
    validateSessionConfig(properties.session(), errors);
    validateRateLimitConfig(properties.rateLimit(), properties.redis(), errors);
    validateRedisConfig(properties.redis(), errors);
    validateAuthConfig(properties.auth(), errors);
    return errors;
  }

  private static void validateSessionConfig(ApplicationProperties.SessionProperties session, List<String> errors) {
    requirePositive(session.idleTimeout(), "Session idle timeout", errors);
    requirePositive(session.absoluteTimeout(), "Session absolute timeout", errors);
    requirePositive(session.cleanupInterval(), "Session cleanup interval", errors);
    if (session.retentionGrace() == null || session.retentionGrace().isNegative()) {
      errors.add("Session retention grace cannot be negative.");
    }
    if (session.idleTimeout() != null && session.absoluteTimeout() != null
        && session.idleTimeout().compareTo(session.absoluteTimeout()) >= 0) {
      errors.add(ERROR_MUST_BE_LESS.formatted("Idle timeout", session.idleTimeout(),
                                              "absolute timeout", session.absoluteTimeout()));
    }
    for (String path : session.skipPaths()) {
      if (!path.startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Session skip path must start with a '/': " + path);
      }
    }
  }

  private static void validateRateLimitConfig(ApplicationProperties.RateLimitProperties rateLimit,
                                               ApplicationProperties.RedisProperties redis,
                                               List<String> errors) {
    requirePositive(rateLimit.defaultWindow(), "Default rate limit window", errors);
    requirePositive(rateLimit.timeout(), "Rate limit timeout", errors);
    requirePositive(rateLimit.fallback().sweepInterval(), "Rate limit fallback sweep interval", errors);
    requirePositive(rateLimit.fallback().retryInterval(), "Rate limit fallback retry interval", errors);

    if (rateLimit.timeout() != null && redis.timeout() != null
        && rateLimit.timeout().compareTo(redis.timeout()) >= 0) {
      errors.add(ERROR_MUST_BE_LESS.formatted("Rate limit timeout", rateLimit.timeout(),
                                              "Redis timeout", redis.timeout()));
    }

    for (ApplicationProperties.RateLimitProperties.RuleProperties rule : rateLimit.rules()) {
      if (rule.pattern() == null || !rule.pattern().startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Rate limit rule pattern must start with a '/': " + rule.pattern());
      }
      if (rule.limit() <= 0) {
        errors.add(ERROR_MUST_BE_POSITIVE.formatted("Rate limit for " + rule.pattern(), rule.limit()));
      }
      requirePositive(rule.window(), "Rate limit window for " + rule.pattern(), errors);
    }
  }

  private static void validateRedisConfig(ApplicationProperties.RedisProperties redis, List<String> errors) {
    requirePositive(redis.timeout(), "Redis timeout", errors);
    if ("cluster".equalsIgnoreCase(redis.mode())) {
      if (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank()) {
        errors.add("Redis cluster mode requires 'app.redis.cluster.nodes'.");
        return;
      }
      for (String node : redis.cluster().nodes().split(",")) {
        if (!node.trim().matches("^[^:\\s]+:\\d{1,5}$")) {
          errors.add("Redis cluster node must be host:port: " + node.trim());
        }
      }
    }
  }

  private static void validateAuthConfig(ApplicationProperties.AuthProperties auth, List<String> errors) {
    boolean hasJwks = StringUtils.hasText(auth.jwksUri());
    boolean hasSecret = StringUtils.hasText(auth.secret());
    if (hasJwks == hasSecret) {
      errors.add("Exactly one of 'app.auth.jwks-uri' or 'app.auth.secret' must be set.");
    }
    if (hasSecret && auth.secret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      errors.add("Token signing secret must be at least %d bytes.".formatted(MIN_SECRET_BYTES));
    }
    if (auth.clockSkew() == null || auth.clockSkew().isNegative()) {
      errors.add("Token clock skew cannot be negative.");
    }
  }

  private static void requirePositive(Duration duration, String name, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(name, duration));
    }
  }
}
