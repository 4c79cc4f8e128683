package com.example.sessionguard.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Session Guard application.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @DefaultValue @NotNull @Valid SessionProperties session,
    @DefaultValue @NotNull @Valid RateLimitProperties rateLimit,
    @DefaultValue @NotNull @Valid SecurityProperties security,
    @DefaultValue @NotNull @Valid RedisProperties redis,
    @DefaultValue @NotNull @Valid AuthProperties auth
) {

  /**
   * Session lifecycle configuration
   */
  public record SessionProperties(
      @DefaultValue("5") @Positive int maxConcurrentSessions,
      @DefaultValue("30m") @DurationUnit(ChronoUnit.MINUTES) Duration idleTimeout,
      @DefaultValue("12h") @DurationUnit(ChronoUnit.HOURS) Duration absoluteTimeout,
      @DefaultValue("0.8") @DecimalMin("0.1") @DecimalMax("1.0") double idleWarningRatio,
      @DefaultValue("100") @Positive int suspiciousRequestThreshold,
      @DefaultValue("24h") @DurationUnit(ChronoUnit.HOURS) Duration retentionGrace,
      @DefaultValue("1h") @DurationUnit(ChronoUnit.MINUTES) Duration cleanupInterval,
      @DefaultValue @NotNull @Valid CookieProperties cookie,
      @DefaultValue("X-Session-ID") @NotBlank String sessionIdHeader,
      @DefaultValue({"/api/auth", "/api/v1/webhooks"}) List<String> skipPaths
  ) {
    public record CookieProperties(
        @DefaultValue("session_id") @NotBlank String name,
        @DefaultValue("true") boolean secure,
        @DefaultValue("Lax") @Pattern(regexp = "Strict|Lax|None") String sameSite,
        String domain
    ) {}
  }

  /**
   * Fixed-window rate limiting configuration
   */
  public record RateLimitProperties(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String store,
      @DefaultValue("60") @Positive int defaultLimit,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration defaultWindow,
      @DefaultValue("250ms") @DurationUnit(ChronoUnit.MILLIS) Duration timeout,
      @DefaultValue @NotNull @Valid FallbackProperties fallback,
      @DefaultValue @NotNull List<@Valid RuleProperties> rules
  ) {
    public record FallbackProperties(
        @DefaultValue("100000") @Positive int maxEntries,
        @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration sweepInterval,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration retryInterval
    ) {}

    public record RuleProperties(
        @NotBlank String pattern,
        @Positive int limit,
        @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration window
    ) {}
  }

  /**
   * Request trust configuration
   */
  public record SecurityProperties(
      @DefaultValue("false") boolean trustForwardedHeaders,
      @DefaultValue("1") @Positive int trustedProxyCount
  ) {}

  /**
   * Bearer token verification for the identity a new session is created for. Exactly one of
   * {@code jwksUri} (RS256) or {@code secret} (HS256) must be set.
   */
  public record AuthProperties(
      String jwksUri,
      String secret,
      String issuerUri,
      String audience,
      @DefaultValue("sub") @NotBlank String userIdClaim,
      @DefaultValue("sid") @NotBlank String sessionIdClaim,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration clockSkew
  ) {}

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("0") @Min(0) int database,
      @DefaultValue @NotNull @Valid SslProperties ssl,
      @DefaultValue @Valid ClusterProperties cluster,
      @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
