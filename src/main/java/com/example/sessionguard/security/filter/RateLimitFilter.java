package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.ratelimit.RateLimitDecision;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.service.RateLimitService;
import com.example.sessionguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the fixed-window rate limit to every API request before authentication.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

  public static final String HEADER_LIMIT = "X-RateLimit-Limit";
  public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  public static final String HEADER_RESET = "X-RateLimit-Reset";

  private final RateLimitService rateLimitService;
  private final ApplicationProperties properties;
  private final ErrorResponseWriter errorResponseWriter;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.rateLimit().enabled();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    RateLimitDecision decision;
    try {
      decision = rateLimitService.check(request);
    } catch (RuntimeException e) {
      log.error("Rate limit check failed for {}, letting request through", request.getRequestURI(), e);
      filterChain.doFilter(request, response);
      return;
    }

    writeHeaders(response, decision);
    if (!decision.allowed()) {
      response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
      errorResponseWriter.write(request, response, HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded",
                                "Rate limit exceeded. Try again in %d seconds".formatted(decision.retryAfterSeconds()));
      return;
    }

    filterChain.doFilter(request, response);
  }

  public static void writeHeaders(HttpServletResponse response, RateLimitDecision decision) {
    response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
    response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
    response.setHeader(HEADER_RESET, String.valueOf(decision.resetEpochSecond()));
  }
}
