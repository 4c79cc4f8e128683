package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.security.filter.RateLimitFilter;
import com.example.sessionguard.security.filter.SessionAuthenticationFilter;
import com.example.sessionguard.web.rest.errors.DelegatedAuthenticationEntryPoint;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Stateless security configuration for multi-instance deployment. Session state lives in Redis,
 * never in the servlet container.
 * <p>
 * Three filter chains: PUBLIC (@Order(1)) health, actuator and API docs; PROTECTED (@Order(2))
 * {@code /api/**} behind the rate limit and session filters; DEFAULT (@Order(3)) deny-all.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final RateLimitFilter rateLimitFilter;
  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;
  private final ApplicationProperties properties;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/actuator/**",
                         "/health/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    String[] skipPatterns = properties.session().skipPaths().stream()
        .map(path -> path + "/**")
        .toArray(String[]::new);

    http
        .securityMatcher("/api/**")
        .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        // Rate limiting runs first so rejected requests never touch the session store
        .addFilterBefore(rateLimitFilter, SessionAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> {
          if (skipPatterns.length > 0) {
            authorize.requestMatchers(skipPatterns).permitAll();
          }
          authorize.anyRequest().authenticated();
        })
        // JSON 401 instead of a login redirect
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Catches any URLs not matched by the public or protected chains
   */
  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  // The filters are components; keep the servlet container from running them outside the chains.
  @Bean
  public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
    FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration() {
    FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(sessionAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Session ids travel in an HttpOnly SameSite cookie or an explicit header
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true))
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma", "no-cache");
                       response.setHeader("Expires", "0");
                     }));
  }
}
