package com.example.sessionguard.security;

import com.example.sessionguard.domain.entity.VerifiedIdentity;
import com.example.sessionguard.properties.ApplicationProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller's identity from an {@code Authorization: Bearer} token. Only tokens that
 * pass signature, expiry, issuer and audience checks yield an identity; nothing else on the
 * request is trusted to name a user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerTokenIdentityResolver {

  private static final String BEARER_PREFIX = "Bearer ";

  private final JwtDecoder jwtDecoder;
  private final ApplicationProperties properties;

  public Optional<VerifiedIdentity> resolve(HttpServletRequest request) {
    String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    String token = authorization.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      return Optional.empty();
    }

    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtException e) {
      log.warn("Rejected bearer token on {} from {}: {}", request.getRequestURI(), request.getRemoteAddr(),
               e.getMessage());
      return Optional.empty();
    }

    ApplicationProperties.AuthProperties auth = properties.auth();
    String userId = jwt.getClaimAsString(auth.userIdClaim());
    if (userId == null || userId.isBlank()) {
      log.warn("Bearer token without a '{}' claim on {}", auth.userIdClaim(), request.getRequestURI());
      return Optional.empty();
    }
    return Optional.of(new VerifiedIdentity(userId, jwt.getClaimAsString(auth.sessionIdClaim())));
  }
}
