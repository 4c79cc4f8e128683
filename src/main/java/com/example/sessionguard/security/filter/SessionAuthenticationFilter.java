package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionPrincipal;
import com.example.sessionguard.domain.entity.VerifiedIdentity;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.security.BearerTokenIdentityResolver;
import com.example.sessionguard.service.SessionLifecycleService;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates API requests from the session cookie or session header, delegating validation to
 * {@link SessionLifecycleService}.
 *
 * <p>When no valid session is presented but the request carries a verified bearer token, the
 * token's subject gets a session (resumed or newly created) that is handed back as a cookie and
 * an {@code X-Session-ID} header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  public static final String SESSION_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".SESSION";

  private final SessionLifecycleService sessionLifecycleService;
  private final BearerTokenIdentityResolver identityResolver;
  private final ApplicationProperties properties;
  private final ErrorResponseWriter errorResponseWriter;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return properties.session().skipPaths().stream().anyMatch(path::startsWith);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    ApplicationProperties.SessionProperties sessionProps = properties.session();
    Optional<String> sessionId = resolveSessionId(request);

    Optional<Session> session = Optional.empty();
    if (sessionId.isPresent()) {
      session = sessionLifecycleService.validate(sessionId.get(), request);
      if (session.isEmpty()) {
        log.debug("Invalid session presented for {}, clearing cookie", request.getRequestURI());
        CookieUtil.clearSessionCookie(response, sessionProps.cookie());
      }
    }

    if (session.isEmpty()) {
      Optional<VerifiedIdentity> identity = identityResolver.resolve(request);
      if (identity.isPresent()) {
        VerifiedIdentity verified = identity.get();
        try {
          Session established = sessionLifecycleService.establish(
              verified.userId(), verified.externalSessionId(), request);
          CookieUtil.setSessionCookie(response, established.sessionId(), sessionProps.cookie(),
                                      sessionProps.absoluteTimeout());
          response.setHeader(sessionProps.sessionIdHeader(), established.sessionId());
          session = Optional.of(established);
        } catch (SessionStoreException e) {
          log.error("Could not establish session for user {}", verified.userId(), e);
          errorResponseWriter.write(request, response, HttpStatus.SERVICE_UNAVAILABLE,
                                    "service_unavailable", "Session store temporarily unavailable");
          return;
        }
      }
    }

    session.ifPresent(s -> authenticate(request, s));
    filterChain.doFilter(request, response);
  }

  private Optional<String> resolveSessionId(HttpServletRequest request) {
    ApplicationProperties.SessionProperties sessionProps = properties.session();
    Optional<String> sessionId = CookieUtil.getCookieValue(request, sessionProps.cookie().name());
    if (sessionId.isEmpty()) {
      sessionId = Optional.ofNullable(request.getHeader(sessionProps.sessionIdHeader()));
    }
    return sessionId.filter(CookieUtil::isValidSessionId);
  }

  private void authenticate(HttpServletRequest request, Session session) {
    if (session.suspicious()) {
      log.warn("Request {} {} on suspicious session for user {}: {}", request.getMethod(),
               request.getRequestURI(), session.userId(), session.suspiciousReason());
    }
    SessionPrincipal principal = new SessionPrincipal(session.userId(), session.sessionId(), session.suspicious());
    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
        principal, null, AuthorityUtils.createAuthorityList("ROLE_USER"));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    request.setAttribute(SESSION_ATTRIBUTE, session);
  }
}
