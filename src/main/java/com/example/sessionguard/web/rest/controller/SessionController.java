package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionPrincipal;
import com.example.sessionguard.domain.entity.SessionStatus;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.service.SessionLifecycleService;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.web.rest.dto.SessionSummary;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Session management REST controller. The caller is identified by the session the
 * authentication filter validated for this request.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionLifecycleService sessionLifecycleService;
  private final ApplicationProperties properties;
  private final HttpServletResponse response;

  @Override
  public ResponseEntity<SessionStatus> getCurrentSession(SessionPrincipal principal) {
    SessionStatus status = sessionLifecycleService.getSessionStatus(requirePrincipal(principal).sessionId())
        .orElseThrow(() -> new SessionException("Session not found"));
    return ResponseEntity.ok(status);
  }

  @Override
  public ResponseEntity<Map<String, Object>> refresh(SessionPrincipal principal) {
    Session session = sessionLifecycleService.refresh(requirePrincipal(principal).sessionId())
        .orElseThrow(() -> new SessionException("Session is no longer active"));

    CookieUtil.setSessionCookie(response, session.sessionId(), properties.session().cookie(),
                                properties.session().absoluteTimeout());
    return ResponseEntity.ok(Map.of(
        "sessionId", session.sessionId(),
        "expiresAt", session.expiresAt().toString()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(SessionPrincipal principal) {
    boolean ended = sessionLifecycleService.end(requirePrincipal(principal).sessionId());
    CookieUtil.clearSessionCookie(response, properties.session().cookie());
    return ResponseEntity.ok(Map.of("loggedOut", ended));
  }

  @Override
  public ResponseEntity<Map<String, Object>> logoutAll(SessionPrincipal principal, boolean keepCurrent) {
    SessionPrincipal caller = requirePrincipal(principal);
    int ended = sessionLifecycleService.endAll(caller.userId(), keepCurrent ? caller.sessionId() : null);
    if (!keepCurrent) {
      CookieUtil.clearSessionCookie(response, properties.session().cookie());
    }
    return ResponseEntity.ok(Map.of(
        "sessionsEnded", ended,
        "currentSessionKept", keepCurrent));
  }

  @Override
  public ResponseEntity<List<SessionSummary>> listSessions(SessionPrincipal principal, boolean activeOnly, int limit) {
    SessionPrincipal caller = requirePrincipal(principal);
    List<SessionSummary> sessions = sessionLifecycleService.listSessions(caller.userId(), activeOnly, limit).stream()
        .map(session -> SessionSummary.from(session, caller.sessionId()))
        .toList();
    return ResponseEntity.ok(sessions);
  }

  @Override
  public ResponseEntity<Map<String, Object>> endSession(SessionPrincipal principal, String sessionId) {
    SessionPrincipal caller = requirePrincipal(principal);
    boolean ended = sessionLifecycleService.endOwnedSession(caller.userId(), sessionId);
    if (sessionId.equals(caller.sessionId())) {
      CookieUtil.clearSessionCookie(response, properties.session().cookie());
    }
    return ResponseEntity.ok(Map.of(
        "sessionId", sessionId,
        "ended", ended));
  }

  private SessionPrincipal requirePrincipal(SessionPrincipal principal) {
    if (principal == null) {
      throw new SessionException("No session found");
    }
    return principal;
  }
}
