package com.example.sessionguard.web.rest.dto;

import com.example.sessionguard.domain.entity.DeviceType;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionState;
import java.time.Instant;

/**
 * Client-facing view of a session. Never carries the fingerprint; the CSRF token is only included
 * for the caller's own current session.
 */
public record SessionSummary(
    String sessionId,
    SessionState state,
    boolean current,
    boolean suspicious,
    String suspiciousReason,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt,
    long requestCount,
    String lastEndpoint,
    String ipAddress,
    DeviceType deviceType,
    String browser,
    String os,
    String csrfToken
) {

  public static SessionSummary from(Session session, String currentSessionId) {
    boolean current = session.sessionId().equals(currentSessionId);
    return new SessionSummary(
        session.sessionId(),
        session.state(),
        current,
        session.suspicious(),
        session.suspiciousReason(),
        session.createdAt(),
        session.lastActivity(),
        session.expiresAt(),
        session.requestCount(),
        session.lastEndpoint(),
        session.metadata() != null ? session.metadata().ipAddress() : null,
        session.metadata() != null ? session.metadata().deviceType() : null,
        session.metadata() != null ? session.metadata().browser() : null,
        session.metadata() != null ? session.metadata().os() : null,
        current ? session.csrfToken() : null);
  }
}
