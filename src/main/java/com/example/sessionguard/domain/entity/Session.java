package com.example.sessionguard.domain.entity;

import java.time.Instant;

/**
 * An authenticated user session as held by the session store.
 * Sessions are never physically removed when they end; their {@link SessionState} changes instead.
 */
public record Session(
    String sessionId,
    String csrfToken,
    String userId,
    String externalSessionId,
    SessionMetadata metadata,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt,
    SessionState state,
    boolean suspicious,
    String suspiciousReason,
    long requestCount,
    String lastEndpoint
) {

  /**
   * A session authenticates only while ACTIVE and before its absolute expiry, whether or not the
   * store has caught up with the expiry yet.
   */
  public boolean isActiveAt(Instant now) {
    return state == SessionState.ACTIVE && now.isBefore(expiresAt);
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public Session markSuspicious(String reason) {
    return new Session(sessionId, csrfToken, userId, externalSessionId, metadata, createdAt,
                       lastActivity, expiresAt, state, true,
                       suspiciousReason != null ? suspiciousReason : reason,
                       requestCount, lastEndpoint);
  }
}
