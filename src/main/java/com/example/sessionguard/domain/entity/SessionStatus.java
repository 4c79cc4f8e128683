package com.example.sessionguard.domain.entity;

import java.time.Instant;

/**
 * Read-only view of a session's timing, used by clients to warn about idleness and expiry.
 */
public record SessionStatus(
    String sessionId,
    SessionState state,
    boolean active,
    boolean suspicious,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt,
    long idleSeconds,
    boolean idleWarning,
    long timeUntilExpirySeconds,
    long requestCount,
    DeviceType deviceType,
    String browser
) {}
