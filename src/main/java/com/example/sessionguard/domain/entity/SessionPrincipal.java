package com.example.sessionguard.domain.entity;

/**
 * Authenticated identity placed in the security context for a validated session.
 */
public record SessionPrincipal(
    String userId,
    String sessionId,
    boolean suspicious
) {}
