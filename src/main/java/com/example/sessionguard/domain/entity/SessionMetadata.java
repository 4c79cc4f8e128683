package com.example.sessionguard.domain.entity;

/**
 * Client signals captured when a session is created.
 */
public record SessionMetadata(
    String ipAddress,
    String userAgent,
    DeviceType deviceType,
    String browser,
    String os,
    /**
     * Truncated SHA-256 of the request headers and client IP, compared on every validation.
     */
    String fingerprint
) {}
