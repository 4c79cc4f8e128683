package com.example.sessionguard.domain.ratelimit;

import java.time.Duration;

/**
 * Quota applied to requests whose path matches {@code pattern}.
 */
public record RateLimitRule(String pattern, int limit, Duration window) {}
