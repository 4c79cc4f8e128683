package com.example.sessionguard.domain.ratelimit;

import java.time.Instant;

/**
 * Counter value after an increment, and the instant its fixed window closes.
 */
public record CounterWindow(long count, Instant resetAt) {}
