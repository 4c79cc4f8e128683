package com.example.sessionguard.adapter.counter;

import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window counter backend.
 */
public interface CounterStore {

  /**
   * Increments the counter for {@code key}. The first increment of a window sets the count to 1
   * and arms the window to close at {@code now + window}; later increments leave the window
   * untouched.
   *
   * @throws com.example.sessionguard.exception.CounterStoreUnavailableException if the backend
   *     cannot be reached
   */
  CounterWindow incrementWithExpiry(RateLimitKey key, Duration window, Instant now);

  /**
   * Short name used in logs and health output.
   */
  String name();
}
