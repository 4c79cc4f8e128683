package com.example.sessionguard.adapter.counter;

import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import com.example.sessionguard.exception.CounterStoreUnavailableException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves increments from a primary store and switches to a fallback when the primary fails.
 * After a failure the primary is left alone for {@code retryInterval}, then tried again by the
 * next request, so recovery is automatic and an outage costs one primary timeout per interval.
 */
@Slf4j
public class FailoverCounterStore implements CounterStore {

  private final CounterStore primary;
  private final CounterStore fallback;
  private final Duration retryInterval;
  private final AtomicBoolean degraded = new AtomicBoolean(false);
  private volatile Instant retryPrimaryAt = Instant.MIN;

  public FailoverCounterStore(CounterStore primary, CounterStore fallback, Duration retryInterval) {
    this.primary = primary;
    this.fallback = fallback;
    this.retryInterval = retryInterval;
  }

  @Override
  public CounterWindow incrementWithExpiry(RateLimitKey key, Duration window, Instant now) {
    if (degraded.get() && now.isBefore(retryPrimaryAt)) {
      return fallback.incrementWithExpiry(key, window, now);
    }
    try {
      CounterWindow result = primary.incrementWithExpiry(key, window, now);
      if (degraded.compareAndSet(true, false)) {
        log.info("Counter store '{}' recovered, leaving '{}' fallback", primary.name(), fallback.name());
      }
      return result;
    } catch (CounterStoreUnavailableException e) {
      retryPrimaryAt = now.plus(retryInterval);
      if (degraded.compareAndSet(false, true)) {
        log.warn("Counter store '{}' unavailable, falling back to per-process '{}' counters for {}",
                 primary.name(), fallback.name(), retryInterval, e);
      } else {
        log.debug("Counter store '{}' still unavailable: {}", primary.name(), e.getMessage());
      }
      return fallback.incrementWithExpiry(key, window, now);
    } catch (RuntimeException e) {
      log.error("Unexpected failure in counter store '{}', using '{}'", primary.name(), fallback.name(), e);
      return fallback.incrementWithExpiry(key, window, now);
    }
  }

  public boolean isDegraded() {
    return degraded.get();
  }

  @Override
  public String name() {
    return primary.name() + "+" + fallback.name();
  }
}
