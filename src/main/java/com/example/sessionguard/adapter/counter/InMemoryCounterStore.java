package com.example.sessionguard.adapter.counter;

import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-process fixed-window counters.
 *
 * <p>Counts are local to this JVM: with several workers behind a load balancer the effective limit
 * is multiplied by the number of workers while this store is in use.
 */
@Slf4j
public class InMemoryCounterStore implements CounterStore {

  private final Cache<RateLimitKey, CounterWindow> windows;

  public InMemoryCounterStore(int maxEntries) {
    this.windows = Caffeine.newBuilder()
        .maximumSize(maxEntries)
        .build();
  }

  @Override
  public CounterWindow incrementWithExpiry(RateLimitKey key, Duration window, Instant now) {
    return windows.asMap().compute(key, (k, current) -> {
      if (current == null || !now.isBefore(current.resetAt())) {
        return new CounterWindow(1, now.plus(window));
      }
      return new CounterWindow(current.count() + 1, current.resetAt());
    });
  }

  /**
   * Drops windows that have closed. Expired windows are already ignored on increment; this only
   * reclaims memory.
   *
   * @return number of entries removed
   */
  public int sweepExpired(Instant now) {
    int removed = 0;
    for (Map.Entry<RateLimitKey, CounterWindow> entry : windows.asMap().entrySet()) {
      CounterWindow window = entry.getValue();
      if (!now.isBefore(window.resetAt()) && windows.asMap().remove(entry.getKey(), window)) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Swept {} expired in-memory rate limit windows", removed);
    }
    return removed;
  }

  public long size() {
    return windows.estimatedSize();
  }

  @Override
  public String name() {
    return "memory";
  }
}
