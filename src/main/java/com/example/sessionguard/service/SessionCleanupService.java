package com.example.sessionguard.service;

import com.example.sessionguard.adapter.counter.InMemoryCounterStore;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Periodic housekeeping: hard-deletes long-expired sessions and drops closed windows from the
 * in-process rate limit counter. Failures are logged and retried on the next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCleanupService {

  private final SessionLifecycleService sessionLifecycleService;
  private final InMemoryCounterStore inMemoryCounterStore;
  private final Clock clock;

  public void cleanupExpiredSessions() {
    try {
      int deleted = sessionLifecycleService.cleanupExpiredSessions();
      log.debug("Session cleanup run finished, {} deleted", deleted);
    } catch (RuntimeException e) {
      log.error("Session cleanup run failed", e);
    }
  }

  public void sweepRateLimitCounters() {
    int removed = inMemoryCounterStore.sweepExpired(clock.instant());
    if (removed > 0) {
      log.debug("Swept {} closed rate limit window(s), {} remaining", removed, inMemoryCounterStore.size());
    }
  }
}
