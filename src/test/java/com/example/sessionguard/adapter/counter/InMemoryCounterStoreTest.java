package com.example.sessionguard.adapter.counter;

import com.example.sessionguard.domain.ratelimit.CounterWindow;
import com.example.sessionguard.domain.ratelimit.RateLimitKey;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCounterStoreTest {

  private static final RateLimitKey KEY = new RateLimitKey("/api/x", "1.2.3.4");
  private static final Duration WINDOW = Duration.ofSeconds(60);
  private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

  @Test
  void firstIncrementArmsWindowAndLaterOnesKeepIt() {
    InMemoryCounterStore store = new InMemoryCounterStore(100);

    CounterWindow first = store.incrementWithExpiry(KEY, WINDOW, T0);
    CounterWindow second = store.incrementWithExpiry(KEY, WINDOW, T0.plusSeconds(30));

    assertEquals(1, first.count());
    assertEquals(T0.plus(WINDOW), first.resetAt());
    assertEquals(2, second.count());
    assertEquals(T0.plus(WINDOW), second.resetAt());
  }

  @Test
  void closedWindowStartsOver() {
    InMemoryCounterStore store = new InMemoryCounterStore(100);
    store.incrementWithExpiry(KEY, WINDOW, T0);
    store.incrementWithExpiry(KEY, WINDOW, T0.plusSeconds(10));

    CounterWindow next = store.incrementWithExpiry(KEY, WINDOW, T0.plus(WINDOW));

    assertEquals(1, next.count());
    assertEquals(T0.plus(WINDOW).plus(WINDOW), next.resetAt());
  }

  @Test
  void sweepRemovesOnlyClosedWindows() {
    InMemoryCounterStore store = new InMemoryCounterStore(100);
    store.incrementWithExpiry(KEY, WINDOW, T0);
    store.incrementWithExpiry(new RateLimitKey("/api/x", "5.6.7.8"), WINDOW, T0.plusSeconds(30));

    int removed = store.sweepExpired(T0.plusSeconds(61));

    assertEquals(1, removed);
    assertEquals(1, store.size());
  }

  @Test
  void concurrentIncrementsAreNotLost() throws Exception {
    InMemoryCounterStore store = new InMemoryCounterStore(100);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<CounterWindow>> tasks = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        tasks.add(() -> store.incrementWithExpiry(KEY, WINDOW, T0));
      }
      long max = 0;
      for (Future<CounterWindow> future : executor.invokeAll(tasks)) {
        max = Math.max(max, future.get().count());
      }
      assertEquals(200, max);
    } finally {
      executor.shutdownNow();
    }
  }
}
