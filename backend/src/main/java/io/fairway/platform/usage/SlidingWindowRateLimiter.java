package io.fairway.platform.usage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Sliding-window log per (tenant, endpoint). Each window is locked on its own, so tenants never
 * contend with each other. An allowed decision takes a slot in the window.
 */
@Component
public class SlidingWindowRateLimiter {

  private record WindowKey(String tenantId, String endpoint) {}

  private final Map<WindowKey, Deque<Instant>> windows = new ConcurrentHashMap<>();
  private final Clock clock;

  public SlidingWindowRateLimiter(Clock clock) {
    this.clock = clock;
  }

  public RateLimitDecision tryAcquire(
      String tenantId, String endpoint, int limit, Duration window) {
    var log = windows.computeIfAbsent(new WindowKey(tenantId, endpoint), k -> new ArrayDeque<>());
    Instant now = clock.instant();
    Instant windowStart = now.minus(window);
    synchronized (log) {
      while (!log.isEmpty() && !log.peekFirst().isAfter(windowStart)) {
        log.pollFirst();
      }
      if (log.size() < limit) {
        log.addLast(now);
        return RateLimitDecision.allow();
      }
      Instant oldest = log.peekFirst();
      return RateLimitDecision.deny(Duration.between(windowStart, oldest));
    }
  }

  /** Drops windows that have been idle for longer than {@code window}. */
  public void evictIdle(Duration window) {
    Instant cutoff = clock.instant().minus(window);
    windows
        .entrySet()
        .removeIf(
            entry -> {
              var log = entry.getValue();
              synchronized (log) {
                return log.isEmpty() || !log.peekLast().isAfter(cutoff);
              }
            });
  }
}
