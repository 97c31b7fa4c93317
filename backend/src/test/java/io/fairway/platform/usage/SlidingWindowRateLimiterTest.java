package io.fairway.platform.usage;

import static org.assertj.core.api.Assertions.assertThat;

import io.fairway.platform.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {

  private static final Duration WINDOW = Duration.ofMinutes(1);

  private MutableClock clock;
  private SlidingWindowRateLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
    limiter = new SlidingWindowRateLimiter(clock);
  }

  @Test
  void deniesOnceTheWindowIsFull() {
    assertThat(limiter.tryAcquire("t1", "/tee-times", 2, WINDOW).allowed()).isTrue();
    assertThat(limiter.tryAcquire("t1", "/tee-times", 2, WINDOW).allowed()).isTrue();

    var denied = limiter.tryAcquire("t1", "/tee-times", 2, WINDOW);

    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(WINDOW);
  }

  @Test
  void retryAfterShrinksAsTheOldestCallAges() {
    limiter.tryAcquire("t1", "/tee-times", 1, WINDOW);
    clock.advance(Duration.ofSeconds(45));

    var denied = limiter.tryAcquire("t1", "/tee-times", 1, WINDOW);

    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  void slotFreesUpWhenTheOldestCallLeavesTheWindow() {
    limiter.tryAcquire("t1", "/tee-times", 1, WINDOW);
    clock.advance(Duration.ofSeconds(61));

    assertThat(limiter.tryAcquire("t1", "/tee-times", 1, WINDOW).allowed()).isTrue();
  }

  @Test
  void windowsAreKeptPerTenantAndEndpoint() {
    limiter.tryAcquire("t1", "/tee-times", 1, WINDOW);

    assertThat(limiter.tryAcquire("t2", "/tee-times", 1, WINDOW).allowed()).isTrue();
    assertThat(limiter.tryAcquire("t1", "/scores", 1, WINDOW).allowed()).isTrue();
    assertThat(limiter.tryAcquire("t1", "/tee-times", 1, WINDOW).allowed()).isFalse();
  }

  @Test
  void evictIdle_forgetsWindowsWithNoRecentCalls() {
    limiter.tryAcquire("t1", "/tee-times", 1, WINDOW);
    clock.advance(Duration.ofMinutes(2));

    limiter.evictIdle(WINDOW);

    assertThat(limiter.tryAcquire("t1", "/tee-times", 1, WINDOW).allowed()).isTrue();
  }
}
