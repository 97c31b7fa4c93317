package io.fairway.platform.testutil;

import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/** Replaces the system clock with a {@link MutableClock} that tests can move. */
@TestConfiguration
public class TestClockConfiguration {

  public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  @Bean
  @Primary
  MutableClock testClock() {
    return new MutableClock(START);
  }
}
