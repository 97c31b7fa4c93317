package io.fairway.platform.config;

import io.fairway.platform.billing.BillingProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded pool on which billing charges run. Its size caps how many processor calls one billing
 * cycle has in flight.
 */
@Configuration
public class BillingExecutorConfig {

  @Bean(name = "billingExecutor", destroyMethod = "shutdown")
  ExecutorService billingExecutor(BillingProperties properties) {
    var counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          var thread = new Thread(runnable, "billing-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.concurrency(), threadFactory);
  }
}
