package io.fairway.platform.billing;

import io.fairway.platform.exception.ResourceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs the automated billing cycle and the overdue sweep on their schedules. */
@Component
public class BillingCycleJob {

  private static final Logger log = LoggerFactory.getLogger(BillingCycleJob.class);

  private final BillingOrchestrator billingOrchestrator;

  public BillingCycleJob(BillingOrchestrator billingOrchestrator) {
    this.billingOrchestrator = billingOrchestrator;
  }

  @Scheduled(cron = "${fairway.billing.cycle-cron:0 0 * * * *}")
  public void runBillingCycle() {
    try {
      var result = billingOrchestrator.runAutomatedBillingCycle();
      if (!result.failed().isEmpty() || !result.deferred().isEmpty()) {
        log.warn(
            "Billing cycle left {} failed and {} deferred renewals",
            result.failed().size(),
            result.deferred().size());
      }
    } catch (ResourceConflictException e) {
      log.info("Skipping scheduled billing cycle: a cycle is already running");
    } catch (RuntimeException e) {
      log.error("Scheduled billing cycle failed", e);
    }
  }

  @Scheduled(cron = "${fairway.billing.overdue-cron:0 30 0 * * *}")
  public void markOverdueInvoices() {
    try {
      billingOrchestrator.markOverdueInvoices();
    } catch (RuntimeException e) {
      log.error("Overdue invoice sweep failed", e);
    }
  }
}
