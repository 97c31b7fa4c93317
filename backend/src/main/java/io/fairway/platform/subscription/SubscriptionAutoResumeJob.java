package io.fairway.platform.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Resumes subscriptions whose pause has expired. */
@Component
public class SubscriptionAutoResumeJob {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionAutoResumeJob.class);

  private final SubscriptionService subscriptionService;

  public SubscriptionAutoResumeJob(SubscriptionService subscriptionService) {
    this.subscriptionService = subscriptionService;
  }

  @Scheduled(
      fixedDelayString = "${fairway.subscriptions.auto-resume-interval-ms:60000}",
      initialDelayString = "${fairway.subscriptions.auto-resume-interval-ms:60000}")
  public void resumeExpiredPauses() {
    try {
      int resumed = subscriptionService.resumeExpiredPauses();
      if (resumed > 0) {
        log.info("Auto-resumed {} subscriptions", resumed);
      }
    } catch (RuntimeException e) {
      log.error("Subscription auto-resume failed", e);
    }
  }
}
