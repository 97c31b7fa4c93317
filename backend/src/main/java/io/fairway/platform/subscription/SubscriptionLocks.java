package io.fairway.platform.subscription;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes mutations of a single subscription. Lifecycle calls and the billing cycle both take
 * the subscription's lock, so a renewal never interleaves with a tier change or cancel. Different
 * subscriptions never contend.
 */
@Component
public class SubscriptionLocks {

  private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(UUID subscriptionId, Supplier<T> work) {
    var lock = locks.computeIfAbsent(subscriptionId, id -> new ReentrantLock());
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
