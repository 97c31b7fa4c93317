package io.fairway.platform.billing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes refunds of a single recorded charge, so the refundable balance is read and spent by
 * one caller at a time. Refunds of different charges never contend.
 */
@Component
public class RefundLocks {

  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String chargeEventId, Supplier<T> work) {
    var lock = locks.computeIfAbsent(chargeEventId, id -> new ReentrantLock());
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
