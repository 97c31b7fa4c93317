package io.fairway.platform.usage;

import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/** Lock-free counters of one bucket. Safe for any number of concurrent writers. */
final class UsageCounters {

  private final LongAdder calls = new LongAdder();
  private final LongAdder bytes = new LongAdder();
  private final LongAdder clientErrors = new LongAdder();
  private final LongAdder serverErrors = new LongAdder();
  private final LongAdder latencySum = new LongAdder();
  private final LongAccumulator latencyMax = new LongAccumulator(Math::max, 0L);

  void record(int statusCode, long latencyMillis, long byteCount) {
    calls.increment();
    bytes.add(byteCount);
    if (statusCode >= 500) {
      serverErrors.increment();
    } else if (statusCode >= 400) {
      clientErrors.increment();
    }
    latencySum.add(latencyMillis);
    latencyMax.accumulate(latencyMillis);
  }

  void add(UsageSnapshot snapshot) {
    calls.add(snapshot.calls());
    bytes.add(snapshot.bytes());
    clientErrors.add(snapshot.clientErrors());
    serverErrors.add(snapshot.serverErrors());
    latencySum.add(snapshot.latencySumMillis());
    latencyMax.accumulate(snapshot.latencyMaxMillis());
  }

  UsageSnapshot snapshot() {
    return new UsageSnapshot(
        calls.sum(),
        bytes.sum(),
        clientErrors.sum(),
        serverErrors.sum(),
        latencySum.sum(),
        latencyMax.get());
  }
}
