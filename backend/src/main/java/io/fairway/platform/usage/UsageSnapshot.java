package io.fairway.platform.usage;

/**
 * Point-in-time copy of a bucket's counters.
 *
 * @param calls requests recorded
 * @param bytes payload bytes transferred
 * @param clientErrors responses with a 4xx status
 * @param serverErrors responses with a 5xx status
 * @param latencySumMillis sum of latencies, for averages
 * @param latencyMaxMillis slowest request
 */
public record UsageSnapshot(
    long calls,
    long bytes,
    long clientErrors,
    long serverErrors,
    long latencySumMillis,
    long latencyMaxMillis) {

  public static final UsageSnapshot EMPTY = new UsageSnapshot(0, 0, 0, 0, 0, 0);

  public UsageSnapshot plus(UsageSnapshot other) {
    return new UsageSnapshot(
        calls + other.calls,
        bytes + other.bytes,
        clientErrors + other.clientErrors,
        serverErrors + other.serverErrors,
        latencySumMillis + other.latencySumMillis,
        Math.max(latencyMaxMillis, other.latencyMaxMillis));
  }

  public long averageLatencyMillis() {
    return calls == 0 ? 0 : latencySumMillis / calls;
  }
}
