package com.mk.fx.qa.ws.benchmark.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks one latency distribution. Running min and max are kept on atomics for cheap progress
 * logging; percentiles come from the full {@link LatencySamples} set.
 */
final class LatencyTracker {

  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(Long.MIN_VALUE);
  private final LatencySamples samples = new LatencySamples();

  void record(long latencyMs) {
    long v = Math.max(0, latencyMs);
    max.accumulateAndGet(v, Math::max);
    min.accumulateAndGet(v, Math::min);
    samples.add(v);
  }

  int count() {
    return samples.size();
  }

  long minMs() {
    long v = min.get();
    return v == Long.MAX_VALUE ? 0 : v;
  }

  long maxMs() {
    long v = max.get();
    return v == Long.MIN_VALUE ? 0 : v;
  }

  LatencyStats stats() {
    return samples.stats();
  }
}
