package com.mk.fx.qa.ws.benchmark.metrics;

/** Summary of one latency sample set, in milliseconds. {@code count == 0} means no data. */
public record LatencyStats(
    long count, long minMs, double meanMs, long p50Ms, long p95Ms, long p99Ms, long maxMs) {

  public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0.0, 0, 0, 0, 0);

  public boolean hasData() {
    return count > 0;
  }
}
