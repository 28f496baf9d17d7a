package com.mk.fx.qa.ws.benchmark.metrics;

import java.util.Arrays;
import java.util.Optional;

/**
 * Thread-safe append-only sample set. Every sample is retained so percentiles are exact (nearest
 * rank on the sorted set) and independent of insertion order.
 */
public final class LatencySamples {

  private static final int INITIAL_CAPACITY = 256;

  private long[] data = new long[INITIAL_CAPACITY];
  private int size;

  public synchronized void add(long value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length * 2);
    }
    data[size++] = value;
  }

  public synchronized int size() {
    return size;
  }

  public Optional<Long> percentile(double p) {
    return Optional.ofNullable(nearestRank(sortedCopy(), p));
  }

  public LatencyStats stats() {
    long[] sorted = sortedCopy();
    if (sorted.length == 0) {
      return LatencyStats.EMPTY;
    }
    double sum = 0;
    for (long v : sorted) {
      sum += v;
    }
    return new LatencyStats(
        sorted.length,
        sorted[0],
        sum / sorted.length,
        nearestRank(sorted, 50),
        nearestRank(sorted, 95),
        nearestRank(sorted, 99),
        sorted[sorted.length - 1]);
  }

  private synchronized long[] sortedCopy() {
    long[] copy = Arrays.copyOf(data, size);
    Arrays.sort(copy);
    return copy;
  }

  static Long nearestRank(long[] sorted, double p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int n = sorted.length;
    if (n == 0) {
      return null;
    }
    int idx = Math.min(n - 1, Math.max(0, (int) Math.ceil((p / 100.0) * n) - 1));
    return sorted[idx];
  }
}
