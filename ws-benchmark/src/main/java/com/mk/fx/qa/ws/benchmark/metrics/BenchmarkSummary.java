package com.mk.fx.qa.ws.benchmark.metrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Final metrics snapshot of a run. {@link #toReportLines()} renders the labelled block that
 * line-oriented scrapers read ({@code Subscribe Success:}, {@code Messages Received:}, ...).
 */
public record BenchmarkSummary(
    String runId,
    int scenario,
    String scenarioLabel,
    int clients,
    long connectionAttempts,
    long connectionErrors,
    long subscribeSuccess,
    long subscribeFailed,
    long updateAttempts,
    long updateSuccess,
    long updateFailed,
    long messagesReceived,
    long warmupMessages,
    long disconnects,
    long forcedTerminations,
    int peakConnections,
    LatencyStats subscribeLatency,
    LatencyStats updateLatency,
    LatencyStats endToEndLatency,
    Map<String, Long> errorBreakdown,
    Duration elapsed,
    boolean periodicUpdates) {

  /** Sessions that landed in exactly one of success, subscribe failure or connection error. */
  public long sessionsAccounted() {
    return subscribeSuccess + subscribeFailed + connectionErrors;
  }

  public List<String> toReportLines() {
    var lines = new ArrayList<String>();
    lines.add("BENCHMARK SUMMARY");
    lines.add("Scenario " + scenario + ": " + scenarioLabel + ", clients=" + clients);
    lines.add("");
    lines.add("Connection Metrics:");
    lines.add(metric("Subscribe Success:", subscribeSuccess));
    lines.add(metric("Subscribe Failed:", subscribeFailed));
    lines.add(metric("Connection Errors:", connectionErrors));
    lines.add(metric("Filter Updates:", updateAttempts));
    lines.add(metric("Messages Received:", messagesReceived));
    lines.add(metric("Disconnects:", disconnects));
    lines.add(metric("Forced Closes:", forcedTerminations));
    lines.add("");
    appendLatency(lines, "Subscribe Latency (ms):", subscribeLatency);
    if (periodicUpdates) {
      lines.add("");
      lines.add(metric("Update Success:", updateSuccess));
      lines.add(metric("Update Failed:", updateFailed));
      appendLatency(lines, "Filter Update Latency (ms):", updateLatency);
    }
    lines.add("");
    appendLatency(lines, "End-to-End Latency (ms):", endToEndLatency);
    if (!errorBreakdown.isEmpty()) {
      lines.add("");
      lines.add("Errors:");
      errorBreakdown.forEach((key, count) -> lines.add(String.format("  %-30s %d", key, count)));
    }
    return lines;
  }

  private static String metric(String label, long value) {
    return String.format("  %-20s %d", label, value);
  }

  private static void appendLatency(List<String> lines, String title, LatencyStats stats) {
    lines.add(title);
    if (!stats.hasData()) {
      lines.add("  No data");
      return;
    }
    lines.add("  Min:    " + stats.minMs());
    lines.add("  Mean:   " + String.format(Locale.ROOT, "%.2f", stats.meanMs()));
    lines.add("  p50:    " + stats.p50Ms());
    lines.add("  p95:    " + stats.p95Ms());
    lines.add("  p99:    " + stats.p99Ms());
    lines.add("  Max:    " + stats.maxMs());
    lines.add("  Samples:" + stats.count());
  }
}
