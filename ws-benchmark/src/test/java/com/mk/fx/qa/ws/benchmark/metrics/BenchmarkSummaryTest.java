package com.mk.fx.qa.ws.benchmark.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BenchmarkSummaryTest {

  private static BenchmarkSummary summary(boolean periodic, LatencyStats subscribe) {
    return new BenchmarkSummary(
        "run-1",
        periodic ? 2 : 1,
        "label",
        1000,
        1000,
        10,
        985,
        5,
        40,
        38,
        2,
        12345,
        17,
        1,
        0,
        990,
        subscribe,
        LatencyStats.EMPTY,
        LatencyStats.EMPTY,
        Map.of("CONNECT:CONNECTION_REFUSED", 10L),
        Duration.ofSeconds(100),
        periodic);
  }

  @Test
  void reportLines_carryScrapedLabels() {
    var stats = new LatencyStats(985, 3, 12.346, 10, 40, 80, 120);
    List<String> lines = summary(false, stats).toReportLines();

    assertTrue(lines.contains("  Subscribe Success:   985"));
    assertTrue(lines.contains("  Subscribe Failed:    5"));
    assertTrue(lines.contains("  Connection Errors:   10"));
    assertTrue(lines.contains("  Filter Updates:      40"));
    assertTrue(lines.contains("  Messages Received:   12345"));
    assertTrue(lines.contains("  Mean:   12.35"));
    assertTrue(lines.contains("  p99:    80"));
    assertTrue(lines.contains("End-to-End Latency (ms):"));
    assertTrue(lines.contains("  No data"));
    assertFalse(lines.contains("Filter Update Latency (ms):"));
  }

  @Test
  void reportLines_includeUpdateSectionForPeriodicScenario() {
    List<String> lines = summary(true, LatencyStats.EMPTY).toReportLines();

    assertTrue(lines.contains("Filter Update Latency (ms):"));
    assertTrue(lines.contains("  Update Success:      38"));
  }

  @Test
  void sessionsAccounted_sumsThePartition() {
    assertEquals(1000, summary(false, LatencyStats.EMPTY).sessionsAccounted());
  }
}
