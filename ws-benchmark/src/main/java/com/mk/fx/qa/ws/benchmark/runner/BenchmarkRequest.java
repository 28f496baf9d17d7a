package com.mk.fx.qa.ws.benchmark.runner;

import com.mk.fx.qa.ws.benchmark.filter.FilterGenerator;
import java.nio.file.Path;
import java.time.Duration;
import lombok.With;

/**
 * Everything one benchmark run needs. Values are validated by {@link ScenarioRunner} before any
 * session is created.
 *
 * @param scenario scenario id, see {@link com.mk.fx.qa.ws.benchmark.model.Scenario}
 * @param clientIdOffset added to each session index, so several processes can share a log
 * @param tokenFile JSON array of filter values; a missing file falls back to generated values
 */
@With
public record BenchmarkRequest(
    String host,
    int port,
    String appKey,
    String channel,
    int scenario,
    int clients,
    int clientIdOffset,
    Duration rampUp,
    Duration warmup,
    Duration hold,
    Duration rampDown,
    Duration grace,
    Duration ackTimeout,
    Duration connectTimeout,
    Duration updateInterval,
    Duration closeLinger,
    String filterKey,
    Path tokenFile) {

  public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);
  public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofMillis(5000);
  public static final Duration DEFAULT_CLOSE_LINGER = Duration.ofSeconds(1);

  /** A request with the standard 30s ramp-up, 60s hold and 10s ramp-down schedule. */
  public static BenchmarkRequest of(
      String host, int port, String appKey, String channel, int scenario, int clients) {
    return new BenchmarkRequest(
        host,
        port,
        appKey,
        channel,
        scenario,
        clients,
        0,
        Duration.ofSeconds(30),
        Duration.ZERO,
        Duration.ofSeconds(60),
        Duration.ofSeconds(10),
        DEFAULT_GRACE,
        DEFAULT_ACK_TIMEOUT,
        DEFAULT_CONNECT_TIMEOUT,
        DEFAULT_UPDATE_INTERVAL,
        DEFAULT_CLOSE_LINGER,
        FilterGenerator.DEFAULT_FILTER_KEY,
        null);
  }
}
