package com.mk.fx.qa.ws.benchmark.cfg;

import com.mk.fx.qa.ws.benchmark.runner.BenchmarkRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Benchmark settings bound from {@code benchmark.*}. Plain numbers for the phase durations are
 * seconds and for the update interval milliseconds, matching the environment variables that feed
 * them (see {@code application.yml}). Range checks that decide the exit status (scenario id, client
 * count, durations) are left to the engine.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkProperties {

  /** Run one benchmark as soon as the application has started. */
  private boolean runOnStartup = true;

  @NotBlank private String host = "stream-v2.projectscylla.com";

  @Min(1)
  @Max(65_535)
  private int port = 443;

  @NotBlank private String appKey = "knife-library-likely";

  @NotBlank private String channel = "trident_filter_tokens_v1";

  private int scenario = 1;

  @NotNull private Path tokenFile = Path.of("token-addresses.json");

  @NotBlank private String filterKey = "token_address";

  @DurationUnit(ChronoUnit.MILLIS)
  private Duration filterUpdateInterval = Duration.ofMillis(5000);

  private int numClients = 1000;

  private int clientIdOffset = 0;

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration rampDuration = Duration.ofSeconds(30);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration holdDuration = Duration.ofSeconds(60);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration rampDownDuration = Duration.ofSeconds(10);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration warmupDuration = Duration.ZERO;

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration subscribeTimeout = Duration.ofSeconds(10);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration connectTimeout = Duration.ofSeconds(10);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration gracePeriod = Duration.ofSeconds(10);

  @DurationUnit(ChronoUnit.SECONDS)
  private Duration closeLinger = Duration.ofSeconds(1);

  public BenchmarkRequest toRequest() {
    return new BenchmarkRequest(
        host,
        port,
        appKey,
        channel,
        scenario,
        numClients,
        clientIdOffset,
        rampDuration,
        warmupDuration,
        holdDuration,
        rampDownDuration,
        gracePeriod,
        subscribeTimeout,
        connectTimeout,
        filterUpdateInterval,
        closeLinger,
        filterKey,
        tokenFile);
  }
}
