package com.mk.fx.qa.ws.benchmark.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.ws.benchmark.metrics.ErrorTracker.FailureKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-wide counters and latency samples shared by every session of one run. All record methods are
 * lock-free apart from the per-distribution sample lock, and may be called from any thread.
 *
 * <p>Message counts, end-to-end latencies and filter updates are only recorded once measurement
 * is enabled; until then data frames are counted as warm-up messages and updates are discarded.
 * Connection and subscribe outcomes are always recorded.
 */
@Slf4j
public class MetricsAggregator {

  public static final long MAX_END_TO_END_MS = 60_000L;

  @Getter private final RunConfig config;

  private final Instant startedAt = Instant.now();
  private final AtomicBoolean measuring = new AtomicBoolean();

  private final AtomicLong connectionAttempts = new AtomicLong();
  private final AtomicLong connectionErrors = new AtomicLong();
  private final AtomicLong subscribeSuccess = new AtomicLong();
  private final AtomicLong subscribeFailed = new AtomicLong();
  private final AtomicLong updateAttempts = new AtomicLong();
  private final AtomicLong updateSuccess = new AtomicLong();
  private final AtomicLong updateFailed = new AtomicLong();
  private final AtomicLong messages = new AtomicLong();
  private final AtomicLong warmupMessages = new AtomicLong();
  private final AtomicLong disconnects = new AtomicLong();
  private final AtomicLong forcedTerminations = new AtomicLong();
  private final AtomicInteger activeConnections = new AtomicInteger();
  private final AtomicInteger peakConnections = new AtomicInteger();

  private final LatencyTracker subscribeLatency = new LatencyTracker();
  private final LatencyTracker updateLatency = new LatencyTracker();
  private final LatencyTracker endToEndLatency = new LatencyTracker();
  private final ErrorTracker errors = new ErrorTracker();

  private ScheduledExecutorService progress;

  public MetricsAggregator(RunConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public synchronized void start() {
    log.info(
        "Run {} started: scenario={} ({}), endpoint={}, channel={}, clients={}, offset={},"
            + " rampUp={}, warmup={}, hold={}, rampDown={}",
        config.runId(),
        config.scenario().id(),
        config.scenario().label(),
        config.endpoint(),
        config.channel(),
        config.clients(),
        config.clientIdOffset(),
        config.rampUp(),
        config.warmup(),
        config.hold(),
        config.rampDown());
    progress =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-progress-" + config.runId());
              t.setDaemon(true);
              return t;
            });
    progress.scheduleAtFixedRate(this::logProgress, 5, 5, TimeUnit.SECONDS);
  }

  public void stopAndSummarise() {
    stop();
    logProgress();
  }

  /** Stops the progress reporter. Idempotent, and safe on runs that ended abnormally. */
  public synchronized void stop() {
    if (progress == null) {
      return;
    }
    progress.shutdownNow();
    try {
      progress.awaitTermination(2, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      progress = null;
    }
  }

  /** Ends the warm-up window. Idempotent. */
  public void startMeasuring() {
    if (measuring.compareAndSet(false, true)) {
      log.info(
          "Run {} measurement enabled (warm-up messages discarded: {})",
          config.runId(),
          warmupMessages.get());
    }
  }

  public boolean isMeasuring() {
    return measuring.get();
  }

  public void recordConnectionAttempt() {
    connectionAttempts.incrementAndGet();
  }

  public void recordConnectionError(Throwable cause) {
    recordConnectionError(ErrorTracker.classify(cause));
  }

  public void recordConnectionError(String category) {
    connectionErrors.incrementAndGet();
    errors.record(FailureKind.CONNECT, category);
  }

  public void recordConnectionOpened() {
    int now = activeConnections.incrementAndGet();
    peakConnections.accumulateAndGet(now, Math::max);
  }

  public void recordConnectionClosed() {
    activeConnections.decrementAndGet();
  }

  public void recordSubscribeSuccess(long latencyMs) {
    subscribeSuccess.incrementAndGet();
    subscribeLatency.record(latencyMs);
  }

  public void recordSubscribeFailure(String category) {
    subscribeFailed.incrementAndGet();
    errors.record(FailureKind.SUBSCRIBE, category);
  }

  public void recordUpdateAttempt() {
    updateAttempts.incrementAndGet();
  }

  public void recordUpdateSuccess(long latencyMs) {
    updateSuccess.incrementAndGet();
    updateLatency.record(latencyMs);
  }

  public void recordUpdateFailure(String category) {
    updateFailed.incrementAndGet();
    errors.record(FailureKind.UPDATE, category);
  }

  /**
   * Counts one data frame. {@code endToEndMs} is the publisher-to-receipt delay or null when the
   * frame carried no timestamp. A timestamp ahead of the local clock counts as 0 ms; values of
   * {@link #MAX_END_TO_END_MS} or more are dropped.
   */
  public void recordMessageReceived(Long endToEndMs) {
    if (!measuring.get()) {
      warmupMessages.incrementAndGet();
      return;
    }
    messages.incrementAndGet();
    if (endToEndMs != null && endToEndMs < MAX_END_TO_END_MS) {
      endToEndLatency.record(Math.max(0L, endToEndMs));
    }
  }

  public void recordDisconnect() {
    disconnects.incrementAndGet();
  }

  public void recordForcedTermination() {
    forcedTerminations.incrementAndGet();
  }

  public int activeConnections() {
    return activeConnections.get();
  }

  public long connectionAttempts() {
    return connectionAttempts.get();
  }

  public BenchmarkSummary snapshot() {
    return new BenchmarkSummary(
        config.runId(),
        config.scenario().id(),
        config.scenario().label(),
        config.clients(),
        connectionAttempts.get(),
        connectionErrors.get(),
        subscribeSuccess.get(),
        subscribeFailed.get(),
        updateAttempts.get(),
        updateSuccess.get(),
        updateFailed.get(),
        messages.get(),
        warmupMessages.get(),
        disconnects.get(),
        forcedTerminations.get(),
        peakConnections.get(),
        subscribeLatency.stats(),
        updateLatency.stats(),
        endToEndLatency.stats(),
        errors.breakdownSnapshot(),
        Duration.between(startedAt, Instant.now()),
        config.scenario().periodicUpdate());
  }

  @VisibleForTesting
  void logProgress() {
    var sb = new StringBuilder();
    sb.append("Run ")
        .append(config.runId())
        .append(" progress: active=")
        .append(activeConnections.get())
        .append("/")
        .append(config.clients())
        .append(", attempts=")
        .append(connectionAttempts.get())
        .append(", subscribed=")
        .append(subscribeSuccess.get())
        .append(", subFailed=")
        .append(subscribeFailed.get())
        .append(", connErrors=")
        .append(connectionErrors.get());
    if (config.scenario().periodicUpdate()) {
      sb.append(", updates=").append(updateAttempts.get());
    }
    if (measuring.get()) {
      sb.append(", messages=").append(messages.get());
    } else {
      sb.append(", warmupMessages=").append(warmupMessages.get()).append(" (discarding)");
    }
    if (subscribeLatency.count() > 0) {
      sb.append(", subLat(ms) min=")
          .append(subscribeLatency.minMs())
          .append(", max=")
          .append(subscribeLatency.maxMs());
    }
    log.info(sb.toString());
  }
}
