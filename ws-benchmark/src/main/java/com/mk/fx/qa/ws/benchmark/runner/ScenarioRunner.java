package com.mk.fx.qa.ws.benchmark.runner;

import static com.mk.fx.qa.ws.benchmark.utils.LoadUtils.orDefault;
import static java.util.concurrent.Executors.newScheduledThreadPool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.ws.benchmark.client.StreamEndpoints;
import com.mk.fx.qa.ws.benchmark.client.StreamTransport;
import com.mk.fx.qa.ws.benchmark.client.protocol.WireProtocol;
import com.mk.fx.qa.ws.benchmark.filter.AddressPool;
import com.mk.fx.qa.ws.benchmark.filter.FilterGenerator;
import com.mk.fx.qa.ws.benchmark.metrics.BenchmarkSummary;
import com.mk.fx.qa.ws.benchmark.metrics.MetricsAggregator;
import com.mk.fx.qa.ws.benchmark.metrics.RunConfig;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import com.mk.fx.qa.ws.benchmark.model.Scenario;
import com.mk.fx.qa.ws.benchmark.ramp.RampController;
import com.mk.fx.qa.ws.benchmark.ramp.RampListener;
import com.mk.fx.qa.ws.benchmark.ramp.RampParameters;
import com.mk.fx.qa.ws.benchmark.ramp.RampResult;
import com.mk.fx.qa.ws.benchmark.ramp.SessionFactory;
import com.mk.fx.qa.ws.benchmark.session.SessionClient;
import com.mk.fx.qa.ws.benchmark.session.SessionSettings;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine. A run validates its request, builds a fresh set of collaborators
 * (metrics, filter generator, transport, timer pool), hands session population to the {@link
 * RampController} and returns the metrics snapshot once every session is terminal.
 *
 * <p>Configuration problems raise {@link FatalConfigurationException} before any session is
 * created. Everything that goes wrong afterwards is measured, never thrown: a run in which every
 * session failed still returns a summary.
 */
@Slf4j
public class ScenarioRunner {

  static final int TIMER_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);

  private final WireProtocol protocol;
  private final TransportFactory transports;
  private final HostResolver resolver;
  private final ObjectMapper objectMapper;
  private final Map<UUID, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

  public ScenarioRunner(
      WireProtocol protocol,
      TransportFactory transports,
      HostResolver resolver,
      ObjectMapper objectMapper) {
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.transports = Objects.requireNonNull(transports, "transports");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public BenchmarkSummary run(BenchmarkRequest request) throws InterruptedException {
    return run(UUID.randomUUID(), request);
  }

  public BenchmarkSummary run(UUID runId, BenchmarkRequest request) throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Scenario scenario = validate(request);
    AddressPool pool = AddressPool.loadOrGenerate(request.tokenFile(), objectMapper);
    var filters = new FilterGenerator(pool, request.filterKey());
    filters.requireCapacity(scenario);

    URI endpoint =
        StreamEndpoints.endpoint(
            request.host(), request.port(), protocol.handshakePath(request.appKey()));
    var ramp =
        new RampParameters(
            request.clients(),
            request.rampUp(),
            request.warmup(),
            request.hold(),
            request.rampDown(),
            orDefault(request.grace(), BenchmarkRequest.DEFAULT_GRACE));
    var settings =
        new SessionSettings(
            endpoint,
            request.channel(),
            scenario,
            orDefault(request.ackTimeout(), BenchmarkRequest.DEFAULT_ACK_TIMEOUT),
            orDefault(request.updateInterval(), BenchmarkRequest.DEFAULT_UPDATE_INTERVAL),
            orDefault(request.closeLinger(), BenchmarkRequest.DEFAULT_CLOSE_LINGER));
    var metrics =
        new MetricsAggregator(
            new RunConfig(
                runId.toString(),
                scenario,
                endpoint.toString(),
                request.channel(),
                request.clients(),
                request.clientIdOffset(),
                ramp.rampUp(),
                ramp.warmup(),
                ramp.hold(),
                ramp.rampDown(),
                settings.updateInterval()));

    var cancelled = new AtomicBoolean(false);
    if (cancellations.putIfAbsent(runId, cancelled) != null) {
      throw new IllegalStateException("Run " + runId + " is already in progress");
    }
    ScheduledExecutorService timers = newScheduledThreadPool(TIMER_THREADS, timerThreads(runId));
    try (StreamTransport transport =
        transports.open(orDefault(request.connectTimeout(), BenchmarkRequest.DEFAULT_CONNECT_TIMEOUT))) {
      metrics.start();
      SessionFactory factory =
          index ->
              new SessionClient(
                  request.clientIdOffset() + index,
                  settings,
                  transport,
                  protocol,
                  filters,
                  metrics,
                  timers);
      RampListener listener = new RunPhaseListener(metrics);

      RampResult result = RampController.execute(runId, ramp, cancelled::get, factory, listener);
      metrics.stopAndSummarise();
      BenchmarkSummary summary = metrics.snapshot();
      report(summary, result);
      return summary;
    } finally {
      metrics.stop();
      timers.shutdownNow();
      cancellations.remove(runId);
    }
  }

  /** Requests cooperative cancellation of a running benchmark. */
  public boolean cancel(UUID runId) {
    var flag = cancellations.get(runId);
    if (flag == null) {
      return false;
    }
    flag.set(true);
    log.info("Run {} cancellation requested", runId);
    return true;
  }

  public Set<UUID> activeRuns() {
    return Set.copyOf(cancellations.keySet());
  }

  Scenario validate(BenchmarkRequest request) {
    if (request == null) {
      throw new FatalConfigurationException("Benchmark request is required");
    }
    Scenario scenario = Scenario.fromId(request.scenario());
    requireText(request.host(), "host");
    requireText(request.appKey(), "app key");
    requireText(request.channel(), "channel");
    if (request.port() < 1 || request.port() > 65_535) {
      throw new FatalConfigurationException("Port out of range: " + request.port());
    }
    if (request.clients() <= 0) {
      throw new FatalConfigurationException(
          "Client count must be positive, got " + request.clients());
    }
    if (request.clientIdOffset() < 0) {
      throw new FatalConfigurationException("Client id offset must not be negative");
    }
    requireNonNegative(request.rampUp(), "ramp-up");
    requireNonNegative(request.warmup(), "warm-up");
    requireNonNegative(request.rampDown(), "ramp-down");
    requireNonNegative(request.grace(), "grace period");
    requirePositive(request.hold(), "hold", true);
    requirePositive(request.ackTimeout(), "subscribe timeout", false);
    requirePositive(request.connectTimeout(), "connect timeout", false);
    requirePositive(request.closeLinger(), "close linger", false);
    if (scenario.periodicUpdate()) {
      requirePositive(request.updateInterval(), "filter update interval", false);
    }
    try {
      resolver.resolve(request.host().trim());
    } catch (UnknownHostException e) {
      throw new FatalConfigurationException("Cannot resolve host " + request.host(), e);
    }
    return scenario;
  }

  private void report(BenchmarkSummary summary, RampResult result) {
    summary.toReportLines().forEach(line -> log.info(line));
    if (summary.sessionsAccounted() != summary.clients()) {
      log.warn(
          "Run {} accounted for {} of {} sessions",
          summary.runId(),
          summary.sessionsAccounted(),
          summary.clients());
    }
    try {
      log.info(
          "Run {} report:\n{}",
          summary.runId(),
          objectMapper.writeValueAsString(new RunReport(summary, result)));
    } catch (JsonProcessingException e) {
      log.warn("Run {} report could not be serialised: {}", summary.runId(), e.getMessage());
    }
  }

  private static ThreadFactory timerThreads(UUID runId) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("session-timers-" + runId + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new FatalConfigurationException("The " + name + " must not be blank");
    }
  }

  private static void requireNonNegative(Duration value, String name) {
    if (value != null && value.isNegative()) {
      throw new FatalConfigurationException("The " + name + " must not be negative");
    }
  }

  private static void requirePositive(Duration value, String name, boolean required) {
    if (value == null && !required) {
      return;
    }
    if (value == null || value.isZero() || value.isNegative()) {
      throw new FatalConfigurationException("The " + name + " must be positive");
    }
  }
}
