package com.mk.fx.qa.ws.benchmark.ramp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a population of sessions through ramp-up, optional warm-up, hold, ramp-down and drain.
 *
 * <p>Ramp-up follows a linear curve: at elapsed time {@code t} the number of started sessions is
 * {@code floor(N * t / rampUp)}, re-evaluated every {@link #QUANTUM}. Ramp-down closes sessions in
 * creation order along {@code ceil(N * t / rampDown)}. Sessions still running at the hard deadline
 * are aborted.
 */
@Slf4j
public final class RampController {

  static final Duration QUANTUM = Duration.ofMillis(50);

  private RampController() {
    throw new UnsupportedOperationException("RampController cannot be instantiated");
  }

  public static RampResult execute(
      UUID runId,
      RampParameters parameters,
      BooleanSupplier cancellationRequested,
      SessionFactory factory,
      RampListener listener)
      throws InterruptedException {

    validate(runId, parameters, cancellationRequested, factory, listener);

    var run = new Run(runId, parameters, cancellationRequested, factory, listener);
    try {
      return run.execute();
    } catch (InterruptedException interrupted) {
      run.abortRemaining();
      Thread.currentThread().interrupt();
      throw interrupted;
    }
  }

  private static void validate(
      UUID runId,
      RampParameters parameters,
      BooleanSupplier cancellationRequested,
      SessionFactory factory,
      RampListener listener) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(listener, "listener");
  }

  private static final class Run {
    private final UUID runId;
    private final RampParameters parameters;
    private final BooleanSupplier cancellationRequested;
    private final SessionFactory factory;
    private final RampListener listener;
    private final List<ManagedSession> sessions;
    private final long startNanos = System.nanoTime();

    private int scheduled;
    private int started;
    private int closed;
    private boolean cancelled;
    private long deadlineNanos;

    Run(
        UUID runId,
        RampParameters parameters,
        BooleanSupplier cancellationRequested,
        SessionFactory factory,
        RampListener listener) {
      this.runId = runId;
      this.parameters = parameters;
      this.cancellationRequested = cancellationRequested;
      this.factory = factory;
      this.listener = listener;
      this.sessions = new ArrayList<>(parameters.sessions());
      this.deadlineNanos =
          startNanos + parameters.scheduled().toNanos() + parameters.grace().toNanos();
    }

    RampResult execute() throws InterruptedException {
      int n = parameters.sessions();
      long rampNanos = parameters.rampUp().toNanos();
      long rampEnd = startNanos + rampNanos;
      long warmupEnd = rampEnd + parameters.warmup().toNanos();
      long holdEnd = warmupEnd + parameters.hold().toNanos();

      phase(RampPhase.RAMP_UP);
      log.info("Run {} ramping up {} sessions over {}", runId, n, parameters.rampUp());
      rampUp(n, rampNanos);
      if (!cancelled) {
        log.info("Run {} ramp-up complete: {} of {} sessions started", runId, started, n);
        sleepUntil(rampEnd);
      }

      if (!cancelled && !parameters.warmup().isZero()) {
        phase(RampPhase.WARMUP);
        log.info("Run {} warming up for {} (metrics discarded)", runId, parameters.warmup());
        sleepUntil(warmupEnd);
      }

      if (!cancelled) {
        phase(RampPhase.HOLD);
        log.info("Run {} holding {} sessions for {}", runId, started, parameters.hold());
        sleepUntil(holdEnd);
      }

      if (!cancelled) {
        phase(RampPhase.RAMP_DOWN);
        log.info("Run {} ramping down over {}", runId, parameters.rampDown());
        rampDown(parameters.rampDown().toNanos());
      }

      if (cancelled) {
        log.info("Run {} cancelled, closing {} sessions", runId, sessions.size() - closed);
        closeUpTo(sessions.size());
        deadlineNanos =
            Math.min(deadlineNanos, System.nanoTime() + parameters.grace().toNanos());
      }

      phase(RampPhase.DRAIN);
      while (pending() > 0 && System.nanoTime() < deadlineNanos) {
        TimeUnit.NANOSECONDS.sleep(
            Math.min(QUANTUM.toNanos(), Math.max(1, deadlineNanos - System.nanoTime())));
      }
      int forced = abortRemaining();
      int graceful = sessions.size() - forced;
      if (forced > 0) {
        log.warn("Run {} aborted {} sessions that missed the deadline", runId, forced);
      }

      var elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
      log.info(
          "Run {} ramp finished: scheduled={}, started={}, closed={}, forced={}, cancelled={},"
              + " elapsed={}",
          runId,
          scheduled,
          started,
          graceful,
          forced,
          cancelled,
          elapsed);
      return new RampResult(scheduled, started, graceful, forced, cancelled, elapsed);
    }

    private void rampUp(int n, long rampNanos) throws InterruptedException {
      while (scheduled < n) {
        if (shouldStop()) {
          cancelled = true;
          return;
        }
        long elapsed = System.nanoTime() - startNanos;
        long target = rampNanos <= 0 ? n : Math.min(n, (long) n * elapsed / rampNanos);
        while (scheduled < target) {
          startSession(scheduled++);
        }
        if (scheduled < n) {
          TimeUnit.NANOSECONDS.sleep(QUANTUM.toNanos());
        }
      }
    }

    private void rampDown(long downNanos) throws InterruptedException {
      int m = sessions.size();
      long downStart = System.nanoTime();
      while (closed < m) {
        if (shouldStop()) {
          cancelled = true;
          return;
        }
        long elapsed = System.nanoTime() - downStart;
        long target = downNanos <= 0 ? m : Math.min(m, ceilDiv((long) m * elapsed, downNanos));
        closeUpTo((int) target);
        if (closed < m) {
          TimeUnit.NANOSECONDS.sleep(QUANTUM.toNanos());
        }
      }
    }

    private void startSession(int index) {
      ManagedSession session;
      try {
        session = factory.create(index);
      } catch (RuntimeException e) {
        log.warn("Run {} could not create session {}: {}", runId, index, e.getMessage());
        listener.onSessionStartFailed(index, e);
        return;
      }
      sessions.add(session);
      try {
        session.start();
        started++;
      } catch (RuntimeException e) {
        log.warn("Run {} session {} failed to start: {}", runId, index, e.getMessage());
        listener.onSessionStartFailed(index, e);
      }
    }

    private void closeUpTo(int target) {
      while (closed < target) {
        var session = sessions.get(closed++);
        try {
          session.close();
        } catch (RuntimeException e) {
          log.warn("Run {} failed to close session: {}", runId, e.getMessage(), e);
          session.abort();
        }
      }
    }

    int abortRemaining() {
      int forced = 0;
      for (ManagedSession session : sessions) {
        if (!session.terminated().isDone()) {
          forced++;
          try {
            session.abort();
          } catch (RuntimeException e) {
            log.warn("Run {} failed to abort session: {}", runId, e.getMessage(), e);
          }
        }
      }
      return forced;
    }

    private long pending() {
      return sessions.stream().filter(s -> !s.terminated().isDone()).count();
    }

    /** Sleeps in quanta until {@code targetNanos}; flags cancellation and returns early on stop. */
    private void sleepUntil(long targetNanos) throws InterruptedException {
      while (true) {
        if (shouldStop()) {
          cancelled = true;
          return;
        }
        long remaining = targetNanos - System.nanoTime();
        if (remaining <= 0) {
          return;
        }
        TimeUnit.NANOSECONDS.sleep(Math.min(QUANTUM.toNanos(), remaining));
      }
    }

    private void phase(RampPhase phase) {
      try {
        listener.onPhase(phase);
      } catch (RuntimeException e) {
        log.warn("Run {} listener failed on {}: {}", runId, phase, e.getMessage(), e);
      }
    }

    private boolean shouldStop() {
      return Thread.currentThread().isInterrupted() || cancellationRequested.getAsBoolean();
    }

    private static long ceilDiv(long x, long y) {
      return -Math.floorDiv(-x, y);
    }
  }
}
