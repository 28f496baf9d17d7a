package com.mk.fx.qa.ws.benchmark.session;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.ws.benchmark.client.FrameListener;
import com.mk.fx.qa.ws.benchmark.client.StreamConnection;
import com.mk.fx.qa.ws.benchmark.client.StreamTransport;
import com.mk.fx.qa.ws.benchmark.client.protocol.InboundFrame;
import com.mk.fx.qa.ws.benchmark.client.protocol.SubscriptionFilter;
import com.mk.fx.qa.ws.benchmark.client.protocol.WireProtocol;
import com.mk.fx.qa.ws.benchmark.filter.FilterGenerator;
import com.mk.fx.qa.ws.benchmark.metrics.MetricsAggregator;
import com.mk.fx.qa.ws.benchmark.ramp.ManagedSession;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * One WebSocket client driven through connect, authenticate, subscribe and (optionally) periodic
 * filter updates.
 *
 * <p>All transitions happen under a per-session lock; transport callbacks and timers of other
 * sessions never contend for it. Every started session ends up in exactly one of three buckets:
 * subscribe success, subscribe failure, or connection error.
 */
@Slf4j
public class SessionClient implements ManagedSession, FrameListener {

  static final String CLOSE_REASON = "benchmark complete";

  private final int id;
  private final SessionSettings settings;
  private final StreamTransport transport;
  private final WireProtocol protocol;
  private final FilterGenerator filters;
  private final MetricsAggregator metrics;
  private final ScheduledExecutorService timers;

  private final Object lock = new Object();
  private final CompletableFuture<SessionState> terminated = new CompletableFuture<>();
  private final AtomicLong messagesReceived = new AtomicLong();

  private volatile SessionState state = SessionState.CONNECTING;

  // Guarded by lock.
  private boolean started;
  private Outcome outcome = Outcome.NONE;
  private boolean gaugeHeld;
  private CompletableFuture<StreamConnection> connecting;
  private StreamConnection connection;
  private SubscriptionFilter filter;
  private long subscribeStartNanos;
  private long updateStartNanos;
  private boolean updateMeasured;
  private long updateSeq;
  private int updatesSent;
  private ScheduledFuture<?> ackTimeout;
  private ScheduledFuture<?> updateTicker;
  private ScheduledFuture<?> updateTimeout;
  private ScheduledFuture<?> lingerTimer;

  public SessionClient(
      int id,
      SessionSettings settings,
      StreamTransport transport,
      WireProtocol protocol,
      FilterGenerator filters,
      MetricsAggregator metrics,
      ScheduledExecutorService timers) {
    this.id = id;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.filters = Objects.requireNonNull(filters, "filters");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.timers = Objects.requireNonNull(timers, "timers");
  }

  @Override
  public void start() {
    CompletableFuture<StreamConnection> attempt;
    synchronized (lock) {
      if (started) {
        throw new IllegalStateException("Session " + id + " already started");
      }
      started = true;
      metrics.recordConnectionAttempt();
      log.debug("Session {} connecting to {}", id, settings.endpoint());
      try {
        attempt = transport.connect(settings.endpoint(), this);
      } catch (RuntimeException e) {
        attempt = CompletableFuture.failedFuture(e);
      }
      connecting = attempt;
    }
    attempt.whenComplete(this::onConnectCompleted);
  }

  private void onConnectCompleted(StreamConnection opened, Throwable error) {
    synchronized (lock) {
      if (error != null) {
        if (state == SessionState.CONNECTING) {
          log.debug("Session {} failed to connect: {}", id, error.toString());
          outcome = Outcome.CONNECTION_ERROR;
          metrics.recordConnectionError(error);
          transition(SessionState.FAILED);
        }
        return;
      }
      if (state != SessionState.CONNECTING) {
        // Cancelled while the handshake was in flight.
        opened.abort();
        return;
      }
      connection = opened;
      gaugeHeld = true;
      metrics.recordConnectionOpened();
      transition(SessionState.AUTHENTICATING);
      ackTimeout = schedule(this::onAckTimeout, settings.ackTimeout());
    }
    opened.startReceiving();
  }

  @Override
  public void onText(String text) {
    try {
      InboundFrame frame = protocol.decode(text);
      switch (frame.type()) {
        case PING -> send(protocol.pongFor(frame));
        case CONNECTION_ESTABLISHED -> onConnectionEstablished();
        case SUBSCRIBE_ACK -> {
          if (frame.isFor(settings.channel())) onAck();
        }
        case SUBSCRIBE_ERROR -> {
          if (frame.isFor(settings.channel())) onRejected(frame.detail());
        }
        case CHANNEL_DATA -> {
          if (settings.channel().equals(frame.channel())) onData(frame);
        }
        case UNKNOWN -> log.trace("Session {} ignoring frame {}", id, frame.event());
      }
    } catch (RuntimeException e) {
      log.warn("Session {} failed handling frame: {}", id, e.getMessage(), e);
      failUnexpected();
    }
  }

  private void onConnectionEstablished() {
    synchronized (lock) {
      if (state != SessionState.AUTHENTICATING) {
        log.debug("Session {} ignoring connection_established in {}", id, state);
        return;
      }
      filter = filters.generate(settings.scenario());
      String frame = protocol.encodeSubscribe(settings.channel(), filter);
      transition(SessionState.SUBSCRIBING);
      subscribeStartNanos = System.nanoTime();
      send(frame);
    }
  }

  private void onAck() {
    synchronized (lock) {
      switch (state) {
        case SUBSCRIBING -> {
          long latencyMs = elapsedMs(subscribeStartNanos);
          cancel(ackTimeout);
          outcome = Outcome.SUBSCRIBED;
          metrics.recordSubscribeSuccess(latencyMs);
          transition(SessionState.ACTIVE);
          log.debug("Session {} subscribed in {} ms", id, latencyMs);
          if (settings.scenario().periodicUpdate()) {
            long intervalMs = settings.updateInterval().toMillis();
            updateTicker =
                timers.scheduleAtFixedRate(
                    this::onUpdateTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
          }
        }
        case UPDATING -> {
          long latencyMs = elapsedMs(updateStartNanos);
          cancel(updateTimeout);
          if (updateMeasured) {
            metrics.recordUpdateSuccess(latencyMs);
          }
          transition(SessionState.ACTIVE);
        }
        default -> log.trace("Session {} ignoring duplicate ack in {}", id, state);
      }
    }
  }

  private void onRejected(String detail) {
    synchronized (lock) {
      switch (state) {
        case AUTHENTICATING, SUBSCRIBING -> failSubscribe("REJECTED", detail);
        case UPDATING -> {
          failPendingUpdate("REJECTED");
          transition(SessionState.ACTIVE);
        }
        default -> log.debug("Session {} error frame in {}: {}", id, state, detail);
      }
    }
  }

  private void onData(InboundFrame frame) {
    SessionState current = state;
    if (current != SessionState.ACTIVE
        && current != SessionState.UPDATING
        && current != SessionState.CLOSING) {
      return;
    }
    Long endToEndMs =
        frame.timestampMs() == null ? null : System.currentTimeMillis() - frame.timestampMs();
    if (messagesReceived.incrementAndGet() == 1) {
      log.debug("Session {} first message: event={}, e2e={}ms", id, frame.event(), endToEndMs);
    }
    metrics.recordMessageReceived(endToEndMs);
  }

  private void onAckTimeout() {
    synchronized (lock) {
      if (state == SessionState.AUTHENTICATING || state == SessionState.SUBSCRIBING) {
        failSubscribe("ACK_TIMEOUT", "no ack within " + settings.ackTimeout());
      }
    }
  }

  @VisibleForTesting
  void onUpdateTick() {
    synchronized (lock) {
      if (state == SessionState.UPDATING) {
        failPendingUpdate("SUPERSEDED");
        transition(SessionState.ACTIVE);
      }
      if (state != SessionState.ACTIVE) {
        return;
      }
      filter = filters.generate(settings.scenario());
      String frame = protocol.encodeSubscribe(settings.channel(), filter);
      updateMeasured = metrics.isMeasuring();
      if (updateMeasured) {
        metrics.recordUpdateAttempt();
      }
      updatesSent++;
      transition(SessionState.UPDATING);
      updateStartNanos = System.nanoTime();
      long seq = ++updateSeq;
      updateTimeout = schedule(() -> onUpdateTimeout(seq), settings.ackTimeout());
      send(frame);
    }
  }

  private void onUpdateTimeout(long seq) {
    synchronized (lock) {
      if (state == SessionState.UPDATING && seq == updateSeq) {
        failPendingUpdate("ACK_TIMEOUT");
        transition(SessionState.ACTIVE);
      }
    }
  }

  @Override
  public void close() {
    CompletableFuture<StreamConnection> toCancel = null;
    synchronized (lock) {
      switch (state) {
        case CONNECTING -> {
          if (started) {
            outcome = Outcome.CONNECTION_ERROR;
            metrics.recordConnectionError("CANCELLED");
            toCancel = connecting;
          }
          transition(SessionState.FAILED);
        }
        case AUTHENTICATING, SUBSCRIBING -> failSubscribe("CANCELLED", "closed before ack");
        case ACTIVE, UPDATING -> {
          if (state == SessionState.UPDATING) {
            failPendingUpdate("CANCELLED");
          }
          transition(SessionState.CLOSING);
          connection
              .close(StreamConnection.NORMAL_CLOSURE, CLOSE_REASON)
              .whenComplete(
                  (ignored, error) -> {
                    if (error != null) {
                      log.debug("Session {} close frame not sent: {}", id, error.toString());
                    }
                  });
          lingerTimer = schedule(this::finishClose, settings.closeLinger());
        }
        default -> {
          // Already closing or terminal.
        }
      }
    }
    if (toCancel != null) {
      toCancel.cancel(true);
    }
  }

  private void finishClose() {
    synchronized (lock) {
      if (state == SessionState.CLOSING) {
        transition(SessionState.CLOSED);
      }
    }
  }

  @Override
  public void abort() {
    CompletableFuture<StreamConnection> toCancel = null;
    synchronized (lock) {
      if (state.isTerminal()) {
        return;
      }
      metrics.recordForcedTermination();
      if (outcome == Outcome.NONE && started) {
        if (state == SessionState.CONNECTING) {
          outcome = Outcome.CONNECTION_ERROR;
          metrics.recordConnectionError("ABORTED");
          toCancel = connecting;
        } else {
          outcome = Outcome.SUBSCRIBE_FAILED;
          metrics.recordSubscribeFailure("ABORTED");
        }
      }
      if (state == SessionState.UPDATING) {
        failPendingUpdate("ABORTED");
      }
      log.debug("Session {} aborted in {}", id, state);
      transition(SessionState.FAILED);
    }
    if (toCancel != null) {
      toCancel.cancel(true);
    }
  }

  @Override
  public void onClosed(int statusCode, String reason) {
    onTransportLost("closed by server (" + statusCode + " " + reason + ")");
  }

  @Override
  public void onError(Throwable error) {
    onTransportLost(error == null ? "transport error" : error.toString());
  }

  private void onTransportLost(String detail) {
    synchronized (lock) {
      switch (state) {
        case CLOSING -> transition(SessionState.CLOSED);
        case AUTHENTICATING, SUBSCRIBING -> failSubscribe("TRANSPORT_CLOSED", detail);
        case ACTIVE, UPDATING -> {
          if (state == SessionState.UPDATING) {
            failPendingUpdate("TRANSPORT_CLOSED");
          }
          log.debug("Session {} disconnected: {}", id, detail);
          metrics.recordDisconnect();
          transition(SessionState.FAILED);
        }
        default -> log.trace("Session {} transport event in {}: {}", id, state, detail);
      }
    }
  }

  private void failUnexpected() {
    synchronized (lock) {
      if (state.isTerminal()) {
        return;
      }
      if (outcome == Outcome.NONE) {
        outcome = Outcome.SUBSCRIBE_FAILED;
        metrics.recordSubscribeFailure("INTERNAL_ERROR");
      }
      if (state == SessionState.UPDATING) {
        failPendingUpdate("INTERNAL_ERROR");
      }
      transition(SessionState.FAILED);
    }
  }

  private void failSubscribe(String category, String detail) {
    log.debug("Session {} subscribe failed ({}): {}", id, category, detail);
    outcome = Outcome.SUBSCRIBE_FAILED;
    metrics.recordSubscribeFailure(category);
    transition(SessionState.FAILED);
  }

  private void failPendingUpdate(String category) {
    cancel(updateTimeout);
    if (updateMeasured) {
      metrics.recordUpdateFailure(category);
    }
  }

  private void transition(SessionState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Session " + id + " cannot move from " + state + " to " + next);
    }
    state = next;
    if (next.isTerminal()) {
      release();
      terminated.complete(next);
    }
  }

  private void release() {
    cancel(ackTimeout);
    cancel(updateTicker);
    cancel(updateTimeout);
    cancel(lingerTimer);
    if (gaugeHeld) {
      gaugeHeld = false;
      metrics.recordConnectionClosed();
    }
    if (connection != null) {
      connection.abort();
    }
  }

  private void send(String text) {
    StreamConnection current;
    synchronized (lock) {
      current = connection;
    }
    if (current == null) {
      return;
    }
    current
        .sendText(text)
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                log.debug("Session {} send failed: {}", id, error.toString());
                onTransportLost("send failed: " + error);
              }
            });
  }

  private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
    return timers.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static void cancel(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  @Override
  public CompletableFuture<SessionState> terminated() {
    return terminated;
  }

  public int id() {
    return id;
  }

  public SessionState state() {
    return state;
  }

  public long messagesReceived() {
    return messagesReceived.get();
  }

  public int updatesSent() {
    synchronized (lock) {
      return updatesSent;
    }
  }

  public SubscriptionFilter filter() {
    synchronized (lock) {
      return filter;
    }
  }

  private enum Outcome {
    NONE,
    SUBSCRIBED,
    SUBSCRIBE_FAILED,
    CONNECTION_ERROR
  }
}
