package com.mk.fx.qa.ws.benchmark.ramp;

import java.util.concurrent.CompletableFuture;

/** A session whose lifetime is driven by the {@link RampController}. */
public interface ManagedSession {

  /** Begins connecting. Must not block on the network. */
  void start();

  /** Requests a graceful close. Idempotent; a session still handshaking is cancelled. */
  void close();

  /** Forces the session into a terminal state and releases its resources. */
  void abort();

  /** Completes once the session reaches a terminal state. */
  CompletableFuture<?> terminated();
}
