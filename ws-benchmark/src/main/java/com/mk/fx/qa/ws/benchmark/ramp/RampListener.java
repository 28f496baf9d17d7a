package com.mk.fx.qa.ws.benchmark.ramp;

/** Callbacks from the ramp loop. Invoked on the thread running {@link RampController#execute}. */
public interface RampListener {

  RampListener NONE = new RampListener() {};

  default void onPhase(RampPhase phase) {}

  default void onSessionStartFailed(int index, Exception error) {}
}
