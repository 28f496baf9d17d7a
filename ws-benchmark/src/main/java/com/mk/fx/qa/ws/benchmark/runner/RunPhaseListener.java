package com.mk.fx.qa.ws.benchmark.runner;

import com.mk.fx.qa.ws.benchmark.metrics.MetricsAggregator;
import com.mk.fx.qa.ws.benchmark.ramp.RampListener;
import com.mk.fx.qa.ws.benchmark.ramp.RampPhase;
import lombok.RequiredArgsConstructor;

/**
 * Opens the measurement window when the hold phase begins. A session that could not be created or
 * started is booked as a connection error so it still lands in one outcome bucket.
 */
@RequiredArgsConstructor
class RunPhaseListener implements RampListener {

  static final String START_FAILED = "START_FAILED";

  private final MetricsAggregator metrics;

  @Override
  public void onPhase(RampPhase phase) {
    if (phase == RampPhase.HOLD) {
      metrics.startMeasuring();
    }
  }

  @Override
  public void onSessionStartFailed(int index, Exception error) {
    metrics.recordConnectionError(START_FAILED);
  }
}
