package com.mk.fx.qa.ws.benchmark.runner;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.ws.benchmark.metrics.MetricsAggregator;
import com.mk.fx.qa.ws.benchmark.model.Scenario;
import com.mk.fx.qa.ws.benchmark.ramp.RampPhase;
import com.mk.fx.qa.ws.benchmark.support.TestRuns;
import org.junit.jupiter.api.Test;

class RunPhaseListenerTest {

  private final MetricsAggregator metrics = TestRuns.metrics(Scenario.SINGLE_TOKEN);
  private final RunPhaseListener listener = new RunPhaseListener(metrics);

  @Test
  void measurementStartsAtHold() {
    listener.onPhase(RampPhase.RAMP_UP);
    listener.onPhase(RampPhase.WARMUP);
    assertFalse(metrics.isMeasuring());

    listener.onPhase(RampPhase.HOLD);
    assertTrue(metrics.isMeasuring());
  }

  @Test
  void sessionThatNeverStarted_isBookedAsConnectionError() {
    metrics.recordConnectionAttempt();
    metrics.recordSubscribeSuccess(4);

    listener.onSessionStartFailed(1, new IllegalStateException("factory broke"));

    var s = metrics.snapshot();
    assertEquals(1, s.connectionErrors());
    assertEquals(2, s.sessionsAccounted());
    assertEquals(1L, s.errorBreakdown().get("CONNECT:" + RunPhaseListener.START_FAILED));
  }
}
