package com.mk.fx.qa.ws.benchmark.ramp;

import static com.mk.fx.qa.ws.benchmark.utils.LoadUtils.toDuration;

import java.time.Duration;

/**
 * Ramp schedule. Null durations are treated as zero. The hard deadline for all sessions to finish
 * is {@code rampUp + warmup + hold + rampDown + grace} after the ramp starts.
 */
public record RampParameters(
    int sessions,
    Duration rampUp,
    Duration warmup,
    Duration hold,
    Duration rampDown,
    Duration grace) {

  public RampParameters {
    if (sessions < 0) {
      throw new IllegalArgumentException("sessions must be >= 0");
    }
    rampUp = requireNonNegative(rampUp, "rampUp");
    warmup = requireNonNegative(warmup, "warmup");
    hold = requireNonNegative(hold, "hold");
    rampDown = requireNonNegative(rampDown, "rampDown");
    grace = requireNonNegative(grace, "grace");
  }

  public Duration scheduled() {
    return rampUp.plus(warmup).plus(hold).plus(rampDown);
  }

  private static Duration requireNonNegative(Duration value, String name) {
    Duration d = toDuration(value);
    if (d.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative");
    }
    return d;
  }
}
