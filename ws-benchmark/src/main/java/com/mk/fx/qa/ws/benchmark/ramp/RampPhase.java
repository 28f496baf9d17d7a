package com.mk.fx.qa.ws.benchmark.ramp;

public enum RampPhase {
  RAMP_UP,
  WARMUP,
  HOLD,
  RAMP_DOWN,
  DRAIN
}
