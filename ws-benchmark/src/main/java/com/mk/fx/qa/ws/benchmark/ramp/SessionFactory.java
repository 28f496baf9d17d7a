package com.mk.fx.qa.ws.benchmark.ramp;

@FunctionalInterface
public interface SessionFactory {

  /** Creates the session for the zero-based {@code index} within the run. */
  ManagedSession create(int index);
}
