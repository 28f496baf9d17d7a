package com.mk.fx.qa.ws.benchmark.session;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of one benchmark session. {@link #CLOSED} and {@link #FAILED} are absorbing. */
public enum SessionState {
  CONNECTING,
  AUTHENTICATING,
  SUBSCRIBING,
  ACTIVE,
  UPDATING,
  CLOSING,
  CLOSED,
  FAILED;

  public boolean isTerminal() {
    return this == CLOSED || this == FAILED;
  }

  public boolean canTransitionTo(SessionState next) {
    return successors().contains(next);
  }

  private Set<SessionState> successors() {
    return switch (this) {
      case CONNECTING -> EnumSet.of(AUTHENTICATING, FAILED);
      case AUTHENTICATING -> EnumSet.of(SUBSCRIBING, FAILED);
      case SUBSCRIBING -> EnumSet.of(ACTIVE, FAILED);
      case ACTIVE -> EnumSet.of(UPDATING, CLOSING, FAILED);
      case UPDATING -> EnumSet.of(ACTIVE, CLOSING, FAILED);
      case CLOSING -> EnumSet.of(CLOSED, FAILED);
      case CLOSED, FAILED -> EnumSet.noneOf(SessionState.class);
    };
  }
}
