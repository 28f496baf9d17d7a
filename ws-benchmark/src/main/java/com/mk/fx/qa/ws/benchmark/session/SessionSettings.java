package com.mk.fx.qa.ws.benchmark.session;

import com.mk.fx.qa.ws.benchmark.model.Scenario;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-run settings shared by every session.
 *
 * @param endpoint full WebSocket URI including the {@code /app/{key}} handshake path
 * @param ackTimeout covers authentication plus the initial subscribe, and each filter update
 * @param updateInterval period of live filter updates for scenarios that use them
 * @param closeLinger how long a closing session waits for the server's close frame
 */
public record SessionSettings(
    URI endpoint,
    String channel,
    Scenario scenario,
    Duration ackTimeout,
    Duration updateInterval,
    Duration closeLinger) {

  public SessionSettings {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(scenario, "scenario");
    Objects.requireNonNull(ackTimeout, "ackTimeout");
    Objects.requireNonNull(updateInterval, "updateInterval");
    Objects.requireNonNull(closeLinger, "closeLinger");
    if (scenario.periodicUpdate() && (updateInterval.isZero() || updateInterval.isNegative())) {
      throw new IllegalArgumentException("updateInterval must be positive for " + scenario);
    }
  }
}
