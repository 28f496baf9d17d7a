package com.mk.fx.qa.ws.benchmark.ramp;

import java.time.Duration;

/**
 * Outcome of one ramp schedule.
 *
 * @param scheduled sessions the factory was asked for
 * @param started sessions whose {@code start()} returned normally
 * @param closedGracefully sessions that reached a terminal state before the deadline
 * @param forcedTerminations sessions aborted at the deadline
 */
public record RampResult(
    int scheduled,
    int started,
    int closedGracefully,
    int forcedTerminations,
    boolean cancelled,
    Duration elapsed) {}
