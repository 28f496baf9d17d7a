package com.mk.fx.qa.ws.benchmark.metrics;

import com.mk.fx.qa.ws.benchmark.model.Scenario;
import java.time.Duration;

/**
 * Immutable description of a benchmark run, used to label progress logs and the final summary.
 */
public record RunConfig(
    String runId,
    Scenario scenario,
    String endpoint,
    String channel,
    int clients,
    int clientIdOffset,
    Duration rampUp,
    Duration warmup,
    Duration hold,
    Duration rampDown,
    Duration updateInterval) {}
