package com.mk.fx.qa.ws.benchmark.runner;

import com.mk.fx.qa.ws.benchmark.metrics.BenchmarkSummary;
import com.mk.fx.qa.ws.benchmark.ramp.RampResult;

/** JSON run report: the metrics snapshot plus how the ramp schedule played out. */
public record RunReport(BenchmarkSummary summary, RampResult ramp) {}
