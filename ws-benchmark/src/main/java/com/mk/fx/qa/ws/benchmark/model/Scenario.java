package com.mk.fx.qa.ws.benchmark.model;

import com.mk.fx.qa.ws.benchmark.client.protocol.ComparisonMode;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/** Benchmark scenarios: the filter shape each session subscribes with. */
public enum Scenario {
  SINGLE_TOKEN(1, 1, ComparisonMode.EQUALS, false, "Single token filter"),
  SINGLE_TOKEN_UPDATE(2, 1, ComparisonMode.EQUALS, true, "Single token filter, periodic update"),
  IN_10(3, 10, ComparisonMode.IN_SET, false, "IN filter, 10 tokens"),
  IN_100(4, 100, ComparisonMode.IN_SET, false, "IN filter, 100 tokens"),
  IN_500(5, 500, ComparisonMode.IN_SET, false, "IN filter, 500 tokens");

  private final int id;
  private final int cardinality;
  private final ComparisonMode mode;
  private final boolean periodicUpdate;
  private final String label;

  Scenario(int id, int cardinality, ComparisonMode mode, boolean periodicUpdate, String label) {
    this.id = id;
    this.cardinality = cardinality;
    this.mode = mode;
    this.periodicUpdate = periodicUpdate;
    this.label = label;
  }

  public int id() {
    return id;
  }

  public int cardinality() {
    return cardinality;
  }

  public ComparisonMode mode() {
    return mode;
  }

  public boolean periodicUpdate() {
    return periodicUpdate;
  }

  public String label() {
    return label;
  }

  public static Scenario fromId(int id) {
    return Arrays.stream(values())
        .filter(scenario -> scenario.id == id)
        .findFirst()
        .orElseThrow(
            () ->
                new FatalConfigurationException(
                    "Unsupported scenario: " + id + " (expected one of " + ids() + ")"));
  }

  public static Set<Integer> ids() {
    return Arrays.stream(values()).map(Scenario::id).collect(Collectors.toUnmodifiableSet());
  }
}
