package com.mk.fx.qa.ws.benchmark.filter;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.ws.benchmark.client.protocol.ComparisonMode;
import com.mk.fx.qa.ws.benchmark.client.protocol.SubscriptionFilter;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import com.mk.fx.qa.ws.benchmark.model.Scenario;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Produces subscription filters for a scenario by drawing distinct values from an {@link
 * AddressPool}. Safe for concurrent use: each call takes its randomness from the supplier and keeps
 * no shared cursor.
 */
public class FilterGenerator {

  public static final String DEFAULT_FILTER_KEY = "token_address";

  private final AddressPool pool;
  private final String filterKey;
  private final Supplier<Random> random;

  public FilterGenerator(AddressPool pool, String filterKey) {
    this(pool, filterKey, ThreadLocalRandom::current);
  }

  @VisibleForTesting
  FilterGenerator(AddressPool pool, String filterKey, Supplier<Random> random) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.filterKey = filterKey == null || filterKey.isBlank() ? DEFAULT_FILTER_KEY : filterKey;
    this.random = Objects.requireNonNull(random, "random");
  }

  public SubscriptionFilter generate(Scenario scenario) {
    Objects.requireNonNull(scenario, "scenario");
    int k = scenario.cardinality();
    if (k > pool.size()) {
      throw new IllegalArgumentException(
          "Scenario " + scenario.id() + " needs " + k + " distinct values, pool has " + pool.size());
    }
    var values = sample(k, random.get());
    return scenario.mode() == ComparisonMode.EQUALS
        ? SubscriptionFilter.equalTo(filterKey, values.get(0))
        : SubscriptionFilter.inSet(filterKey, values);
  }

  public void requireCapacity(Scenario scenario) {
    if (scenario.cardinality() > pool.size()) {
      throw new FatalConfigurationException(
          "Address pool holds "
              + pool.size()
              + " values but scenario "
              + scenario.id()
              + " needs "
              + scenario.cardinality());
    }
  }

  public String filterKey() {
    return filterKey;
  }

  private List<String> sample(int k, Random rnd) {
    int n = pool.size();
    var picked = new ArrayList<String>(k);
    if (k * 4 < n) {
      // Sparse draw: rejection sampling on indices.
      var seen = new HashSet<Integer>(k * 2);
      while (picked.size() < k) {
        int idx = rnd.nextInt(n);
        if (seen.add(idx)) {
          picked.add(pool.get(idx));
        }
      }
      return picked;
    }
    // Dense draw: partial Fisher-Yates over an index array.
    int[] indices = new int[n];
    for (int i = 0; i < n; i++) {
      indices[i] = i;
    }
    for (int i = 0; i < k; i++) {
      int j = i + rnd.nextInt(n - i);
      int tmp = indices[i];
      indices[i] = indices[j];
      indices[j] = tmp;
      picked.add(pool.get(indices[i]));
    }
    return picked;
  }
}
