package com.mk.fx.qa.ws.benchmark.filter;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.ws.benchmark.client.protocol.ComparisonMode;
import com.mk.fx.qa.ws.benchmark.client.protocol.SubscriptionFilter;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import com.mk.fx.qa.ws.benchmark.model.Scenario;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FilterGeneratorTest {

  private final AddressPool pool = AddressPool.generateFake(AddressPool.DEFAULT_FAKE_SIZE);

  @ParameterizedTest
  @EnumSource(Scenario.class)
  void generate_returnsExactlyKDistinctPoolValues(Scenario scenario) {
    var generator = new FilterGenerator(pool, "token_address");
    Set<String> known = new HashSet<>(pool.addresses());

    SubscriptionFilter filter = generator.generate(scenario);

    assertEquals(scenario.cardinality(), filter.cardinality());
    assertEquals(scenario.cardinality(), new HashSet<>(filter.values()).size());
    assertTrue(known.containsAll(filter.values()));
    assertEquals(scenario.mode(), filter.mode());
    assertEquals("token_address", filter.key());
  }

  @Test
  void generate_densePoolStillDistinct() {
    var small = AddressPool.generateFake(500);
    var generator = new FilterGenerator(small, null);

    SubscriptionFilter filter = generator.generate(Scenario.IN_500);

    assertEquals(500, new HashSet<>(filter.values()).size());
    assertEquals(FilterGenerator.DEFAULT_FILTER_KEY, filter.key());
    assertEquals(ComparisonMode.IN_SET, filter.mode());
  }

  @Test
  void generate_moreValuesThanPoolIsRejected() {
    var generator = new FilterGenerator(AddressPool.generateFake(99), "k");

    assertThrows(IllegalArgumentException.class, () -> generator.generate(Scenario.IN_100));
    assertThrows(FatalConfigurationException.class, () -> generator.requireCapacity(Scenario.IN_100));
    generator.requireCapacity(Scenario.IN_10);
  }

  @Test
  void generate_periodicCallsYieldIndependentValues() {
    var generator = new FilterGenerator(pool, "k", () -> new Random(42));
    var seeded = generator.generate(Scenario.SINGLE_TOKEN_UPDATE);
    assertEquals(seeded, generator.generate(Scenario.SINGLE_TOKEN_UPDATE));

    var random = new FilterGenerator(pool, "k");
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 50; i++) {
      seen.add(random.generate(Scenario.SINGLE_TOKEN_UPDATE).values().get(0));
    }
    assertTrue(seen.size() > 1);
  }

  @Test
  void generate_isSafeUnderConcurrency() throws Exception {
    var generator = new FilterGenerator(pool, "k");
    List<SubscriptionFilter> results = new CopyOnWriteArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    var done = new CountDownLatch(8);
    List<Throwable> failures = new CopyOnWriteArrayList<>();
    for (int t = 0; t < 8; t++) {
      executor.execute(
          () -> {
            try {
              for (int i = 0; i < 100; i++) {
                results.add(generator.generate(Scenario.IN_100));
              }
            } catch (Throwable e) {
              failures.add(e);
            } finally {
              done.countDown();
            }
          });
    }
    assertTrue(done.await(10, TimeUnit.SECONDS));
    executor.shutdownNow();

    assertTrue(failures.isEmpty(), () -> new ArrayList<>(failures).toString());
    assertEquals(800, results.size());
    results.forEach(f -> assertEquals(100, new HashSet<>(f.values()).size()));
  }
}
