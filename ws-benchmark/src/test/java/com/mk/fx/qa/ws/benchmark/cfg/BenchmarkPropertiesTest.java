package com.mk.fx.qa.ws.benchmark.cfg;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class BenchmarkPropertiesTest {

  private static BenchmarkProperties bind(Map<String, String> values) {
    var binder = new Binder(new MapConfigurationPropertySource(values));
    return binder.bindOrCreate("benchmark", BenchmarkProperties.class);
  }

  @Test
  void defaults_matchStandardRun() {
    var props = bind(Map.of());

    assertEquals("stream-v2.projectscylla.com", props.getHost());
    assertEquals(443, props.getPort());
    assertEquals("knife-library-likely", props.getAppKey());
    assertEquals("trident_filter_tokens_v1", props.getChannel());
    assertEquals(1, props.getScenario());
    assertEquals(1000, props.getNumClients());
    assertEquals(Duration.ofSeconds(30), props.getRampDuration());
    assertEquals(Duration.ofSeconds(60), props.getHoldDuration());
    assertEquals(Duration.ofSeconds(10), props.getRampDownDuration());
    assertEquals(Duration.ZERO, props.getWarmupDuration());
    assertEquals(Duration.ofMillis(5000), props.getFilterUpdateInterval());
    assertEquals(Path.of("token-addresses.json"), props.getTokenFile());
  }

  @Test
  void plainNumbers_bindAsSecondsAndMillis() {
    var props =
        bind(
            Map.of(
                "benchmark.ramp-duration", "45",
                "benchmark.hold-duration", "120",
                "benchmark.warmup-duration", "15",
                "benchmark.filter-update-interval", "2500",
                "benchmark.num-clients", "250",
                "benchmark.scenario", "4"));

    assertEquals(Duration.ofSeconds(45), props.getRampDuration());
    assertEquals(Duration.ofSeconds(120), props.getHoldDuration());
    assertEquals(Duration.ofSeconds(15), props.getWarmupDuration());
    assertEquals(Duration.ofMillis(2500), props.getFilterUpdateInterval());
    assertEquals(250, props.getNumClients());
    assertEquals(4, props.getScenario());
  }

  @Test
  void toRequest_carriesEveryField() {
    var props = bind(Map.of("benchmark.client-id-offset", "500", "benchmark.port", "6001"));

    var request = props.toRequest();

    assertEquals(500, request.clientIdOffset());
    assertEquals(6001, request.port());
    assertEquals(props.getHost(), request.host());
    assertEquals(props.getHoldDuration(), request.hold());
    assertEquals(props.getSubscribeTimeout(), request.ackTimeout());
    assertEquals(props.getGracePeriod(), request.grace());
    assertEquals("token_address", request.filterKey());
  }
}
