package com.mk.fx.qa.ws.benchmark;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.ws.benchmark.cfg.BenchmarkProperties;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import com.mk.fx.qa.ws.benchmark.runner.ScenarioRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = "benchmark.run-on-startup=false")
class WsBenchmarkApplicationTest {

  @Autowired private ApplicationContext context;

  private final ApplicationContextRunner propertiesRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  ConfigurationPropertiesAutoConfiguration.class,
                  ValidationAutoConfiguration.class))
          .withUserConfiguration(BenchmarkProperties.class);

  @Test
  void contextLoads_withoutStartingBenchmark() {
    assertNotNull(context.getBean(ScenarioRunner.class));
    assertTrue(context.getBeansOfType(BenchmarkCommandRunner.class).isEmpty());
  }

  @Test
  void invalidBoundProperty_mapsToConfigurationExitCode() {
    propertiesRunner
        .withPropertyValues("benchmark.port=0")
        .run(
            failed -> {
              assertNotNull(failed.getStartupFailure());
              assertEquals(
                  FatalConfigurationException.EXIT_CODE,
                  WsBenchmarkApplication.startupFailureExitCode(failed.getStartupFailure()));
            });
  }

  @Test
  void validProperties_bind() {
    propertiesRunner
        .withPropertyValues("benchmark.host=localhost", "benchmark.hold-duration=5")
        .run(
            started -> {
              assertNull(started.getStartupFailure());
              assertEquals(
                  5, started.getBean(BenchmarkProperties.class).getHoldDuration().getSeconds());
            });
  }

  @Test
  void startupFailureExitCode_classifiesCauseChain() {
    assertEquals(
        2,
        WsBenchmarkApplication.startupFailureExitCode(
            new IllegalStateException(new FatalConfigurationException("bad"))));
    assertEquals(1, WsBenchmarkApplication.startupFailureExitCode(new IllegalStateException("x")));
  }
}
