package com.mk.fx.qa.ws.benchmark;

import com.mk.fx.qa.ws.benchmark.cfg.BenchmarkProperties;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import com.mk.fx.qa.ws.benchmark.runner.ScenarioRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one benchmark with the bound {@link BenchmarkProperties}. Exit status: 0 after a complete
 * schedule, 2 on a configuration error, 1 on any other failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "benchmark", name = "run-on-startup", matchIfMissing = true)
public class BenchmarkCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int FAILURE_EXIT_CODE = 1;

  private final BenchmarkProperties properties;
  private final ScenarioRunner scenarioRunner;

  private volatile int exitCode;

  @Override
  public void run(ApplicationArguments args) {
    try {
      scenarioRunner.run(properties.toRequest());
      exitCode = 0;
    } catch (FatalConfigurationException e) {
      log.error("Benchmark configuration rejected: {}", e.getMessage());
      exitCode = e.getExitCode();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Benchmark interrupted");
      exitCode = FAILURE_EXIT_CODE;
    } catch (RuntimeException e) {
      log.error("Benchmark failed: {}", e.getMessage(), e);
      exitCode = FAILURE_EXIT_CODE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
