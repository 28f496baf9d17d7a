package com.mk.fx.qa.ws.benchmark;

import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.bind.BindException;

@SpringBootApplication
public class WsBenchmarkApplication {

  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = SpringApplication.exit(SpringApplication.run(WsBenchmarkApplication.class, args));
    } catch (RuntimeException e) {
      exitCode = startupFailureExitCode(e);
    }
    System.exit(exitCode);
  }

  /** Invalid bound properties count as configuration errors; anything else is a plain failure. */
  static int startupFailureExitCode(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
      if (t instanceof BindException || t instanceof FatalConfigurationException) {
        return FatalConfigurationException.EXIT_CODE;
      }
    }
    return BenchmarkCommandRunner.FAILURE_EXIT_CODE;
  }
}
