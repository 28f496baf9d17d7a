package com.mk.fx.qa.ws.benchmark.model;

import org.springframework.boot.ExitCodeGenerator;

/** Raised before any session is created when a run cannot be configured. Exits with status 2. */
public class FatalConfigurationException extends RuntimeException implements ExitCodeGenerator {

  public static final int EXIT_CODE = 2;

  public FatalConfigurationException(String message) {
    super(message);
  }

  public FatalConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int getExitCode() {
    return EXIT_CODE;
  }
}
