package com.mk.fx.qa.ws.benchmark.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  public static Duration orDefault(Duration duration, Duration fallback) {
    return duration != null ? duration : fallback;
  }
}
