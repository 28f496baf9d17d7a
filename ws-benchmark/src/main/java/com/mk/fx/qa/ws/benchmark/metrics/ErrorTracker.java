package com.mk.fx.qa.ws.benchmark.metrics;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocketHandshakeException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import javax.net.ssl.SSLException;

/** Counts failures per {@code KIND:CATEGORY} key, e.g. {@code CONNECT:CONNECTION_REFUSED}. */
final class ErrorTracker {

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();

  void record(FailureKind kind, String category) {
    totalErrors.incrementAndGet();
    String key = kind.name() + ":" + normalise(category);
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  long totalErrors() {
    return totalErrors.get();
  }

  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new TreeMap<>();
    for (var e : errorBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return map;
  }

  private static String normalise(String category) {
    return category == null || category.isBlank() ? "UNKNOWN" : category.toUpperCase();
  }

  /**
   * Maps a connect failure to a stable category. The first recognised exception on the cause chain
   * wins, so wrappers such as {@code CompletionException} are looked through.
   */
  static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable current = t;
    Throwable rootCause = t;
    while (current != null) {
      String category = categoryOf(current);
      if (category != null) {
        return category;
      }
      rootCause = current;
      current = current.getCause() == current ? null : current.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return clsName.isBlank() ? "EXCEPTION" : clsName;
  }

  private static String categoryOf(Throwable t) {
    if (t instanceof ConnectException) return "CONNECTION_REFUSED";
    if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException)
      return "UNKNOWN_HOST";
    if (t instanceof SSLException) return "SSL_ERROR";
    if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException)
      return "CONNECT_TIMEOUT";
    if (t instanceof WebSocketHandshakeException) return "HANDSHAKE_REJECTED";
    if (t instanceof CancellationException) return "CANCELLED";
    return null;
  }

  enum FailureKind {
    CONNECT,
    SUBSCRIBE,
    UPDATE
  }
}
