package com.mk.fx.qa.ws.benchmark.support;

/** Scripted server side of a {@link FakeConnection}. */
public interface FakeServer {

  String ESTABLISHED =
      "{\"event\":\"pusher:connection_established\",\"data\":\"{\\\"socket_id\\\":\\\"1.1\\\"}\"}";

  /** Never answers anything. */
  FakeServer SILENT = new FakeServer() {};

  default void onOpen(FakeConnection connection) {}

  default void onClientText(FakeConnection connection, String text) {}

  default void onClientClose(FakeConnection connection, int statusCode) {}

  static String ack(String channel) {
    return "{\"event\":\"pusher_internal:subscription_succeeded\",\"channel\":\"" + channel + "\"}";
  }

  static String error(String message) {
    return "{\"event\":\"pusher:error\",\"data\":{\"message\":\"" + message + "\",\"code\":4001}}";
  }

  static String data(String channel, long timestampMs) {
    return "{\"event\":\"token-update\",\"channel\":\""
        + channel
        + "\",\"tags\":{\"timestamp\":"
        + timestampMs
        + "},\"data\":{}}";
  }

  /** Handshakes, acknowledges every subscribe and echoes the close handshake. */
  static FakeServer acking(String channel) {
    return new FakeServer() {
      @Override
      public void onOpen(FakeConnection connection) {
        connection.deliver(ESTABLISHED);
      }

      @Override
      public void onClientText(FakeConnection connection, String text) {
        if (text.contains("pusher:subscribe")) {
          connection.deliver(ack(channel));
        }
      }

      @Override
      public void onClientClose(FakeConnection connection, int statusCode) {
        connection.serverClose(statusCode, "bye");
      }
    };
  }

  /** Handshakes but never acknowledges. */
  static FakeServer handshakeOnly() {
    return new FakeServer() {
      @Override
      public void onOpen(FakeConnection connection) {
        connection.deliver(ESTABLISHED);
      }
    };
  }

  /** Handshakes and rejects every subscribe. */
  static FakeServer rejecting(String message) {
    return new FakeServer() {
      @Override
      public void onOpen(FakeConnection connection) {
        connection.deliver(ESTABLISHED);
      }

      @Override
      public void onClientText(FakeConnection connection, String text) {
        if (text.contains("pusher:subscribe")) {
          connection.deliver(error(message));
        }
      }
    };
  }
}
