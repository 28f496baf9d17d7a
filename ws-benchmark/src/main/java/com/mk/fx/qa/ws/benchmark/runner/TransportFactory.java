package com.mk.fx.qa.ws.benchmark.runner;

import com.mk.fx.qa.ws.benchmark.client.StreamTransport;
import com.mk.fx.qa.ws.benchmark.client.WebSocketStreamTransport;
import java.time.Duration;

/** Opens the transport shared by all sessions of one run. */
@FunctionalInterface
public interface TransportFactory {

  TransportFactory WEBSOCKET = WebSocketStreamTransport::new;

  StreamTransport open(Duration connectTimeout);
}
