package com.mk.fx.qa.ws.benchmark.client;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/** Opens WebSocket connections. Implementations are shared by all sessions of a run. */
public interface StreamTransport extends AutoCloseable {

    /**
     * Starts an asynchronous connection attempt.
     *
     * @param endpoint ws:// or wss:// URI, including the handshake path
     * @param listener receives frames once the connection is open
     * @return completes with the open connection, or exceptionally on refusal, timeout, TLS or DNS
     *     failure
     */
    CompletableFuture<StreamConnection> connect(URI endpoint, FrameListener listener);

    @Override
    void close();
}
