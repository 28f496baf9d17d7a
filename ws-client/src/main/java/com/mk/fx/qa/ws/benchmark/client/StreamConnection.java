package com.mk.fx.qa.ws.benchmark.client;

import java.util.concurrent.CompletableFuture;

/** One open WebSocket connection, exclusively owned by a single session. */
public interface StreamConnection {

    int NORMAL_CLOSURE = 1000;

    /**
     * Starts delivering inbound frames to the listener. Nothing is delivered before this call, so
     * the owner can finish its own bookkeeping for the open connection first. Idempotent.
     */
    void startReceiving();

    /**
     * Queues a text message. Sends are delivered in call order; the returned future completes when
     * this message has been handed to the socket.
     */
    CompletableFuture<Void> sendText(String text);

    /** Starts the close handshake. Completes when the close frame has been sent. */
    CompletableFuture<Void> close(int statusCode, String reason);

    /** Drops the connection immediately without a close handshake. */
    void abort();

    boolean isOpen();
}
