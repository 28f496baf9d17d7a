package com.mk.fx.qa.ws.benchmark.client;

/**
 * Receives events for one connection. Calls for a given connection are never concurrent with each
 * other, but may arrive on any thread.
 */
public interface FrameListener {

    /** A complete text message (partial frames are already reassembled). */
    void onText(String text);

    /** The server closed the connection, or the close handshake completed. */
    void onClosed(int statusCode, String reason);

    /** The connection failed after being opened. */
    void onError(Throwable error);
}
