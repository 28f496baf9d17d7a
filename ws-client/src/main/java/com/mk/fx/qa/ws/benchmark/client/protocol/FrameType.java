package com.mk.fx.qa.ws.benchmark.client.protocol;

/** Classification of an inbound text frame, independent of the server's event naming. */
public enum FrameType {
    /** Handshake completed; the server is ready to accept a subscribe request. */
    CONNECTION_ESTABLISHED,
    /** Acknowledgement of a subscribe or replacement subscribe. */
    SUBSCRIBE_ACK,
    /** Explicit rejection of a subscribe request. */
    SUBSCRIBE_ERROR,
    /** Keep-alive probe that must be answered. */
    PING,
    /** Data published on a channel. */
    CHANNEL_DATA,
    UNKNOWN
}
