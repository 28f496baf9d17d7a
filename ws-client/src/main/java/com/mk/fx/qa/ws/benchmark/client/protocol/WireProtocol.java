package com.mk.fx.qa.ws.benchmark.client.protocol;

/**
 * Message schema spoken with the streaming server. The benchmark only depends on this contract:
 * the handshake carries the application key, the subscribe request carries channel, comparison
 * mode and values, and acknowledgements can be told apart from channel data.
 */
public interface WireProtocol {

    /** Path (including leading slash) of the WebSocket handshake for the given application key. */
    String handshakePath(String appKey);

    /** Encodes a subscribe request; also used for live filter replacement. */
    String encodeSubscribe(String channel, SubscriptionFilter filter);

    /**
     * Decodes a text frame. Frames that cannot be parsed are reported as {@link FrameType#UNKNOWN}
     * rather than thrown.
     */
    InboundFrame decode(String text);

    /** Reply for a {@link FrameType#PING} frame. */
    String pongFor(InboundFrame ping);
}
