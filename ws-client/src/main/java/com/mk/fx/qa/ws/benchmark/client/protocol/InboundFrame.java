package com.mk.fx.qa.ws.benchmark.client.protocol;

/**
 * Decoded inbound frame.
 *
 * @param type classification used by the session state machine
 * @param event raw event name as sent by the server, may be null for raw frames
 * @param channel channel the frame refers to, null when absent
 * @param timestampMs publisher timestamp (epoch millis) carried by data frames, null when absent
 * @param detail short diagnostic payload (error message, ping data), null when absent
 */
public record InboundFrame(
        FrameType type, String event, String channel, Long timestampMs, String detail) {

    public static InboundFrame of(FrameType type, String event) {
        return new InboundFrame(type, event, null, null, null);
    }

    public boolean isFor(String expectedChannel) {
        return channel == null || channel.equals(expectedChannel);
    }
}
