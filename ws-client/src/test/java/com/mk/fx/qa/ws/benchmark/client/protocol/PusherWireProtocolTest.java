package com.mk.fx.qa.ws.benchmark.client.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.ws.benchmark.client.JsonUtil;
import java.util.List;
import org.junit.jupiter.api.Test;

class PusherWireProtocolTest {

    private final PusherWireProtocol protocol = new PusherWireProtocol();

    @Test
    void handshakePath_embedsEncodedAppKey() {
        assertThat(protocol.handshakePath("knife-library-likely")).isEqualTo("/app/knife-library-likely");
        assertThat(protocol.handshakePath("a b")).isEqualTo("/app/a+b");
    }

    @Test
    void encodeSubscribe_singleValueUsesValField() throws Exception {
        String json = protocol.encodeSubscribe("chan", SubscriptionFilter.equalTo("token_address", "t1"));

        JsonNode root = JsonUtil.readTree(json);
        assertThat(root.get("event").asText()).isEqualTo("pusher:subscribe");
        assertThat(root.at("/data/channel").asText()).isEqualTo("chan");
        assertThat(root.at("/data/filter/key").asText()).isEqualTo("token_address");
        assertThat(root.at("/data/filter/cmp").asText()).isEqualTo("eq");
        assertThat(root.at("/data/filter/val").asText()).isEqualTo("t1");
        assertThat(root.at("/data/filter").has("vals")).isFalse();
    }

    @Test
    void encodeSubscribe_inSetUsesValsArrayInOrder() throws Exception {
        String json =
                protocol.encodeSubscribe(
                        "chan", SubscriptionFilter.inSet("token_address", List.of("a", "b", "c")));

        JsonNode filter = JsonUtil.readTree(json).at("/data/filter");
        assertThat(filter.get("cmp").asText()).isEqualTo("in");
        assertThat(filter.get("vals")).hasSize(3);
        assertThat(filter.get("vals").get(0).asText()).isEqualTo("a");
        assertThat(filter.get("vals").get(2).asText()).isEqualTo("c");
        assertThat(filter.has("val")).isFalse();
    }

    @Test
    void decode_classifiesControlEvents() {
        assertThat(protocol.decode("{\"event\":\"pusher:connection_established\",\"data\":\"{}\"}").type())
                .isEqualTo(FrameType.CONNECTION_ESTABLISHED);
        assertThat(protocol.decode("{\"event\":\"pusher:ping\",\"data\":{}}").type())
                .isEqualTo(FrameType.PING);
        assertThat(protocol.decode("ping").type()).isEqualTo(FrameType.PING);

        InboundFrame ack =
                protocol.decode(
                        "{\"event\":\"pusher_internal:subscription_succeeded\",\"channel\":\"chan\"}");
        assertThat(ack.type()).isEqualTo(FrameType.SUBSCRIBE_ACK);
        assertThat(ack.channel()).isEqualTo("chan");
    }

    @Test
    void decode_errorCarriesMessageDetail() {
        InboundFrame error =
                protocol.decode(
                        "{\"event\":\"pusher:error\",\"data\":{\"message\":\"filter too large\",\"code\":4301}}");

        assertThat(error.type()).isEqualTo(FrameType.SUBSCRIBE_ERROR);
        assertThat(error.detail()).isEqualTo("filter too large");
    }

    @Test
    void decode_channelEventIsDataDistinctFromAck() {
        InboundFrame data =
                protocol.decode("{\"event\":\"token-update\",\"channel\":\"chan\",\"data\":{\"price\":1}}");

        assertThat(data.type()).isEqualTo(FrameType.CHANNEL_DATA);
        assertThat(data.channel()).isEqualTo("chan");
        assertThat(data.timestampMs()).isNull();
    }

    @Test
    void decode_extractsTimestampFromRootTagsFirst() {
        InboundFrame frame =
                protocol.decode(
                        "{\"event\":\"e\",\"channel\":\"c\",\"tags\":{\"timestamp\":1700000000001},"
                                + "\"data\":{\"timestamp\":5}}");

        assertThat(frame.timestampMs()).isEqualTo(1_700_000_000_001L);
    }

    @Test
    void decode_extractsTimestampFromDataTagsAndStringValues() {
        InboundFrame nested =
                protocol.decode(
                        "{\"event\":\"e\",\"channel\":\"c\",\"data\":{\"tags\":{\"timestamp\":\"42\"}}}");
        InboundFrame flat =
                protocol.decode("{\"event\":\"e\",\"channel\":\"c\",\"data\":{\"timestamp\":43}}");
        InboundFrame encoded =
                protocol.decode(
                        "{\"event\":\"e\",\"channel\":\"c\",\"data\":\"{\\\"timestamp\\\":44}\"}");

        assertThat(nested.timestampMs()).isEqualTo(42L);
        assertThat(flat.timestampMs()).isEqualTo(43L);
        assertThat(encoded.timestampMs()).isEqualTo(44L);
    }

    @Test
    void decode_garbageAndEventlessFramesAreUnknown() {
        assertThat(protocol.decode("not json").type()).isEqualTo(FrameType.UNKNOWN);
        assertThat(protocol.decode("").type()).isEqualTo(FrameType.UNKNOWN);
        assertThat(protocol.decode("[1,2]").type()).isEqualTo(FrameType.UNKNOWN);
        assertThat(protocol.decode("{\"channel\":\"c\"}").type()).isEqualTo(FrameType.UNKNOWN);
        assertThat(protocol.decode("{\"event\":\"pusher:other\"}").type()).isEqualTo(FrameType.UNKNOWN);
    }

    @Test
    void pongFor_matchesPingFlavour() throws Exception {
        assertThat(protocol.pongFor(protocol.decode("ping"))).isEqualTo("pong");

        String pong = protocol.pongFor(protocol.decode("{\"event\":\"pusher:ping\"}"));
        assertThat(JsonUtil.readTree(pong).get("event").asText()).isEqualTo("pusher:pong");
    }
}
