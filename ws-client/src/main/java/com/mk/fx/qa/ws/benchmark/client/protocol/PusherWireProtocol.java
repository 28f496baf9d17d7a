package com.mk.fx.qa.ws.benchmark.client.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mk.fx.qa.ws.benchmark.client.JsonUtil;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Pusher-style protocol: the application key travels in the handshake path ({@code /app/{key}}),
 * subscriptions are {@code pusher:subscribe} events carrying a tag filter, and the server answers
 * with {@code pusher_internal:subscription_succeeded} or {@code pusher:error}.
 *
 * <p>Subscribe frame layout:
 *
 * <pre>{@code
 * {"event":"pusher:subscribe",
 *  "data":{"channel":"c","filter":{"key":"token_address","cmp":"in","vals":["a","b"]}}}
 * }</pre>
 *
 * Single-value filters use {@code "val"} instead of {@code "vals"}.
 */
@Slf4j
public class PusherWireProtocol implements WireProtocol {

    public static final String EVENT_SUBSCRIBE = "pusher:subscribe";
    public static final String EVENT_CONNECTION_ESTABLISHED = "pusher:connection_established";
    public static final String EVENT_SUBSCRIPTION_SUCCEEDED = "pusher_internal:subscription_succeeded";
    public static final String EVENT_ERROR = "pusher:error";
    public static final String EVENT_SUBSCRIPTION_ERROR = "pusher:subscription_error";
    public static final String EVENT_PING = "pusher:ping";
    public static final String EVENT_PONG = "pusher:pong";

    private static final String RAW_PING = "ping";
    private static final String RAW_PONG = "pong";
    private static final String TIMESTAMP_TAG = "timestamp";

    private final ObjectMapper mapper;
    private final String pongFrame;

    public PusherWireProtocol() {
        this(JsonUtil.mapper());
    }

    public PusherWireProtocol(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        ObjectNode pong = mapper.createObjectNode();
        pong.put("event", EVENT_PONG);
        pong.putObject("data");
        this.pongFrame = pong.toString();
    }

    @Override
    public String handshakePath(String appKey) {
        Objects.requireNonNull(appKey, "appKey");
        return "/app/" + URLEncoder.encode(appKey, StandardCharsets.UTF_8);
    }

    @Override
    public String encodeSubscribe(String channel, SubscriptionFilter filter) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(filter, "filter");

        ObjectNode root = mapper.createObjectNode();
        root.put("event", EVENT_SUBSCRIBE);
        ObjectNode data = root.putObject("data");
        data.put("channel", channel);
        ObjectNode filterNode = data.putObject("filter");
        filterNode.put("key", filter.key());
        filterNode.put("cmp", filter.mode().wireValue());
        if (filter.mode() == ComparisonMode.EQUALS) {
            filterNode.put("val", filter.values().get(0));
        } else {
            ArrayNode vals = filterNode.putArray("vals");
            filter.values().forEach(vals::add);
        }
        return root.toString();
    }

    @Override
    public InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            return InboundFrame.of(FrameType.UNKNOWN, null);
        }
        if (RAW_PING.equals(text)) {
            return InboundFrame.of(FrameType.PING, null);
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.trace("Ignoring unparseable frame: {}", e.getOriginalMessage());
            return InboundFrame.of(FrameType.UNKNOWN, null);
        }
        if (root == null || !root.isObject()) {
            return InboundFrame.of(FrameType.UNKNOWN, null);
        }

        String event = textOrNull(root.get("event"));
        String channel = textOrNull(root.get("channel"));
        if (event == null) {
            return new InboundFrame(FrameType.UNKNOWN, null, channel, null, null);
        }

        return switch (event) {
            case EVENT_PING -> InboundFrame.of(FrameType.PING, event);
            case EVENT_CONNECTION_ESTABLISHED -> InboundFrame.of(FrameType.CONNECTION_ESTABLISHED, event);
            case EVENT_SUBSCRIPTION_SUCCEEDED ->
                    new InboundFrame(FrameType.SUBSCRIBE_ACK, event, channel, null, null);
            case EVENT_ERROR, EVENT_SUBSCRIPTION_ERROR ->
                    new InboundFrame(
                            FrameType.SUBSCRIBE_ERROR, event, channel, null, errorDetail(root.get("data")));
            default -> channel == null
                    ? new InboundFrame(FrameType.UNKNOWN, event, null, null, null)
                    : new InboundFrame(FrameType.CHANNEL_DATA, event, channel, extractTimestamp(root), null);
        };
    }

    @Override
    public String pongFor(InboundFrame ping) {
        return ping == null || ping.event() == null ? RAW_PONG : pongFrame;
    }

    /**
     * Looks for the publisher timestamp in root {@code tags}, then {@code data.tags}, then {@code
     * data.timestamp}. Values may be numbers or numeric strings. {@code data} may itself be a JSON
     * encoded string.
     */
    Long extractTimestamp(JsonNode root) {
        Long fromTags = timestampOf(root.get("tags"));
        if (fromTags != null) {
            return fromTags;
        }
        JsonNode data = unwrapData(root.get("data"));
        if (data == null || !data.isObject()) {
            return null;
        }
        Long fromDataTags = timestampOf(data.get("tags"));
        if (fromDataTags != null) {
            return fromDataTags;
        }
        return asLong(data.get(TIMESTAMP_TAG));
    }

    private JsonNode unwrapData(JsonNode data) {
        if (data == null || !data.isTextual()) {
            return data;
        }
        try {
            return mapper.readTree(data.asText());
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Long timestampOf(JsonNode tags) {
        if (tags == null || !tags.isObject()) {
            return null;
        }
        return asLong(tags.get(TIMESTAMP_TAG));
    }

    private static Long asLong(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private String errorDetail(JsonNode data) {
        if (data == null || data.isNull()) {
            return null;
        }
        JsonNode unwrapped = unwrapData(data);
        if (unwrapped == null) {
            return data.asText();
        }
        if (unwrapped.isObject() && unwrapped.hasNonNull("message")) {
            return unwrapped.get("message").asText();
        }
        return unwrapped.toString();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
