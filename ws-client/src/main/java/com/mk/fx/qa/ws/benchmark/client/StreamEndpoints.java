package com.mk.fx.qa.ws.benchmark.client;

import java.net.URI;
import java.util.Objects;

/** Builds WebSocket endpoint URIs. Port 443 selects {@code wss}, anything else {@code ws}. */
public final class StreamEndpoints {

    public static final int TLS_PORT = 443;

    private StreamEndpoints() {
        // Utility class, no instantiation
    }

    public static URI endpoint(String host, int port, String path) {
        Objects.requireNonNull(host, "host");
        var trimmed = host.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        var scheme = port == TLS_PORT ? "wss" : "ws";
        var normalisedPath = path == null || path.isEmpty() ? "/" : path.startsWith("/") ? path : "/" + path;
        return URI.create(scheme + "://" + trimmed + ":" + port + normalisedPath);
    }
}
