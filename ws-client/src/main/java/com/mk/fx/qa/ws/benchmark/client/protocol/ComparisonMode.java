package com.mk.fx.qa.ws.benchmark.client.protocol;

import java.util.Arrays;

/** Comparison applied by the server between a filter key and the subscribed value(s). */
public enum ComparisonMode {
    EQUALS("eq"),
    IN_SET("in");

    private final String wireValue;

    ComparisonMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static ComparisonMode fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported comparison mode: " + value));
    }
}
