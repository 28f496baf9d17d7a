package com.mk.fx.qa.ws.benchmark.client.protocol;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Subscription predicate sent with a subscribe request.
 *
 * @param key the tag the server compares against (e.g. {@code token_address})
 * @param mode {@link ComparisonMode#EQUALS} for exactly one value, {@link ComparisonMode#IN_SET}
 *     for one or more
 * @param values distinct filter values, in the order they will be written on the wire
 */
public record SubscriptionFilter(String key, ComparisonMode mode, List<String> values) {

    public SubscriptionFilter {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(values, "values");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Filter key cannot be blank");
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Filter requires at least one value");
        }
        if (mode == ComparisonMode.EQUALS && values.size() != 1) {
            throw new IllegalArgumentException(
                    "EQUALS filter requires exactly one value, got " + values.size());
        }
        if (new HashSet<>(values).size() != values.size()) {
            throw new IllegalArgumentException("Filter values must be distinct");
        }
        values = List.copyOf(values);
    }

    public static SubscriptionFilter equalTo(String key, String value) {
        return new SubscriptionFilter(key, ComparisonMode.EQUALS, List.of(value));
    }

    public static SubscriptionFilter inSet(String key, List<String> values) {
        return new SubscriptionFilter(key, ComparisonMode.IN_SET, values);
    }

    public int cardinality() {
        return values.size();
    }
}
