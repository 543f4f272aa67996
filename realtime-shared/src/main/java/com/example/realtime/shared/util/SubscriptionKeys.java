package com.example.realtime.shared.util;

import java.util.List;
import java.util.Locale;

/**
 * Encodes an event type and its parameters into the key stored in a connection's
 * subscription set. The subscribe path and the event matching path must both go
 * through {@link #encode(String, List)} or deliveries are silently missed.
 */
public final class SubscriptionKeys {

    private SubscriptionKeys() {}

    /**
     * @param eventType the event type, e.g. {@code DEPLOYMENT}
     * @param params    ordered parameters; order is significant and {@code null} counts as empty
     * @return {@code EVENTTYPE:P1,P2,...} upper-cased
     */
    public static String encode(String eventType, List<String> params) {
        String joined = params == null ? "" : String.join(",", params);
        return (eventType + ":" + joined).toUpperCase(Locale.ROOT);
    }

    /**
     * Event type part of a key, as used for the statistics breakdown.
     */
    public static String eventTypeOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? key : key.substring(0, separator);
    }
}
