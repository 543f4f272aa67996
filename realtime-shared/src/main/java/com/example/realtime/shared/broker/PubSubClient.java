package com.example.realtime.shared.broker;

import java.util.function.Consumer;

/**
 * Minimal publish/subscribe contract over a shared message broker.
 * Every subscriber of a channel receives every message published to it,
 * including messages published by the same process.
 */
public interface PubSubClient {

    void publish(String channel, String message);

    /**
     * Registers a standing subscription. Implementations must fail fast when the broker
     * cannot be reached, so that startup aborts instead of running without channels.
     */
    void subscribe(String channel, Consumer<String> handler);

    /** Drops every subscription registered through this client. */
    void disconnect();
}
