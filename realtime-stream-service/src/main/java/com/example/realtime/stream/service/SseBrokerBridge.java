package com.example.realtime.stream.service;

import com.example.realtime.shared.broker.PubSubClient;
import com.example.realtime.shared.broker.SseMessageCodec;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.dto.broker.SseBrokerMessage;
import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.exception.BrokerUnavailableException;
import com.example.realtime.shared.exception.MessageProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Receiving side of the two SSE broker channels. Messages published by this instance come
 * back here too and are applied like any other.
 * <p>
 * Handlers never throw: a bad message is logged and dropped so the listener keeps running.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SseBrokerBridge {

    private final PubSubClient pubSubClient;
    private final SseMessageCodec messageCodec;
    private final SseFanoutCoordinator fanoutCoordinator;
    private final AppProperties appProperties;

    /**
     * @throws BrokerUnavailableException if either channel cannot be subscribed
     */
    public void start() {
        String eventsChannel = appProperties.getRedis().getEventsChannel();
        String subscriptionsChannel = appProperties.getRedis().getSubscriptionsChannel();
        try {
            pubSubClient.subscribe(eventsChannel, this::handleEventMessage);
            pubSubClient.subscribe(subscriptionsChannel, this::handleSubscriptionMessage);
        } catch (BrokerUnavailableException e) {
            log.error("Failed to set up broker subscriptions: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to set up broker subscriptions: {}", e.getMessage());
            throw new BrokerUnavailableException("Failed to subscribe to SSE broker channels", e);
        }
        log.info("Broker subscriptions established on channels [{}, {}]", eventsChannel, subscriptionsChannel);
    }

    public void disconnect() {
        try {
            pubSubClient.disconnect();
            log.info("Broker bridge disconnected");
        } catch (RuntimeException e) {
            log.warn("Error while disconnecting broker bridge: {}", e.getMessage());
        }
    }

    void handleEventMessage(String rawMessage) {
        try {
            SseBrokerMessage message = messageCodec.deserialize(rawMessage);
            if (!(message instanceof SseEventMessage eventMessage)) {
                log.warn("Received non-event message on events channel: {}", rawMessage);
                return;
            }
            if (eventMessage.getEventType() == null || eventMessage.getEventType().isBlank()) {
                log.warn("Dropping event message without event type: {}", rawMessage);
                return;
            }
            fanoutCoordinator.deliverEvent(eventMessage);
        } catch (MessageProcessingException e) {
            log.warn("Dropping malformed message on events channel: {}. Raw message: {}", e.getMessage(), rawMessage);
        } catch (RuntimeException e) {
            log.error("Failed to process event message from broker. Raw message: {}", rawMessage, e);
        }
    }

    void handleSubscriptionMessage(String rawMessage) {
        try {
            SseBrokerMessage message = messageCodec.deserialize(rawMessage);
            if (!(message instanceof SseSubscriptionMessage subscriptionMessage)) {
                log.warn("Received non-subscription message on subscriptions channel: {}", rawMessage);
                return;
            }
            if (subscriptionMessage.getUserId() == null || subscriptionMessage.getAction() == null
                    || subscriptionMessage.getEventType() == null) {
                log.warn("Dropping incomplete subscription message: {}", rawMessage);
                return;
            }
            fanoutCoordinator.applySubscriptionChange(subscriptionMessage);
        } catch (MessageProcessingException e) {
            log.warn("Dropping malformed message on subscriptions channel: {}. Raw message: {}", e.getMessage(), rawMessage);
        } catch (RuntimeException e) {
            log.error("Failed to process subscription message from broker. Raw message: {}", rawMessage, e);
        }
    }
}
