package com.example.realtime.shared.service;

import com.example.realtime.shared.broker.PubSubClient;
import com.example.realtime.shared.broker.SseMessageCodec;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.dto.broker.SseBrokerMessage;
import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.dto.broker.SubscriptionAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Publishes SSE envelopes to the broker so that every service instance can deliver them.
 * Any process may use it to emit events, whether or not it holds SSE connections itself.
 * <p>
 * Publishing is best effort: failures are logged and never reach the caller, because the
 * caller's local state is already correct and cross-instance propagation cannot be retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SseEventPublisher {

    private final PubSubClient pubSubClient;
    private final SseMessageCodec messageCodec;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public void publishEvent(String eventType, List<String> params, Object payload) {
        publishEvent(eventType, params, payload, null);
    }

    public void publishEvent(String eventType, List<String> params, Object payload, List<String> targetUserIds) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required to publish an SSE event");
        }
        if (params != null && params.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("params must not contain null entries");
        }
        if (targetUserIds != null && targetUserIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("targetUserIds must not contain null entries");
        }
        log.info("Publishing SSE event type={}, params={}, targets={}", eventType, params,
                targetUserIds == null ? "all" : targetUserIds.size());

        SseEventMessage message = SseEventMessage.builder()
                .eventType(eventType)
                .params(params == null ? List.of() : List.copyOf(params))
                .payload(objectMapper.valueToTree(payload))
                .targetUserIds(targetUserIds == null ? null : List.copyOf(targetUserIds))
                .timestamp(Instant.now())
                .build();
        publish(message);
    }

    public void publish(SseEventMessage message) {
        publish(appProperties.getRedis().getEventsChannel(), message);
    }

    public void publishSubscriptionChange(String userId, SubscriptionAction action, String eventType, List<String> params) {
        SseSubscriptionMessage message = SseSubscriptionMessage.builder()
                .userId(userId)
                .action(action)
                .eventType(eventType)
                .params(params == null ? List.of() : List.copyOf(params))
                .build();
        publish(message);
    }

    public void publish(SseSubscriptionMessage message) {
        publish(appProperties.getRedis().getSubscriptionsChannel(), message);
    }

    private void publish(String channel, SseBrokerMessage message) {
        try {
            pubSubClient.publish(channel, messageCodec.serialize(message));
            log.debug("Published {} to channel '{}'", message, channel);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} to channel '{}': {}", message.getClass().getSimpleName(), channel, e.getMessage());
        }
    }
}
