package com.example.realtime.shared.service;

import com.example.realtime.shared.broker.PubSubClient;
import com.example.realtime.shared.broker.SseMessageCodec;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.dto.broker.SubscriptionAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SseEventPublisherTest {

    @Mock
    private PubSubClient pubSubClient;

    private SseMessageCodec codec;
    private SseEventPublisher publisher;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        codec = new SseMessageCodec(objectMapper);
        publisher = new SseEventPublisher(pubSubClient, codec, objectMapper, new AppProperties());
    }

    @Test
    void eventGoesToEventsChannelWithPayloadAndTargets() {
        publisher.publishEvent("DEPLOYMENT", List.of("repo-1"), Map.of("status", "ok"), List.of("alice"));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(pubSubClient).publish(eq("sse:events"), body.capture());

        SseEventMessage message = (SseEventMessage) codec.deserialize(body.getValue());
        assertThat(message.getEventType()).isEqualTo("DEPLOYMENT");
        assertThat(message.getParams()).containsExactly("repo-1");
        assertThat(message.getPayload().get("status").asText()).isEqualTo("ok");
        assertThat(message.getTargetUserIds()).containsExactly("alice");
        assertThat(message.getTimestamp()).isNotNull();
    }

    @Test
    void untargetedEventLeavesTargetsUnset() {
        publisher.publishEvent("DEPLOYMENT", null, Map.of());

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(pubSubClient).publish(eq("sse:events"), body.capture());

        SseEventMessage message = (SseEventMessage) codec.deserialize(body.getValue());
        assertThat(message.getTargetUserIds()).isNull();
        assertThat(message.getParams()).isEmpty();
    }

    @Test
    void subscriptionChangeGoesToSubscriptionsChannel() {
        publisher.publishSubscriptionChange("alice", SubscriptionAction.UNSUBSCRIBE, "DEPLOYMENT", List.of("repo-1"));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(pubSubClient).publish(eq("sse:subscriptions"), body.capture());

        SseSubscriptionMessage message = (SseSubscriptionMessage) codec.deserialize(body.getValue());
        assertThat(message.getUserId()).isEqualTo("alice");
        assertThat(message.getAction()).isEqualTo(SubscriptionAction.UNSUBSCRIBE);
    }

    @Test
    void brokerFailureIsSwallowed() {
        doThrow(new RedisConnectionFailureException("down")).when(pubSubClient).publish(anyString(), anyString());

        assertThatCode(() -> publisher.publishEvent("DEPLOYMENT", List.of(), Map.of()))
                .doesNotThrowAnyException();
        assertThatCode(() -> publisher.publishSubscriptionChange("alice", SubscriptionAction.SUBSCRIBE, "X", List.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void blankEventTypeIsACallerError() {
        assertThatThrownBy(() -> publisher.publishEvent(" ", List.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(pubSubClient);
    }

    @Test
    void nullListEntriesAreACallerError() {
        assertThatThrownBy(() -> publisher.publishEvent("DEPLOYMENT", Arrays.asList("repo-1", null), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("params");
        assertThatThrownBy(() -> publisher.publishEvent("DEPLOYMENT", List.of(), Map.of(), Arrays.asList("alice", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetUserIds");
        verifyNoInteractions(pubSubClient);
    }
}
