package com.example.realtime.shared.broker;

import com.example.realtime.shared.dto.broker.SseBrokerMessage;
import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.dto.broker.SubscriptionAction;
import com.example.realtime.shared.exception.MessageProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseMessageCodecTest {

    private ObjectMapper objectMapper;
    private SseMessageCodec codec;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        codec = new SseMessageCodec(objectMapper);
    }

    @Test
    void subscriptionMessageCarriesTypeDiscriminatorAndLowercaseAction() throws Exception {
        SseSubscriptionMessage message = SseSubscriptionMessage.builder()
                .userId("alice")
                .action(SubscriptionAction.SUBSCRIBE)
                .eventType("DEPLOYMENT")
                .params(List.of("repo-1"))
                .build();

        JsonNode json = objectMapper.readTree(codec.serialize(message));

        assertThat(json.get("type").asText()).isEqualTo("subscription");
        assertThat(json.get("action").asText()).isEqualTo("subscribe");
        assertThat(json.get("userId").asText()).isEqualTo("alice");
    }

    @Test
    void eventMessageDecodesToEventShape() throws Exception {
        SseEventMessage message = SseEventMessage.builder()
                .eventType("DEPLOYMENT")
                .params(List.of("repo-1"))
                .payload(objectMapper.readTree("{\"status\":\"ok\"}"))
                .targetUserIds(List.of("alice"))
                .timestamp(Instant.parse("2026-01-01T10:00:00Z"))
                .build();

        SseBrokerMessage decoded = codec.deserialize(codec.serialize(message));

        assertThat(decoded).isInstanceOf(SseEventMessage.class).isEqualTo(message);
        assertThat(((SseEventMessage) decoded).isTargeted()).isTrue();
    }

    @Test
    void broadcastEventHasNoTargets() {
        String raw = "{\"type\":\"event\",\"eventType\":\"X\",\"params\":[],\"payload\":{}}";

        SseEventMessage decoded = (SseEventMessage) codec.deserialize(raw);

        assertThat(decoded.getTargetUserIds()).isNull();
        assertThat(decoded.isTargeted()).isFalse();
    }

    @Test
    void unknownDiscriminatorIsRejected() {
        assertThatThrownBy(() -> codec.deserialize("{\"type\":\"bogus\",\"userId\":\"alice\"}"))
                .isInstanceOfSatisfying(MessageProcessingException.class,
                        e -> assertThat(e.getRawMessage()).contains("bogus"));
    }

    @Test
    void missingDiscriminatorIsRejected() {
        assertThatThrownBy(() -> codec.deserialize("{\"userId\":\"alice\"}"))
                .isInstanceOf(MessageProcessingException.class);
    }

    @Test
    void garbageAndEmptyBodiesAreRejected() {
        assertThatThrownBy(() -> codec.deserialize("not json")).isInstanceOf(MessageProcessingException.class);
        assertThatThrownBy(() -> codec.deserialize("")).isInstanceOf(MessageProcessingException.class);
        assertThatThrownBy(() -> codec.deserialize("null")).isInstanceOf(MessageProcessingException.class);
    }
}
