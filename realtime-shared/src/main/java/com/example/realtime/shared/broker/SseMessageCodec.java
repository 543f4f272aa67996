package com.example.realtime.shared.broker;

import com.example.realtime.shared.dto.broker.SseBrokerMessage;
import com.example.realtime.shared.exception.MessageProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON codec for broker envelopes. Both directions wrap Jackson failures in
 * {@link MessageProcessingException}.
 */
@Component
@RequiredArgsConstructor
public class SseMessageCodec {

    private final ObjectMapper objectMapper;

    public String serialize(SseBrokerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new MessageProcessingException("Failed to serialize broker message " + message.getClass().getSimpleName(), e, null);
        }
    }

    public SseBrokerMessage deserialize(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MessageProcessingException("Empty broker message", null, rawMessage);
        }
        try {
            SseBrokerMessage message = objectMapper.readValue(rawMessage, SseBrokerMessage.class);
            if (message == null) {
                throw new MessageProcessingException("Broker message decoded to null", null, rawMessage);
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new MessageProcessingException("Failed to parse broker message: " + e.getOriginalMessage(), e, rawMessage);
        }
    }
}
