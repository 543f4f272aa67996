package com.example.realtime.stream.service;

import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.util.Constants.DataChangeType;
import com.example.realtime.shared.util.Constants.NotificationLevel;
import com.example.realtime.shared.util.Constants.SseEventType;
import com.example.realtime.stream.model.SseEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SseEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * Generic method to create any SSE event.
     * @param eventType The event type written to the {@code event:} line.
     * @param data The payload, converted to a JSON tree.
     * @return An event stamped with the current time.
     */
    public SseEvent createEvent(String eventType, Object data) {
        return new SseEvent(eventType, objectMapper.valueToTree(data), Instant.now());
    }

    public SseEvent createEvent(SseEventType eventType, Object data) {
        return createEvent(eventType.name(), data);
    }

    public SseEvent fromMessage(SseEventMessage message) {
        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : Instant.now();
        return new SseEvent(message.getEventType(), message.getPayload(), timestamp);
    }

    public SseEvent createConnectedEvent(String connectionId) {
        Map<String, String> data = Map.of(
                "message", "SSE connection established",
                "connectionId", connectionId,
                "timestamp", Instant.now().toString()
        );
        return createEvent(SseEventType.CONNECTED, data);
    }

    public SseEvent createHeartbeatEvent() {
        return createEvent(SseEventType.HEARTBEAT, Map.of("timestamp", Instant.now().toString()));
    }

    public SseEvent createShutdownEvent() {
        return createEvent(SseEventType.SERVER_SHUTDOWN,
                Map.of("message", "Server is shutting down. Please reconnect momentarily."));
    }

    public SseEvent createNotificationEvent(String title, String message, NotificationLevel level) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("message", message);
        data.put("level", (level == null ? NotificationLevel.INFO : level).name().toLowerCase());
        return createEvent(SseEventType.NOTIFICATION, data);
    }

    public SseEvent createDataChangeEvent(DataChangeType changeType, Object payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", changeType.name());
        data.put("data", payload);
        return createEvent(SseEventType.DATA_CHANGE, data);
    }
}
