package com.example.realtime.stream.service;

import com.example.realtime.stream.connection.SseConnection;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import com.example.realtime.stream.model.SseEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Writes events to connections of this instance. A connection whose stream is dead, or
 * whose write fails, is removed from the registry instead of being retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SseEventDispatcher {

    private final SseConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;

    public boolean send(String connectionId, SseEvent event) {
        Optional<SseConnection> connection = connectionRegistry.find(connectionId);
        if (connection.isEmpty()) {
            log.warn("Attempted to send {} event to non-existent connection {}", event.getType(), connectionId);
            return false;
        }
        return send(connection.get(), event);
    }

    public boolean send(SseConnection connection, SseEvent event) {
        if (connection.getStream().isClosed()) {
            log.info("Cannot send event to closed connection {}, removing it", connection.getId());
            connectionRegistry.remove(connection.getId());
            return false;
        }

        String frame;
        try {
            frame = formatFrame(event);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event type {}: {}", event.getType(), e.getMessage());
            return false;
        }

        try {
            connection.getStream().write(frame);
            log.debug("Event {} sent to connection {}", event.getType(), connection.getId());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send event {} to connection {} of user {}: {}",
                    event.getType(), connection.getId(), connection.getUserId(), e.getMessage());
            connectionRegistry.remove(connection.getId());
            return false;
        }
    }

    /**
     * @return how many of the connections accepted the event
     */
    public int broadcast(SseEvent event, Collection<SseConnection> connections) {
        int successCount = 0;
        for (SseConnection connection : connections) {
            if (send(connection, event)) {
                successCount++;
            }
        }
        return successCount;
    }

    /**
     * Renders one frame: {@code event}, {@code data} and a timestamp comment, then a blank line.
     */
    public String formatFrame(SseEvent event) throws JsonProcessingException {
        return "event: " + event.getType() + "\n"
                + "data: " + objectMapper.writeValueAsString(event.getData()) + "\n"
                + ": timestamp: " + event.getTimestamp() + "\n"
                + "\n";
    }
}
