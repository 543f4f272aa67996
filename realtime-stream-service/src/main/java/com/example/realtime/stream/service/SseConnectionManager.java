package com.example.realtime.stream.service;

import com.example.realtime.stream.connection.SseConnection;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import com.example.realtime.stream.connection.SseStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Admits client streams into the registry and takes them out again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SseConnectionManager {

    private final SseConnectionRegistry connectionRegistry;
    private final SseEventDispatcher eventDispatcher;
    private final SseEventFactory eventFactory;
    private final SseHeartbeatScheduler heartbeatScheduler;

    /**
     * Registers the stream as a new connection of {@code userId}, greets it and starts its heartbeat.
     *
     * @throws IllegalArgumentException if {@code userId} is blank; nothing is registered then
     */
    public String admit(String userId, String organizationId, SseStream stream) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required for SSE connections");
        }

        String connectionId = UUID.randomUUID().toString();
        SseConnection connection = new SseConnection(connectionId, userId, organizationId, stream);
        connectionRegistry.register(connection);

        stream.onTermination(error -> {
            if (error != null) {
                log.error("SSE connection error for connection {}, user {}: {}", connectionId, userId, error.getMessage());
            }
            connectionRegistry.remove(connectionId);
        });

        eventDispatcher.send(connection, eventFactory.createConnectedEvent(connectionId));
        heartbeatScheduler.start(connection);
        return connectionId;
    }

    public boolean remove(String connectionId) {
        return connectionRegistry.remove(connectionId).isPresent();
    }
}
