package com.example.realtime.stream.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live SSE connections of this instance, bucketed by user. Other instances keep their own
 * table; nothing here is shared across processes.
 * <p>
 * Bucket changes go through {@link ConcurrentHashMap#compute} so admission and removal for
 * the same user never interleave. Readers always get snapshots.
 */
@Component
@Slf4j
public class SseConnectionRegistry {

    private final Map<String, List<SseConnection>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<String, SseConnection> connectionsById = new ConcurrentHashMap<>();

    public void register(SseConnection connection) {
        if (connectionsById.putIfAbsent(connection.getId(), connection) != null) {
            throw new IllegalStateException("Connection id already registered: " + connection.getId());
        }
        connectionsByUser.compute(connection.getUserId(), (userId, bucket) -> {
            List<SseConnection> connections = bucket == null ? new CopyOnWriteArrayList<>() : bucket;
            connections.add(connection);
            return connections;
        });
        log.info("Registered SSE connection {} for user {} (org {}). User connections: {}, total: {}",
                connection.getId(), connection.getUserId(), connection.getOrganizationId(),
                connectionsOf(connection.getUserId()).size(), size());
    }

    /**
     * Removes the connection, stops its heartbeat and closes its stream. Safe to call any
     * number of times from any trigger; only the first call has an effect.
     */
    public Optional<SseConnection> remove(String connectionId) {
        SseConnection connection = connectionsById.remove(connectionId);
        if (connection == null) {
            log.debug("Connection {} already removed", connectionId);
            return Optional.empty();
        }

        connectionsByUser.computeIfPresent(connection.getUserId(), (userId, bucket) -> {
            bucket.remove(connection);
            return bucket.isEmpty() ? null : bucket;
        });
        connection.release();

        log.info("Removed SSE connection {} for user {} (org {}). Remaining user connections: {}, total: {}",
                connectionId, connection.getUserId(), connection.getOrganizationId(),
                connectionsOf(connection.getUserId()).size(), size());
        return Optional.of(connection);
    }

    /**
     * Removes every connection. Used by the shutdown sweep.
     *
     * @return number of connections removed
     */
    public int removeAll() {
        int removed = 0;
        for (String connectionId : new ArrayList<>(connectionsById.keySet())) {
            if (remove(connectionId).isPresent()) {
                removed++;
            }
        }
        return removed;
    }

    public Optional<SseConnection> find(String connectionId) {
        return Optional.ofNullable(connectionsById.get(connectionId));
    }

    public boolean contains(String connectionId) {
        return connectionsById.containsKey(connectionId);
    }

    public List<SseConnection> connectionsOf(String userId) {
        List<SseConnection> bucket = connectionsByUser.get(userId);
        return bucket == null ? List.of() : List.copyOf(bucket);
    }

    public List<SseConnection> allConnections() {
        List<SseConnection> all = new ArrayList<>();
        for (Collection<SseConnection> bucket : connectionsByUser.values()) {
            all.addAll(bucket);
        }
        return all;
    }

    public Set<String> userIds() {
        return Set.copyOf(connectionsByUser.keySet());
    }

    public int size() {
        return connectionsById.size();
    }
}
