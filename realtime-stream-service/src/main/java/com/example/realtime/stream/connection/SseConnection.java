package com.example.realtime.stream.connection;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One admitted client stream on this instance. Owns its stream, its heartbeat task and
 * its subscription keys; belongs to a single user for its whole life.
 */
@Slf4j
@Getter
public class SseConnection {

    private final String id;
    private final String userId;
    private final String organizationId;
    private final SseStream stream;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    private Disposable heartbeat;
    private boolean released;

    public SseConnection(String id, String userId, String organizationId, SseStream stream) {
        this.id = id;
        this.userId = userId;
        this.organizationId = organizationId;
        this.stream = stream;
    }

    public Set<String> getSubscriptions() {
        return Collections.unmodifiableSet(subscriptions);
    }

    public boolean subscribe(String subscriptionKey) {
        return subscriptions.add(subscriptionKey);
    }

    public boolean unsubscribe(String subscriptionKey) {
        return subscriptions.remove(subscriptionKey);
    }

    public boolean isSubscribedTo(String subscriptionKey) {
        return subscriptions.contains(subscriptionKey);
    }

    /**
     * Takes ownership of the heartbeat task. A task attached after {@link #release()} is
     * disposed on the spot.
     */
    public synchronized void attachHeartbeat(Disposable task) {
        if (released) {
            task.dispose();
            return;
        }
        this.heartbeat = task;
    }

    public synchronized void cancelHeartbeat() {
        if (heartbeat != null) {
            heartbeat.dispose();
            heartbeat = null;
        }
    }

    public synchronized boolean isReleased() {
        return released;
    }

    /**
     * Stops the heartbeat and closes the stream. Runs at most once.
     *
     * @return false if the connection had already been released
     */
    public synchronized boolean release() {
        if (released) {
            return false;
        }
        released = true;
        cancelHeartbeat();
        try {
            if (!stream.isClosed()) {
                stream.close();
            }
        } catch (RuntimeException e) {
            log.warn("Error closing SSE stream for connection {}: {}", id, e.getMessage());
        }
        return true;
    }
}
