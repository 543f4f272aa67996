package com.example.realtime.stream.service;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.stream.connection.SseConnection;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Sends a heartbeat to each connection at a fixed interval. A failed heartbeat removes the
 * connection through the dispatcher, which is how half-open sockets get reclaimed.
 */
@Component
@Slf4j
public class SseHeartbeatScheduler {

    private final SseConnectionRegistry connectionRegistry;
    private final SseEventDispatcher eventDispatcher;
    private final SseEventFactory eventFactory;
    private final Scheduler scheduler;
    private final Duration interval;

    public SseHeartbeatScheduler(SseConnectionRegistry connectionRegistry,
                                 SseEventDispatcher eventDispatcher,
                                 SseEventFactory eventFactory,
                                 @Qualifier("heartbeatScheduler") Scheduler scheduler,
                                 AppProperties appProperties) {
        this.connectionRegistry = connectionRegistry;
        this.eventDispatcher = eventDispatcher;
        this.eventFactory = eventFactory;
        this.scheduler = scheduler;
        this.interval = Duration.ofMillis(appProperties.getSse().getHeartbeatInterval());
    }

    public void start(SseConnection connection) {
        Disposable task = Flux.interval(interval, interval, scheduler)
                .subscribe(tick -> beat(connection));
        connection.attachHeartbeat(task);
        log.debug("Heartbeat started for connection {} every {}", connection.getId(), interval);
    }

    private void beat(SseConnection connection) {
        try {
            if (!connectionRegistry.contains(connection.getId())) {
                log.info("Connection {} no longer exists, cancelling its heartbeat", connection.getId());
                connection.cancelHeartbeat();
                return;
            }
            if (!eventDispatcher.send(connection, eventFactory.createHeartbeatEvent())) {
                log.info("Heartbeat failed for connection {} of user {}", connection.getId(), connection.getUserId());
            }
        } catch (RuntimeException e) {
            log.error("Error in heartbeat for connection {}: {}", connection.getId(), e.getMessage());
        }
    }
}
