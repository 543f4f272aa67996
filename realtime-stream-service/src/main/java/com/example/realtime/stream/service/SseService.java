package com.example.realtime.stream.service;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.dto.broker.SubscriptionAction;
import com.example.realtime.shared.service.SseEventPublisher;
import com.example.realtime.shared.util.Constants.DataChangeType;
import com.example.realtime.shared.util.Constants.NotificationLevel;
import com.example.realtime.shared.util.SubscriptionKeys;
import com.example.realtime.stream.connection.SinkSseStream;
import com.example.realtime.stream.connection.SseConnection;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import com.example.realtime.stream.connection.SseStream;
import com.example.realtime.stream.dto.ConnectionStats;
import com.example.realtime.stream.model.SseEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class SseService {

    private final SseConnectionRegistry connectionRegistry;
    private final SseConnectionManager connectionManager;
    private final SseFanoutCoordinator fanoutCoordinator;
    private final SseBrokerBridge brokerBridge;
    private final SseEventPublisher eventPublisher;
    private final SseEventFactory eventFactory;
    private final AppProperties appProperties;

    @PostConstruct
    public void init() {
        log.info("SseService initializing on pod {} - setting up broker subscriptions", appProperties.getPodName());
        brokerBridge.start();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Commencing SseService graceful shutdown...");

        if (connectionRegistry.size() > 0) {
            log.info("Sending graceful shutdown notice to {} connected clients...", connectionRegistry.size());
            fanoutCoordinator.toAll(eventFactory.createShutdownEvent());
            try {
                Thread.sleep(appProperties.getSse().getShutdownNoticeDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for shutdown notice delivery");
            }
        }

        int removed = connectionRegistry.removeAll();
        log.info("Closed {} SSE connections", removed);

        brokerBridge.disconnect();
        log.info("SseService shutdown complete.");
    }

    public Flux<String> connect(String userId, String organizationId) {
        SinkSseStream stream = new SinkSseStream();
        String connectionId = admit(userId, organizationId, stream);
        log.debug("Created SSE event stream for user: {}, connection: {}", userId, connectionId);
        return stream.asFlux();
    }

    public String admit(String userId, String organizationId, SseStream stream) {
        return connectionManager.admit(userId, organizationId, stream);
    }

    public boolean disconnect(String connectionId) {
        return connectionManager.remove(connectionId);
    }

    public boolean subscribe(String userId, String eventType, List<String> params) {
        return changeSubscription(userId, SubscriptionAction.SUBSCRIBE, eventType, params);
    }

    public boolean unsubscribe(String userId, String eventType, List<String> params) {
        return changeSubscription(userId, SubscriptionAction.UNSUBSCRIBE, eventType, params);
    }

    /**
     * Updates this instance's connections of the user right away, then tells the other
     * instances. The result only reflects local validation; propagation is best effort.
     */
    private boolean changeSubscription(String userId, SubscriptionAction action, String eventType, List<String> params) {
        if (userId == null || userId.isBlank() || eventType == null || eventType.isBlank()
                || (params != null && params.stream().anyMatch(Objects::isNull))) {
            log.warn("Rejected {} request: userId='{}', eventType='{}', params={}", action, userId, eventType, params);
            return false;
        }

        SseSubscriptionMessage message = SseSubscriptionMessage.builder()
                .userId(userId)
                .action(action)
                .eventType(eventType)
                .params(params == null ? List.of() : List.copyOf(params))
                .build();

        log.info("{} user {} for key {}", action, userId, SubscriptionKeys.encode(eventType, message.getParams()));
        fanoutCoordinator.applySubscriptionChange(message);
        eventPublisher.publish(message);
        return true;
    }

    /**
     * Publishes the event for every instance, this one included, to deliver to subscribers.
     */
    public void emit(String eventType, List<String> params, Object payload, List<String> targetUserIds) {
        eventPublisher.publishEvent(eventType, params, payload, targetUserIds);
    }

    public int broadcastToUser(String userId, SseEvent event) {
        return fanoutCoordinator.toUser(userId, event);
    }

    public int broadcastToOrganization(String organizationId, SseEvent event) {
        return fanoutCoordinator.toOrganization(organizationId, event);
    }

    public int broadcastToAll(SseEvent event) {
        return fanoutCoordinator.toAll(event);
    }

    public int sendNotification(String title, String message, NotificationLevel level,
                                String targetUserId, String targetOrganizationId) {
        return route(eventFactory.createNotificationEvent(title, message, level), targetUserId, targetOrganizationId);
    }

    public int sendDataChangeEvent(DataChangeType changeType, Object data,
                                   String targetUserId, String targetOrganizationId) {
        return route(eventFactory.createDataChangeEvent(changeType, data), targetUserId, targetOrganizationId);
    }

    private int route(SseEvent event, String targetUserId, String targetOrganizationId) {
        if (targetUserId != null) {
            return broadcastToUser(targetUserId, event);
        } else if (targetOrganizationId != null) {
            return broadcastToOrganization(targetOrganizationId, event);
        }
        return broadcastToAll(event);
    }

    public List<String> getUserSubscriptions(String userId) {
        Set<String> subscriptions = new LinkedHashSet<>();
        for (SseConnection connection : connectionRegistry.connectionsOf(userId)) {
            subscriptions.addAll(connection.getSubscriptions());
        }
        return new ArrayList<>(subscriptions);
    }

    public ConnectionStats getConnectionStats() {
        Map<String, Integer> connectionsByUser = new LinkedHashMap<>();
        Map<String, Integer> connectionsByOrganization = new LinkedHashMap<>();
        Map<String, Integer> subscriptionsByEventType = new LinkedHashMap<>();
        Set<String> distinctSubscriptions = new LinkedHashSet<>();

        List<SseConnection> connections = connectionRegistry.allConnections();
        for (SseConnection connection : connections) {
            connectionsByUser.merge(connection.getUserId(), 1, Integer::sum);
            if (connection.getOrganizationId() != null) {
                connectionsByOrganization.merge(connection.getOrganizationId(), 1, Integer::sum);
            }
            for (String subscription : connection.getSubscriptions()) {
                distinctSubscriptions.add(subscription);
                subscriptionsByEventType.merge(SubscriptionKeys.eventTypeOf(subscription), 1, Integer::sum);
            }
        }

        return ConnectionStats.builder()
                .podName(appProperties.getPodName())
                .totalConnections(connections.size())
                .connectionsByUser(connectionsByUser)
                .connectionsByOrganization(connectionsByOrganization)
                .subscriptionStats(ConnectionStats.SubscriptionStats.builder()
                        .totalSubscriptions(distinctSubscriptions.size())
                        .subscriptionsByEventType(subscriptionsByEventType)
                        .build())
                .build();
    }

    public boolean isUserConnected(String userId) {
        return !connectionRegistry.connectionsOf(userId).isEmpty();
    }
}
