package com.example.realtime.stream.service;

import com.example.realtime.shared.dto.broker.SseEventMessage;
import com.example.realtime.shared.dto.broker.SseSubscriptionMessage;
import com.example.realtime.shared.dto.broker.SubscriptionAction;
import com.example.realtime.shared.util.SubscriptionKeys;
import com.example.realtime.stream.connection.SseConnection;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import com.example.realtime.stream.model.SseEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Applies broker traffic to the connections held by this instance.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SseFanoutCoordinator {

    private final SseConnectionRegistry connectionRegistry;
    private final SseEventDispatcher eventDispatcher;
    private final SseEventFactory eventFactory;

    /**
     * Adds or removes the subscription key on every local connection of the user.
     *
     * @return number of local connections updated; zero when the user is connected elsewhere only
     */
    public int applySubscriptionChange(SseSubscriptionMessage message) {
        String subscriptionKey = SubscriptionKeys.encode(message.getEventType(), message.getParams());
        List<SseConnection> userConnections = connectionRegistry.connectionsOf(message.getUserId());

        for (SseConnection connection : userConnections) {
            if (message.getAction() == SubscriptionAction.SUBSCRIBE) {
                connection.subscribe(subscriptionKey);
            } else {
                connection.unsubscribe(subscriptionKey);
            }
        }

        log.info("Subscription change applied: user={}, action={}, key={}, updatedConnections={}",
                message.getUserId(), message.getAction(), subscriptionKey, userConnections.size());
        return userConnections.size();
    }

    /**
     * Delivers the event to every local connection subscribed to its key, restricted to the
     * target users when the message names any.
     *
     * @return number of successful deliveries
     */
    public int deliverEvent(SseEventMessage message) {
        String subscriptionKey = SubscriptionKeys.encode(message.getEventType(), message.getParams());

        List<SseConnection> candidates;
        if (message.isTargeted()) {
            candidates = new ArrayList<>();
            // Repeated target ids must not double-deliver.
            for (String userId : new LinkedHashSet<>(message.getTargetUserIds())) {
                if (userId == null) {
                    log.warn("Skipping null target user id in event message of type {}", message.getEventType());
                    continue;
                }
                candidates.addAll(connectionRegistry.connectionsOf(userId));
            }
        } else {
            candidates = connectionRegistry.allConnections();
        }

        List<SseConnection> subscribed = candidates.stream()
                .filter(connection -> connection.isSubscribedTo(subscriptionKey))
                .toList();

        log.debug("Processing event message: key={}, targets={}, candidates={}, subscribed={}",
                subscriptionKey, message.getTargetUserIds(), candidates.size(), subscribed.size());

        int successCount = eventDispatcher.broadcast(eventFactory.fromMessage(message), subscribed);

        log.info("Event message processed: type={}, params={}, targetConnections={}, successCount={}",
                message.getEventType(), message.getParams(), subscribed.size(), successCount);
        return successCount;
    }

    public int toUser(String userId, SseEvent event) {
        List<SseConnection> userConnections = connectionRegistry.connectionsOf(userId);
        int successCount = eventDispatcher.broadcast(event, userConnections);
        log.info("User event broadcast completed: user={}, type={}, connections={}, successCount={}",
                userId, event.getType(), userConnections.size(), successCount);
        return successCount;
    }

    public int toOrganization(String organizationId, SseEvent event) {
        List<SseConnection> organizationConnections = connectionRegistry.allConnections().stream()
                .filter(connection -> Objects.equals(organizationId, connection.getOrganizationId()))
                .toList();
        int successCount = eventDispatcher.broadcast(event, organizationConnections);
        log.info("Organization event broadcast completed: org={}, type={}, connections={}, successCount={}",
                organizationId, event.getType(), organizationConnections.size(), successCount);
        return successCount;
    }

    public int toAll(SseEvent event) {
        List<SseConnection> allConnections = connectionRegistry.allConnections();
        int successCount = eventDispatcher.broadcast(event, allConnections);
        log.info("Event broadcast completed: type={}, connections={}, successCount={}",
                event.getType(), allConnections.size(), successCount);
        return successCount;
    }
}
