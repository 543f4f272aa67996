package com.example.realtime.stream.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ConnectionStats {
    private final String podName;
    private final int totalConnections;
    private final Map<String, Integer> connectionsByUser;
    private final Map<String, Integer> connectionsByOrganization;
    private final SubscriptionStats subscriptionStats;

    @Data
    @Builder
    public static class SubscriptionStats {
        private final int totalSubscriptions;
        private final Map<String, Integer> subscriptionsByEventType;
    }
}
