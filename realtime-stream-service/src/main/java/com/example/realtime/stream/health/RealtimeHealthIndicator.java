package com.example.realtime.stream.health;

import com.example.realtime.stream.dto.ConnectionStats;
import com.example.realtime.stream.service.SseService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the SSE side of this instance. Redis has its own indicator from Spring Boot.
 */
@Component
@RequiredArgsConstructor
public class RealtimeHealthIndicator implements HealthIndicator {

    private final SseService sseService;

    @Override
    public Health health() {
        try {
            ConnectionStats stats = sseService.getConnectionStats();
            return Health.up()
                    .withDetail("pod", String.valueOf(stats.getPodName()))
                    .withDetail("sseConnections", stats.getTotalConnections())
                    .withDetail("connectedUsers", stats.getConnectionsByUser().size())
                    .withDetail("distinctSubscriptions", stats.getSubscriptionStats().getTotalSubscriptions())
                    .build();
        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("sseError", e.getMessage())
                    .build();
        }
    }
}
