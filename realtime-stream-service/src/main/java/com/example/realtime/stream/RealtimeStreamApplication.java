package com.example.realtime.stream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-time event stream service.
 *
 * Holds the SSE connections of this instance and keeps their subscriptions in step with
 * every other instance through two Redis pub/sub channels:
 * - subscription changes, applied to the local connections of the affected user
 * - events, matched against local subscriptions and written to the matching streams
 */
@SpringBootApplication(scanBasePackages = "com.example.realtime")
public class RealtimeStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeStreamApplication.class, args);
    }
}
