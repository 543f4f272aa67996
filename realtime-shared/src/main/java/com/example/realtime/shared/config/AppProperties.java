package com.example.realtime.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
public class AppProperties {

    private String podName;

    @Valid
    private final Sse sse = new Sse();
    @Valid
    private final Redis redis = new Redis();

    @Data
    public static class Sse {
        @Positive
        private long heartbeatInterval = 5000L;
        @PositiveOrZero
        private long shutdownNoticeDelay = 500L;
    }

    @Data
    public static class Redis {
        @NotBlank
        private String eventsChannel = "sse:events";
        @NotBlank
        private String subscriptionsChannel = "sse:subscriptions";
    }
}
