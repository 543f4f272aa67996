package com.example.realtime.shared.dto.broker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class SseSubscriptionMessage extends SseBrokerMessage {
    private String userId;
    private SubscriptionAction action;
    private String eventType;
    @Builder.Default
    private List<String> params = List.of();
}
