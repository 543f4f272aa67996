package com.example.realtime.shared.dto.broker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class SseEventMessage extends SseBrokerMessage {
    private String eventType;
    @Builder.Default
    private List<String> params = List.of();
    private JsonNode payload;
    private List<String> targetUserIds; // null means every subscriber
    private Instant timestamp;

    @JsonIgnore
    public boolean isTargeted() {
        return targetUserIds != null;
    }
}
