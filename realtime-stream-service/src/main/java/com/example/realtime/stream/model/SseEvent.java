package com.example.realtime.stream.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * An event ready for a client stream: a type tag plus an untyped JSON payload.
 */
@Data
@Builder
@AllArgsConstructor
public class SseEvent {
    private final String type;
    private final JsonNode data;
    private final Instant timestamp;
}
