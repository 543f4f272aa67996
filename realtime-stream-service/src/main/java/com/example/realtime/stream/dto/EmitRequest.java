package com.example.realtime.stream.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmitRequest {
    @NotBlank(message = "eventType is required")
    private String eventType;
    private List<String> params = new ArrayList<>();
    private JsonNode payload;
    private List<String> targetUserIds; // omit to reach every subscriber
}
