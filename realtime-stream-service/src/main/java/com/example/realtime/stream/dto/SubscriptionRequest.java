package com.example.realtime.stream.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRequest {
    @NotBlank(message = "userId is required")
    private String userId;
    @NotBlank(message = "eventType is required")
    private String eventType;
    private List<String> params = new ArrayList<>();
}
