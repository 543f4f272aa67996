package com.example.realtime.shared.dto.broker;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SubscriptionAction {
    @JsonProperty("subscribe")
    SUBSCRIBE,
    @JsonProperty("unsubscribe")
    UNSUBSCRIBE
}
