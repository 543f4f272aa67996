package com.example.realtime.shared.dto.broker;

import com.example.realtime.shared.util.Constants;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Body of a message travelling over one of the SSE broker channels.
 * The {@code type} property tells the two envelope shapes apart.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SseEventMessage.class, name = Constants.BrokerMessageType.EVENT),
    @JsonSubTypes.Type(value = SseSubscriptionMessage.class, name = Constants.BrokerMessageType.SUBSCRIPTION)
})
public abstract class SseBrokerMessage {
}
