package com.example.realtime.shared.exception;

import lombok.Getter;

/**
 * Raised when a broker message cannot be serialized or parsed.
 * Carries the raw body so the failure can be logged with its context.
 */
@Getter
public class MessageProcessingException extends RuntimeException {

    private final String rawMessage;

    public MessageProcessingException(String message, Throwable cause, String rawMessage) {
        super(message, cause);
        this.rawMessage = rawMessage;
    }
}
