package com.example.realtime.stream.connection;

public class StreamWriteException extends RuntimeException {

    public StreamWriteException(String message) {
        super(message);
    }

    public StreamWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
