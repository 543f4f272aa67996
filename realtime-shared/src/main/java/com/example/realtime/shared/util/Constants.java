package com.example.realtime.shared.util;

public final class Constants {

    private Constants() {}

    public static final class BrokerMessageType {
        private BrokerMessageType() {}
        public static final String EVENT = "event";
        public static final String SUBSCRIPTION = "subscription";
    }

    public enum SseEventType {
        CONNECTED,
        HEARTBEAT,
        NOTIFICATION,
        DATA_CHANGE,
        SERVER_SHUTDOWN
    }

    public enum NotificationLevel {
        INFO,
        SUCCESS,
        WARNING,
        ERROR
    }

    public enum DataChangeType {
        CREATE,
        UPDATE,
        PUT,
        DELETE
    }
}
