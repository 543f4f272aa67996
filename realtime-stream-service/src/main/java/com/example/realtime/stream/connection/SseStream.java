package com.example.realtime.stream.connection;

import java.util.function.Consumer;

/**
 * Write side of one client's event stream. Only the owning {@link SseConnection} writes to it.
 */
public interface SseStream {

    /**
     * Hands a complete frame to the transport without waiting for delivery.
     *
     * @throws StreamWriteException if the frame cannot be accepted
     */
    void write(String frame);

    boolean isClosed();

    /** Ends the stream. No-op when already closed. */
    void close();

    /**
     * Called once when the stream ends for any reason: client cancel, transport error,
     * or {@link #close()}. The argument is the error, or {@code null} on a normal end.
     */
    void onTermination(Consumer<Throwable> handler);
}
