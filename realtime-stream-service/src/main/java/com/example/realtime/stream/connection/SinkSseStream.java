package com.example.realtime.stream.connection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link SseStream} backed by a Reactor sink. The HTTP layer subscribes to {@link #asFlux()}
 * and writes whatever frames come out of it.
 */
public class SinkSseStream implements SseStream {

    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Consumer<Throwable> terminationHandler = error -> { };

    public Flux<String> asFlux() {
        return sink.asFlux()
                .doOnCancel(() -> terminate(null))
                .doOnError(this::terminate)
                .doOnComplete(() -> terminate(null));
    }

    // Writers come from the heartbeat scheduler and the broker listener thread; the sink needs them serialized.
    @Override
    public synchronized void write(String frame) {
        if (closed.get()) {
            throw new StreamWriteException("Stream is closed");
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            closed.set(true);
            throw new StreamWriteException("Failed to emit frame: " + result);
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public synchronized void close() {
        if (closed.compareAndSet(false, true)) {
            sink.tryEmitComplete();
        }
    }

    @Override
    public void onTermination(Consumer<Throwable> handler) {
        this.terminationHandler = handler;
    }

    private void terminate(Throwable error) {
        closed.set(true);
        if (terminated.compareAndSet(false, true)) {
            terminationHandler.accept(error);
        }
    }
}
