package com.example.realtime.stream.connection;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SinkSseStreamTest {

    @Test
    void framesWrittenBeforeSubscriptionAreBuffered() {
        SinkSseStream stream = new SinkSseStream();
        stream.write("event: A\n\n");
        stream.write("event: B\n\n");
        stream.close();

        StepVerifier.create(stream.asFlux())
                .expectNext("event: A\n\n", "event: B\n\n")
                .verifyComplete();
    }

    @Test
    void clientCancelTriggersTerminationOnce() {
        SinkSseStream stream = new SinkSseStream();
        AtomicInteger terminations = new AtomicInteger();
        stream.onTermination(error -> terminations.incrementAndGet());

        StepVerifier.create(stream.asFlux())
                .then(() -> stream.write("event: A\n\n"))
                .expectNext("event: A\n\n")
                .thenCancel()
                .verify();

        assertThat(stream.isClosed()).isTrue();
        assertThat(terminations.get()).isEqualTo(1);
    }

    @Test
    void closeCompletesTheFluxAndReportsNormalEnd() {
        SinkSseStream stream = new SinkSseStream();
        AtomicReference<Throwable> reported = new AtomicReference<>(new IllegalStateException("not called"));
        stream.onTermination(reported::set);

        StepVerifier.create(stream.asFlux())
                .then(stream::close)
                .verifyComplete();

        assertThat(reported.get()).isNull();
    }

    @Test
    void writeAfterCloseFails() {
        SinkSseStream stream = new SinkSseStream();
        stream.close();

        assertThatThrownBy(() -> stream.write("event: A\n\n"))
                .isInstanceOf(StreamWriteException.class);
    }

    @Test
    void writeAfterClientCancelFails() {
        SinkSseStream stream = new SinkSseStream();
        StepVerifier.create(stream.asFlux()).thenCancel().verify();

        assertThatThrownBy(() -> stream.write("event: A\n\n"))
                .isInstanceOf(StreamWriteException.class);
    }
}
