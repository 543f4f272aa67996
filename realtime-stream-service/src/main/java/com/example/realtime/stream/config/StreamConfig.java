package com.example.realtime.stream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class StreamConfig {

    /**
     * Runs the per-connection heartbeat ticks, off the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler heartbeatScheduler() {
        return Schedulers.newParallel("sse-heartbeat-", Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }
}
