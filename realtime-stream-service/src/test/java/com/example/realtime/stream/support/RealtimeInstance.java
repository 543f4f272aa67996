package com.example.realtime.stream.support;

import com.example.realtime.shared.broker.PubSubClient;
import com.example.realtime.shared.broker.SseMessageCodec;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.service.SseEventPublisher;
import com.example.realtime.stream.connection.SseConnectionRegistry;
import com.example.realtime.stream.service.SseBrokerBridge;
import com.example.realtime.stream.service.SseConnectionManager;
import com.example.realtime.stream.service.SseEventDispatcher;
import com.example.realtime.stream.service.SseEventFactory;
import com.example.realtime.stream.service.SseFanoutCoordinator;
import com.example.realtime.stream.service.SseHeartbeatScheduler;
import com.example.realtime.stream.service.SseService;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.scheduler.Scheduler;

/**
 * One service instance wired by hand, the way Spring would wire it, around a given broker
 * client and heartbeat scheduler. Several of these on one {@link InMemoryBroker} behave like
 * separate processes behind a load balancer.
 */
public class RealtimeInstance {

    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    public final AppProperties properties = new AppProperties();
    public final SseConnectionRegistry registry = new SseConnectionRegistry();
    public final SseEventFactory eventFactory;
    public final SseEventDispatcher dispatcher;
    public final SseHeartbeatScheduler heartbeatScheduler;
    public final SseConnectionManager connectionManager;
    public final SseFanoutCoordinator fanoutCoordinator;
    public final SseMessageCodec messageCodec;
    public final SseEventPublisher publisher;
    public final SseBrokerBridge bridge;
    public final SseService service;

    public RealtimeInstance(String podName, PubSubClient pubSubClient, Scheduler heartbeatTicks) {
        properties.setPodName(podName);
        properties.getSse().setShutdownNoticeDelay(0);

        eventFactory = new SseEventFactory(objectMapper);
        dispatcher = new SseEventDispatcher(registry, objectMapper);
        heartbeatScheduler = new SseHeartbeatScheduler(registry, dispatcher, eventFactory, heartbeatTicks, properties);
        connectionManager = new SseConnectionManager(registry, dispatcher, eventFactory, heartbeatScheduler);
        fanoutCoordinator = new SseFanoutCoordinator(registry, dispatcher, eventFactory);
        messageCodec = new SseMessageCodec(objectMapper);
        publisher = new SseEventPublisher(pubSubClient, messageCodec, objectMapper, properties);
        bridge = new SseBrokerBridge(pubSubClient, messageCodec, fanoutCoordinator, properties);
        service = new SseService(registry, connectionManager, fanoutCoordinator, bridge, publisher, eventFactory, properties);
    }

    public RealtimeInstance started() {
        service.init();
        return this;
    }
}
