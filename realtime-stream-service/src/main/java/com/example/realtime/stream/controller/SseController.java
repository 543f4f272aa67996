package com.example.realtime.stream.controller;

import com.example.realtime.stream.dto.ConnectionStats;
import com.example.realtime.stream.dto.EmitRequest;
import com.example.realtime.stream.dto.SubscriptionRequest;
import com.example.realtime.stream.service.SseService;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * HTTP entry points. Identity comes in already resolved by the authentication layer in
 * front of this service.
 */
@RestController
@RequestMapping("/api/sse")
@RequiredArgsConstructor
@Slf4j
public class SseController {

    private final SseService sseService;

    @GetMapping(value = "/connect", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "sseConnectLimiter", fallbackMethod = "connectFallback")
    public Flux<DataBuffer> connect(
            @RequestParam String userId,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {

        log.info("[CONNECT_START] SSE connection request for userId='{}', organizationId='{}', IP='{}'",
                userId, organizationId,
                exchange.getRequest().getRemoteAddress() != null ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress() : "unknown");

        ServerHttpResponse response = exchange.getResponse();
        response.getHeaders().set(HttpHeaders.CACHE_CONTROL, "no-cache");
        response.getHeaders().set("X-Accel-Buffering", "no");

        // Frames are already rendered, so they go out as raw bytes rather than through the SSE encoder.
        DataBufferFactory bufferFactory = response.bufferFactory();
        return sseService.connect(userId, organizationId)
                .map(frame -> bufferFactory.wrap(frame.getBytes(StandardCharsets.UTF_8)));
    }

    public Flux<DataBuffer> connectFallback(String userId, String organizationId, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded for user: {}. IP: {}. Details: {}",
                userId,
                exchange.getRequest().getRemoteAddress(),
                ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect(@RequestParam String connectionId) {
        log.info("Disconnect request for connection: {}", connectionId);
        boolean removed = sseService.disconnect(connectionId);
        return ResponseEntity.ok(Map.of("connectionId", connectionId, "removed", removed));
    }

    @PostMapping("/subscribe")
    public ResponseEntity<Map<String, Boolean>> subscribe(@Valid @RequestBody SubscriptionRequest request) {
        boolean success = sseService.subscribe(request.getUserId(), request.getEventType(), request.getParams());
        return ResponseEntity.ok(Map.of("success", success));
    }

    @PostMapping("/unsubscribe")
    public ResponseEntity<Map<String, Boolean>> unsubscribe(@Valid @RequestBody SubscriptionRequest request) {
        boolean success = sseService.unsubscribe(request.getUserId(), request.getEventType(), request.getParams());
        return ResponseEntity.ok(Map.of("success", success));
    }

    @GetMapping("/subscriptions/{userId}")
    public ResponseEntity<List<String>> getUserSubscriptions(@PathVariable String userId) {
        return ResponseEntity.ok(sseService.getUserSubscriptions(userId));
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> emit(@Valid @RequestBody EmitRequest request) {
        sseService.emit(request.getEventType(), request.getParams(), request.getPayload(), request.getTargetUserIds());
        return ResponseEntity.accepted().body(Map.of("published", true, "eventType", request.getEventType()));
    }

    @GetMapping("/stats")
    public ResponseEntity<ConnectionStats> getStats() {
        return ResponseEntity.ok(sseService.getConnectionStats());
    }

    @GetMapping("/connected/{userId}")
    public ResponseEntity<Boolean> isUserConnected(@PathVariable String userId) {
        return ResponseEntity.ok(sseService.isUserConnected(userId));
    }
}
