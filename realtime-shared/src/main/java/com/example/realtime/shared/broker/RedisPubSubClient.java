package com.example.realtime.shared.broker;

import com.example.realtime.shared.exception.BrokerUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisPubSubClient implements PubSubClient {

    private final StringRedisTemplate pubSubRedisTemplate;
    private final RedisMessageListenerContainer redisMessageListenerContainer;
    private final RedisConnectionFactory redisConnectionFactory;

    private final List<MessageListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String channel, String message) {
        Long receivers = pubSubRedisTemplate.convertAndSend(channel, message);
        log.debug("Published to Redis channel '{}', received by {} subscribers", channel, receivers);
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        // The listener container retries silently in the background, so probe the broker first.
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            connection.ping();
        } catch (DataAccessException e) {
            throw new BrokerUnavailableException("Redis is unreachable, cannot subscribe to channel " + channel, e);
        }

        MessageListener listener = (message, pattern) ->
                handler.accept(new String(message.getBody(), StandardCharsets.UTF_8));
        redisMessageListenerContainer.addMessageListener(listener, new ChannelTopic(channel));
        listeners.add(listener);
        log.info("Subscribed to Redis channel '{}'", channel);
    }

    @Override
    public void disconnect() {
        for (MessageListener listener : listeners) {
            redisMessageListenerContainer.removeMessageListener(listener);
        }
        log.info("Removed {} Redis pub/sub listeners", listeners.size());
        listeners.clear();
    }
}
