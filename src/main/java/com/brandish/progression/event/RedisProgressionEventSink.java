package com.brandish.progression.event;

import com.brandish.progression.config.ProgressionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * Pushes events as JSON onto a Redis list for out-of-process consumers. While Redis is
 * unreachable, events go to the logging sink and Redis is retried after a short backoff.
 */
@Service
@RequiredArgsConstructor
@Primary
@ConditionalOnProperty(
        prefix = "progression.events",
        name = "sink-mode",
        havingValue = "redis"
)
public class RedisProgressionEventSink implements ProgressionEventSink {

    private static final Logger log = LoggerFactory.getLogger(RedisProgressionEventSink.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final ProgressionProperties progressionProperties;
    private final LoggingProgressionEventSink fallbackSink;

    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    @Override
    public void publish(ProgressionEvent event) {
        ProgressionEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        if (System.nanoTime() < redisRetryNotBeforeNanos) {
            fallbackSink.publish(requiredEvent);
            return;
        }
        try {
            Long listLength = stringRedisTemplate.opsForList().rightPush(resolveListKey(), serialize(requiredEvent));
            if (listLength != null) {
                markRedisHealthy();
                return;
            }
            log.warn("Redis event push returned null, routing event to log sink");
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        fallbackSink.publish(requiredEvent);
    }

    String serialize(ProgressionEvent event) {
        try {
            return OBJECT_MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize progression event payload", ex);
        }
    }

    private String resolveListKey() {
        String listKey = progressionProperties.getEvents().getRedisListKey();
        if (listKey == null || listKey.isBlank()) {
            throw new IllegalStateException("progression.events.redis-list-key must not be blank");
        }
        return listKey.trim();
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            log.warn("Redis event sink is unavailable ({}); logging events until it recovers",
                    ex == null ? "null reply" : ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis event sink connection restored");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }
}
