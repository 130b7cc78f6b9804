package com.example.webhookscheduler.service.queue;

import com.example.webhookscheduler.exception.DispatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Task queue on a Redis sorted set with delayed delivery.
 * <p>
 * Layout:
 * - {prefix}due: sorted set, member = run id, score = epoch millis the task becomes deliverable
 * - {prefix}payloads: hash, run id -> task JSON
 * <p>
 * Enqueue and claim are Lua scripts, so a task is either fully queued or absent and is handed
 * to exactly one consumer.
 */
@Slf4j
@Component
public class RedisTaskQueue implements TaskQueue {

    static final String CIRCUIT_BREAKER = "taskQueue";

    static final RedisScript<Long> ENQUEUE_SCRIPT = new DefaultRedisScript<>("""
            redis.call('HSET', KEYS[2], ARGV[1], ARGV[3])
            redis.call('ZADD', KEYS[1], ARGV[2], ARGV[1])
            return 1
            """, Long.class);

    @SuppressWarnings("rawtypes")
    static final RedisScript<List> CLAIM_SCRIPT = new DefaultRedisScript<>("""
            local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[2]))
            local claimed = {}
            for _, id in ipairs(ids) do
                redis.call('ZREM', KEYS[1], id)
                local payload = redis.call('HGET', KEYS[2], id)
                redis.call('HDEL', KEYS[2], id)
                if payload then
                    table.insert(claimed, payload)
                end
            end
            return claimed
            """, List.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String dueKey;
    private final String payloadKey;

    public RedisTaskQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
                          @Value("${webhook-scheduler.queue.key-prefix:webhook-scheduler:queue:}") String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dueKey = keyPrefix + "due";
        this.payloadKey = keyPrefix + "payloads";
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "enqueueFallback")
    public void enqueue(QueuedTask task, Duration delay) {
        var deliverAt = clock.millis() + Math.max(delay.toMillis(), 0);
        try {
            var json = objectMapper.writeValueAsString(task);
            redisTemplate.execute(ENQUEUE_SCRIPT, List.of(dueKey, payloadKey),
                    task.getRunId().toString(), String.valueOf(deliverAt), json);
            log.debug("Queued run {} (attempt {}) for delivery at {}", task.getRunId(), task.getAttempt(), deliverAt);
        } catch (JsonProcessingException e) {
            throw new DispatchException(task.getRunId(), "task could not be serialized", e);
        } catch (DataAccessException e) {
            throw new DispatchException(task.getRunId(), "task queue unreachable", e);
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "pollFallback")
    public List<QueuedTask> poll(int max) {
        List<?> raw = redisTemplate.execute(CLAIM_SCRIPT, List.of(dueKey, payloadKey),
                String.valueOf(clock.millis()), String.valueOf(max));
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        var tasks = new ArrayList<QueuedTask>(raw.size());
        for (var item : raw) {
            try {
                tasks.add(objectMapper.readValue(item.toString(), QueuedTask.class));
            } catch (JsonProcessingException e) {
                log.error("Dropping unreadable queue entry: {}", e.getMessage());
            }
        }
        return tasks;
    }

    @Override
    public long size() {
        var size = redisTemplate.opsForZSet().zCard(dueKey);
        return size != null ? size : 0;
    }

    private void enqueueFallback(QueuedTask task, Duration delay, Throwable throwable) {
        if (throwable instanceof DispatchException dispatchException) {
            throw dispatchException;
        }
        throw new DispatchException(task.getRunId(), "task queue unavailable (" + throwable.getClass().getSimpleName() + ")", throwable);
    }

    private List<QueuedTask> pollFallback(int max, Throwable throwable) {
        log.warn("Task queue unavailable, skipping poll: {}", throwable.getMessage());
        return List.of();
    }
}
