package com.example.spimex.broker;

import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.enums.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reliable task queue on Redis.
 * <p>
 * Keys under the configured prefix:
 * - payloads: hash of task id to message JSON
 * - ready: list of ids waiting for a worker (LPUSH in, BLMOVE out from the right)
 * - processing: list of ids claimed by a worker
 * - inflight: sorted set of claimed ids scored by their redelivery deadline
 * - delayed: sorted set of ids waiting for a retry, scored by due time
 * - dead: list of ids that failed for good
 * <p>
 * Delivery is at least once: a claim moves the id atomically from ready to processing,
 * and an id whose deadline passes without an acknowledgement goes back to ready.
 * Moves between sets are decided by ZREM, so only one of several concurrent maintenance
 * runs performs each move.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisTaskQueue {

    private static final int MAINTENANCE_BATCH = 100;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TaskQueueProperties properties;
    private final TaskStatusStore statusStore;

    public void enqueue(TaskMessage message) {
        var id = message.getId().toString();
        // Payload first: an id in a list always has a payload to read
        redisTemplate.opsForHash().put(payloadsKey(), id, serialize(message));
        redisTemplate.opsForList().leftPush(readyKey(), id);
        statusStore.record(message, TaskStatus.QUEUED);

        log.info("Enqueued task {} (type: {}, origin: {})", id, message.getType(), message.getOrigin());
    }

    /**
     * Block up to {@code timeout} for the next ready task and claim it.
     *
     * @return the claimed message, empty if nothing arrived in time
     */
    public Optional<TaskMessage> claim(Duration timeout) {
        var id = redisTemplate.opsForList().move(readyKey(), Direction.RIGHT, processingKey(), Direction.LEFT, timeout);
        if (id == null) {
            return Optional.empty();
        }

        redisTemplate.opsForZSet().add(inflightKey(), id, deadline(Instant.now()));

        var json = redisTemplate.<String, String>opsForHash().get(payloadsKey(), id);
        if (json == null) {
            log.warn("Claimed task {} has no payload, discarding", id);
            forget(id);
            return Optional.empty();
        }

        try {
            return Optional.of(deserialize(json));
        } catch (IllegalArgumentException e) {
            log.error("Claimed task {} has an unreadable payload, dead-lettering: {}", id, e.getMessage());
            redisTemplate.opsForList().leftPush(deadKey(), id);
            release(id);
            return Optional.empty();
        }
    }

    /**
     * Push the redelivery deadline of a running task forward.
     * <p>
     * Only a claim that is still registered is extended; once maintenance has taken the
     * id back, a stray deadline left by a race here finds nothing in processing and is dropped.
     *
     * @return false if the claim is no longer held
     */
    public boolean extendClaim(TaskMessage message) {
        var id = message.getId().toString();
        if (redisTemplate.opsForZSet().score(inflightKey(), id) == null) {
            log.warn("Task {} lost its claim while running", id);
            return false;
        }
        redisTemplate.opsForZSet().add(inflightKey(), id, deadline(Instant.now()));
        log.debug("Extended claim of task {}", id);
        return true;
    }

    /**
     * Task finished; drop every trace of it from the queues
     */
    public void acknowledge(TaskMessage message) {
        forget(message.getId().toString());
        log.debug("Acknowledged task {}", message.getId());
    }

    /**
     * Park a task until {@code delay} has passed. The message should already carry the
     * incremented attempt count.
     */
    public void scheduleRetry(TaskMessage message, Duration delay) {
        var id = message.getId().toString();
        var due = Instant.now().plus(delay);

        redisTemplate.opsForHash().put(payloadsKey(), id, serialize(message));
        redisTemplate.opsForZSet().add(delayedKey(), id, due.toEpochMilli());
        release(id);

        log.info("Task {} parked for retry {} until {}", id, message.getAttempt(), due);
    }

    public void deadLetter(TaskMessage message) {
        var id = message.getId().toString();

        redisTemplate.opsForHash().put(payloadsKey(), id, serialize(message));
        redisTemplate.opsForList().leftPush(deadKey(), id);
        release(id);

        log.warn("Task {} moved to dead-letter list", id);
    }

    /**
     * Move retries whose due time has passed back onto the ready list.
     *
     * @return number of tasks this call promoted
     */
    public int promoteDueRetries(Instant now) {
        var due = redisTemplate.opsForZSet().rangeByScore(delayedKey(), 0, now.toEpochMilli(), 0, MAINTENANCE_BATCH);
        if (due == null || due.isEmpty()) {
            return 0;
        }

        var promoted = 0;
        for (var id : due) {
            if (removed(redisTemplate.opsForZSet().remove(delayedKey(), id))) {
                redisTemplate.opsForList().leftPush(readyKey(), id);
                promoted++;
            }
        }

        if (promoted > 0) {
            log.info("Promoted {} due retries", promoted);
        }
        return promoted;
    }

    /**
     * Return abandoned claims to the ready list.
     * <p>
     * An id sitting in processing without a deadline (its worker died between the claim
     * and registering the deadline) is given one now, so it is recovered on a later run.
     *
     * @return number of tasks this call redelivered
     */
    public int requeueExpired(Instant now) {
        var processing = redisTemplate.opsForList().range(processingKey(), 0, -1);
        if (processing != null) {
            for (var id : processing) {
                redisTemplate.opsForZSet().addIfAbsent(inflightKey(), id, deadline(now));
            }
        }

        var expired = redisTemplate.opsForZSet().rangeByScore(inflightKey(), 0, now.toEpochMilli(), 0, MAINTENANCE_BATCH);
        if (expired == null || expired.isEmpty()) {
            return 0;
        }

        var requeued = 0;
        for (var id : expired) {
            if (!removed(redisTemplate.opsForZSet().remove(inflightKey(), id))) {
                continue;
            }
            // Zero means the task was acknowledged in the meantime
            if (removed(redisTemplate.opsForList().remove(processingKey(), 1, id))) {
                redisTemplate.opsForList().leftPush(readyKey(), id);
                requeued++;
                log.warn("Task {} exceeded its visibility timeout, redelivering", id);
            }
        }
        return requeued;
    }

    public QueueDepth depth() {
        return QueueDepth.builder()
                .ready(size(redisTemplate.opsForList().size(readyKey())))
                .processing(size(redisTemplate.opsForList().size(processingKey())))
                .delayed(size(redisTemplate.opsForZSet().zCard(delayedKey())))
                .deadLettered(size(redisTemplate.opsForList().size(deadKey())))
                .build();
    }

    private void release(String id) {
        redisTemplate.opsForList().remove(processingKey(), 1, id);
        redisTemplate.opsForZSet().remove(inflightKey(), id);
    }

    private void forget(String id) {
        release(id);
        redisTemplate.opsForHash().delete(payloadsKey(), id);
    }

    private double deadline(Instant from) {
        return from.plus(Duration.ofMinutes(properties.getVisibilityTimeoutMinutes())).toEpochMilli();
    }

    String serialize(TaskMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task message cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    TaskMessage deserialize(String json) {
        try {
            return objectMapper.readValue(json, TaskMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task message cannot be read: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean removed(Long count) {
        return count != null && count > 0;
    }

    private static long size(Long value) {
        return value != null ? value : 0L;
    }

    String payloadsKey() {
        return properties.key("payloads");
    }

    String readyKey() {
        return properties.key("ready");
    }

    String processingKey() {
        return properties.key("processing");
    }

    String inflightKey() {
        return properties.key("inflight");
    }

    String delayedKey() {
        return properties.key("delayed");
    }

    String deadKey() {
        return properties.key("dead");
    }
}
