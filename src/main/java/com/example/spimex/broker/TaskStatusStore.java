package com.example.spimex.broker;

import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.enums.TaskType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-task status hashes kept next to the queues.
 * <p>
 * Key pattern: {prefix}:status:{taskId}. Records expire after the configured TTL,
 * after which only the execution log in the store remains.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskStatusStore {

    static final String TYPE = "type";
    static final String STATUS = "status";
    static final String ATTEMPT = "attempt";
    static final String LAST_ERROR = "lastError";
    static final String RESULT = "result";
    static final String UPDATED_AT = "updatedAt";

    private static final int MAX_TEXT_LENGTH = 2000;

    private final StringRedisTemplate redisTemplate;
    private final TaskQueueProperties properties;

    public void record(TaskMessage message, TaskStatus status) {
        record(message, status, null, null);
    }

    public void record(TaskMessage message, TaskStatus status, String lastError, String result) {
        var key = statusKey(message.getId());
        var fields = new HashMap<String, String>();
        fields.put(TYPE, message.getType().name());
        fields.put(STATUS, status.name());
        fields.put(ATTEMPT, String.valueOf(message.getAttempt()));
        fields.put(UPDATED_AT, Instant.now().toString());
        if (lastError != null) {
            fields.put(LAST_ERROR, truncate(lastError));
        }
        if (result != null) {
            fields.put(RESULT, truncate(result));
        }

        redisTemplate.opsForHash().putAll(key, fields);
        redisTemplate.expire(key, ttl());
        log.debug("Task {} is now {}", message.getId(), status);
    }

    public Optional<TaskStatusRecord> find(UUID taskId) {
        var entries = redisTemplate.<String, String>opsForHash().entries(statusKey(taskId));
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(TaskStatusRecord.builder()
                .taskId(taskId)
                .taskType(TaskType.valueOf(entries.get(TYPE)))
                .status(TaskStatus.valueOf(entries.get(STATUS)))
                .attempt(Integer.parseInt(entries.getOrDefault(ATTEMPT, "0")))
                .lastError(entries.get(LAST_ERROR))
                .result(entries.get(RESULT))
                .updatedAt(entries.containsKey(UPDATED_AT) ? Instant.parse(entries.get(UPDATED_AT)) : null)
                .build());
    }

    /**
     * Whether a task already ran to success
     */
    public boolean isCompleted(UUID taskId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(completedKey(taskId)));
    }

    /**
     * Record the first successful completion of a task (SET NX with TTL).
     *
     * @return true if this caller recorded it, false if another delivery already had
     */
    public boolean markCompleted(UUID taskId, String executor) {
        var value = String.format("%s:%d", executor, System.currentTimeMillis());
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(completedKey(taskId), value, ttl()));
    }

    String statusKey(UUID taskId) {
        return properties.key("status:" + taskId);
    }

    String completedKey(UUID taskId) {
        return properties.key("completed:" + taskId);
    }

    private Duration ttl() {
        return Duration.ofHours(properties.getStatusTtlHours());
    }

    private static String truncate(String text) {
        return text.length() <= MAX_TEXT_LENGTH ? text : text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
}
