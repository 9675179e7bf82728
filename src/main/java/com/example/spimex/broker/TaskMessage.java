package com.example.spimex.broker;

import com.example.spimex.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Unit of work carried by the broker.
 * Serialized as JSON into the payload hash; the queues only hold ids.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage {

    private UUID id;

    private TaskType type;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    /**
     * Attempts already made; 0 for a fresh message
     */
    private int attempt;

    private int maxRetries;

    /**
     * Producer that enqueued the message (api, beat)
     */
    private String origin;

    private Instant enqueuedAt;

    private String lastError;

    public static TaskMessage create(TaskType type, Map<String, Object> payload, int maxRetries, String origin) {
        return TaskMessage.builder()
                .id(UUID.randomUUID())
                .type(type)
                .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                .attempt(0)
                .maxRetries(maxRetries)
                .origin(origin)
                .enqueuedAt(Instant.now())
                .build();
    }

    public String payloadString(String key) {
        var value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public boolean payloadFlag(String key) {
        var value = payload != null ? payload.get(key) : null;
        return value instanceof Boolean flag ? flag : Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Copy for the next attempt
     */
    public TaskMessage nextAttempt(String error) {
        return toBuilder()
                .attempt(attempt + 1)
                .lastError(error)
                .build();
    }

    /**
     * Attempts made once the current one finishes
     */
    public int attemptNumber() {
        return attempt + 1;
    }

    public boolean hasAttemptsLeft() {
        return attemptNumber() < maxRetries;
    }
}
