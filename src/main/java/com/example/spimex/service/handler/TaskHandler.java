package com.example.spimex.service.handler;

import com.example.spimex.broker.TaskMessage;
import com.example.spimex.domain.enums.TaskType;

/**
 * Interface for task handlers.
 * <p>
 * Each task type has one handler that knows how to execute it. Handlers are stateless
 * and translate their own errors into a {@link TaskExecutionResult}; acknowledgement,
 * retries and execution logging belong to the executor.
 */
public interface TaskHandler {

    TaskType getTaskType();

    TaskExecutionResult execute(TaskMessage message);

    /**
     * Validate the message payload before execution
     *
     * @throws IllegalArgumentException if the payload cannot be executed
     */
    default void validate(TaskMessage message) {
        if (message.getType() != getTaskType()) {
            throw new IllegalArgumentException("Message of type " + message.getType() + " sent to " + getTaskType() + " handler");
        }
    }

    /**
     * Delay before the next attempt: the initial delay doubled per attempt made, capped
     *
     * @param message        The failed message, before its attempt count is incremented
     * @param initialDelayMs Delay after the first failure
     * @param maxDelayMs     Upper bound
     */
    default long calculateNextRetryDelayMs(TaskMessage message, long initialDelayMs, long maxDelayMs) {
        var exponent = Math.min(message.getAttempt(), 30);
        var delay = initialDelayMs * (1L << exponent);
        return delay <= 0 ? maxDelayMs : Math.min(delay, maxDelayMs);
    }
}
