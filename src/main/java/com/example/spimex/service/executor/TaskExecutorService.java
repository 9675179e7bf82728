package com.example.spimex.service.executor;

import com.example.spimex.broker.RedisTaskQueue;
import com.example.spimex.broker.TaskMessage;
import com.example.spimex.broker.TaskStatusStore;
import com.example.spimex.config.MetricsConfig;
import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.entity.TaskExecutionLog;
import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.repository.TaskExecutionLogRepository;
import com.example.spimex.service.alert.SlackAlertService;
import com.example.spimex.service.handler.TaskExecutionResult;
import com.example.spimex.service.handler.TaskHandlerRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.net.InetAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Executes one claimed task message.
 * <p>
 * Handles:
 * - Duplicate deliveries of tasks that already succeeded
 * - Handler lookup, validation and invocation
 * - Acknowledgement, retry scheduling or dead-lettering
 * - Execution logging to the store
 * - Extending the claim while a long handler runs
 * - Metrics and on-call alerts
 * <p>
 * Broker errors are not caught here; they reach the consumer loop, which waits for the
 * broker to return. The claimed message then comes back through redelivery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskExecutorService {

    private final RedisTaskQueue taskQueue;
    private final TaskStatusStore statusStore;
    private final TaskExecutionLogRepository executionLogRepository;
    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final TaskQueueProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskScheduler taskScheduler;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }

    /**
     * Execute a claimed message through its full lifecycle.
     *
     * @return true if the task succeeded (or had already succeeded)
     */
    public boolean execute(TaskMessage message) {
        var taskId = message.getId();

        if (statusStore.isCompleted(taskId)) {
            log.info("Task {} already completed, acknowledging duplicate delivery", taskId);
            taskQueue.acknowledge(message);
            return true;
        }

        log.info("Starting execution of task {} (type: {}, attempt: {})", taskId, message.getType(), message.attemptNumber());
        statusStore.record(message, TaskStatus.RUNNING);

        var timerSample = metricsConfig.startTaskExecutionTimer();
        var startTime = Instant.now();
        var heartbeat = startClaimHeartbeat(message);
        TaskExecutionResult result;
        try {
            result = run(message);
        } finally {
            heartbeat.cancel(false);
        }
        var endTime = Instant.now();

        saveExecutionLog(message, result, startTime, endTime);
        metricsConfig.recordTaskExecution(timerSample, message.getType(), result.isSuccess());

        if (result.isSuccess()) {
            handleSuccess(message, result, Duration.between(startTime, endTime).toMillis());
            return true;
        }

        metricsConfig.recordTaskFailure(message.getType(), result.getErrorType());
        handleFailure(message, result);
        return false;
    }

    /**
     * Renews the redelivery deadline three times per visibility timeout, so a claim only
     * lapses when its worker stops.
     */
    private ScheduledFuture<?> startClaimHeartbeat(TaskMessage message) {
        var period = Duration.ofMinutes(properties.getVisibilityTimeoutMinutes()).dividedBy(3);
        return taskScheduler.scheduleAtFixedRate(() -> extendClaim(message), Instant.now().plus(period), period);
    }

    private void extendClaim(TaskMessage message) {
        try {
            taskQueue.extendClaim(message);
        } catch (RuntimeException e) {
            log.warn("Claim of task {} not extended: {}", message.getId(), e.getMessage());
        }
    }

    private TaskExecutionResult run(TaskMessage message) {
        try {
            var handler = handlerRegistry.getHandlerOrThrow(message.getType());

            try {
                handler.validate(message);
            } catch (IllegalArgumentException e) {
                log.error("Task {} validation failed: {}", message.getId(), e.getMessage());
                return TaskExecutionResult.permanentFailure(e.getMessage(), "VALIDATION_ERROR");
            }

            return handler.execute(message);
        } catch (Exception e) {
            log.error("Unexpected error executing task {}: {}", message.getId(), e.getMessage(), e);
            return TaskExecutionResult.failure(e);
        }
    }

    private void handleSuccess(TaskMessage message, TaskExecutionResult result, long durationMs) {
        log.info("Task {} completed successfully in {}ms", message.getId(), durationMs);

        statusStore.markCompleted(message.getId(), getInstanceId());
        taskQueue.acknowledge(message);
        statusStore.record(message, TaskStatus.SUCCEEDED, null, toJson(result.getResultData()));
    }

    private void handleFailure(TaskMessage message, TaskExecutionResult result) {
        log.warn("Task {} failed: {}", message.getId(), result.getErrorMessage());

        if (!result.isRetryable()) {
            handlePermanentFailure(message, result);
            return;
        }

        if (!message.hasAttemptsLeft()) {
            handleMaxRetriesExceeded(message, result);
            return;
        }

        scheduleRetry(message, result);
    }

    private void handlePermanentFailure(TaskMessage message, TaskExecutionResult result) {
        log.error("Task {} failed permanently (non-retryable): {}", message.getId(), result.getErrorMessage());
        deadLetter(message.nextAttempt(result.getErrorMessage()), result);
    }

    private void handleMaxRetriesExceeded(TaskMessage message, TaskExecutionResult result) {
        log.error("Task {} exceeded max retries ({})", message.getId(), message.getMaxRetries());
        deadLetter(message.nextAttempt(result.getErrorMessage()), result);
    }

    private void deadLetter(TaskMessage failed, TaskExecutionResult result) {
        taskQueue.deadLetter(failed);
        statusStore.record(failed, TaskStatus.FAILED, result.getErrorMessage(), null);
        metricsConfig.recordDeadLettered(failed.getType());
        slackAlertService.sendDeadLetterAlert(failed, result.getErrorType());
    }

    private void scheduleRetry(TaskMessage message, TaskExecutionResult result) {
        var handler = handlerRegistry.getHandlerOrThrow(message.getType());
        var delayMs = handler.calculateNextRetryDelayMs(message,
                properties.getRetryInitialDelaySeconds() * 1000L,
                properties.getRetryMaxDelaySeconds() * 1000L);

        var next = message.nextAttempt(result.getErrorMessage());
        log.info("Scheduling retry {} of {} for task {} in {}ms", next.attemptNumber(), next.getMaxRetries(), next.getId(), delayMs);

        taskQueue.scheduleRetry(next, Duration.ofMillis(delayMs));
        statusStore.record(next, TaskStatus.RETRY_PENDING, result.getErrorMessage(), null);
        metricsConfig.recordRetry(next.getType(), next.getAttempt());
    }

    private void saveExecutionLog(TaskMessage message, TaskExecutionResult result, Instant startTime, Instant endTime) {
        var executionLog = TaskExecutionLog.builder()
                .taskId(message.getId())
                .taskType(message.getType())
                .attemptNumber(message.attemptNumber())
                .executorInstance(getInstanceId())
                .startedAt(startTime)
                .completedAt(endTime)
                .durationMs(Duration.between(startTime, endTime).toMillis())
                .success(result.isSuccess())
                .errorMessage(result.getErrorMessage())
                .errorStackTrace(result.getStackTrace())
                .errorType(result.getErrorType())
                .payload(buildPayload(message, result))
                .result(result.getResultData())
                .build();

        try {
            executionLogRepository.save(executionLog);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Execution log for task {} attempt {} not stored: {}", message.getId(), message.attemptNumber(), e.getMessage());
        }
    }

    private Map<String, Object> buildPayload(TaskMessage message, TaskExecutionResult result) {
        var payload = new HashMap<String, Object>();
        payload.put("taskId", message.getId().toString());
        payload.put("taskType", message.getType().name());
        payload.put("origin", message.getOrigin());
        payload.put("attemptNumber", message.attemptNumber());
        payload.put(TaskExecutionLog.MAX_RETRIES, message.getMaxRetries());
        if (!result.isSuccess()) {
            payload.put(TaskExecutionLog.RETRYABLE, result.isRetryable());
        }
        if (message.getPayload() != null) {
            payload.put("taskPayload", message.getPayload());
        }
        return payload;
    }

    private String toJson(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Result of task could not be serialized: {}", e.getOriginalMessage());
            return data.toString();
        }
    }
}
