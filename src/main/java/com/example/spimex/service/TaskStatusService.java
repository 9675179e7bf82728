package com.example.spimex.service;

import com.example.spimex.broker.TaskStatusStore;
import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.entity.TaskExecutionLog;
import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.repository.TaskExecutionLogRepository;
import com.example.spimex.dto.TaskStatusResponse;
import com.example.spimex.exception.TaskNotFoundException;
import com.example.spimex.mapper.TradingResultMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Combines the broker's live status record with the execution history in the store.
 * <p>
 * Status records expire; after that the history alone answers, and the status is
 * derived from the latest attempt: a failure is final when it was not retryable or
 * used the last attempt, otherwise a retry is still pending.
 */
@Service
@RequiredArgsConstructor
public class TaskStatusService {

    private final TaskStatusStore statusStore;
    private final TaskExecutionLogRepository executionLogRepository;
    private final TradingResultMapper mapper;
    private final TaskQueueProperties properties;

    @Transactional(readOnly = true)
    public TaskStatusResponse getStatus(UUID taskId) {
        var history = executionLogRepository.findByTaskIdOrderByAttemptNumberDesc(taskId);
        var record = statusStore.find(taskId);

        if (record.isEmpty() && history.isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }

        var response = TaskStatusResponse.builder()
                .taskId(taskId)
                .executionHistory(mapper.toLogResponses(history));

        if (record.isPresent()) {
            var status = record.get();
            return response
                    .taskType(status.getTaskType())
                    .status(status.getStatus())
                    .finished(status.getStatus().isTerminal())
                    .attempt(status.getAttempt())
                    .lastError(status.getLastError())
                    .result(status.getResult())
                    .updatedAt(status.getUpdatedAt())
                    .build();
        }

        var latest = history.get(0);
        var status = statusOf(latest);
        return response
                .taskType(latest.getTaskType())
                .status(status)
                .finished(status.isTerminal())
                .attempt(latest.getAttemptNumber())
                .lastError(latest.getErrorMessage())
                .updatedAt(latest.getCompletedAt())
                .build();
    }

    private TaskStatus statusOf(TaskExecutionLog latest) {
        if (Boolean.TRUE.equals(latest.getSuccess())) {
            return TaskStatus.SUCCEEDED;
        }
        var payload = latest.getPayload() != null ? latest.getPayload() : Map.<String, Object>of();
        if (Boolean.FALSE.equals(payload.get(TaskExecutionLog.RETRYABLE))) {
            return TaskStatus.FAILED;
        }
        var maxRetries = payload.get(TaskExecutionLog.MAX_RETRIES) instanceof Number number
                ? number.intValue()
                : properties.getDefaultMaxRetries();
        return latest.getAttemptNumber() >= maxRetries ? TaskStatus.FAILED : TaskStatus.RETRY_PENDING;
    }
}
