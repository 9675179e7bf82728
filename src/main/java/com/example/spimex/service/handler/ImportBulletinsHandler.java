package com.example.spimex.service.handler;

import com.example.spimex.broker.TaskDispatcher;
import com.example.spimex.broker.TaskMessage;
import com.example.spimex.domain.enums.TaskType;
import com.example.spimex.service.BulletinImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Handler for bulletin imports.
 * <p>
 * Payload: targetDate (ISO date, required), force (boolean, optional).
 * Exceptions are classified by {@link TaskExecutionResult#failure(Exception)}: download
 * failures are retried, unreadable bulletins are not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportBulletinsHandler implements TaskHandler {

    private final BulletinImportService importService;

    @Override
    public TaskType getTaskType() {
        return TaskType.IMPORT_BULLETINS;
    }

    @Override
    public void validate(TaskMessage message) {
        TaskHandler.super.validate(message);
        var targetDate = message.payloadString(TaskDispatcher.TARGET_DATE);
        if (targetDate == null || targetDate.isBlank()) {
            throw new IllegalArgumentException("targetDate is required for bulletin import");
        }
        try {
            LocalDate.parse(targetDate);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("targetDate is not an ISO date: " + targetDate);
        }
    }

    @Override
    public TaskExecutionResult execute(TaskMessage message) {
        var targetDate = LocalDate.parse(message.payloadString(TaskDispatcher.TARGET_DATE));
        var force = message.payloadFlag(TaskDispatcher.FORCE);

        log.info("Processing bulletin import task {} since {} (attempt {})", message.getId(), targetDate, message.attemptNumber());

        try {
            var summary = importService.importSince(targetDate, force);
            return TaskExecutionResult.success(summary.toResultData());
        } catch (Exception e) {
            log.error("Bulletin import task {} failed: {}", message.getId(), e.getMessage());
            return TaskExecutionResult.failure(e);
        }
    }
}
