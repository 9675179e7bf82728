package com.example.spimex.service.handler;

import com.example.spimex.exception.BulletinParseException;
import com.example.spimex.exception.ExternalServiceException;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of one task execution.
 * <p>
 * Carries what the executor needs to acknowledge, retry or dead-letter the message and to
 * write the execution log.
 */
@Data
@Builder
public class TaskExecutionResult {

    private boolean success;

    private String errorMessage;

    /**
     * Error classification for metrics and analysis
     */
    private String errorType;

    private String stackTrace;

    @Builder.Default
    private Map<String, Object> resultData = new HashMap<>();

    /**
     * Validation errors and malformed bulletins fail the same way on every attempt
     */
    @Builder.Default
    private boolean retryable = true;

    public static TaskExecutionResult success() {
        return TaskExecutionResult.builder().success(true).build();
    }

    public static TaskExecutionResult success(Map<String, Object> resultData) {
        return TaskExecutionResult.builder()
                .success(true)
                .resultData(resultData != null ? resultData : new HashMap<>())
                .build();
    }

    public static TaskExecutionResult failure(String errorMessage, String errorType) {
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(true)
                .build();
    }

    public static TaskExecutionResult permanentFailure(String errorMessage, String errorType) {
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(false)
                .build();
    }

    /**
     * Classify an exception thrown while executing a task
     */
    public static TaskExecutionResult failure(Exception e) {
        var builder = TaskExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .retryable(true);

        if (e instanceof ExternalServiceException external) {
            builder.retryable(external.isRetryable());
            if (external.getHttpStatusCode() != null) {
                builder.errorType("HTTP_" + external.getHttpStatusCode());
            }
        } else if (e instanceof BulletinParseException || e instanceof IllegalArgumentException) {
            builder.retryable(false);
        }

        return builder.build();
    }

    /**
     * Truncate stack trace to keep execution log rows bounded
     */
    private static String truncateStackTrace(Exception e) {
        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }
}
