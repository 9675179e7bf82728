package com.example.spimex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for one execution attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionLogResponse {

    private UUID id;
    private UUID taskId;
    private String taskType;
    private Integer attemptNumber;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Boolean success;
    private String errorMessage;
    private String errorType;
    private Map<String, Object> result;
}
