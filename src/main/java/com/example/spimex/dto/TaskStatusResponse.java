package com.example.spimex.dto;

import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Current broker-side status of a task plus its stored execution history
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusResponse {

    private UUID taskId;
    private TaskType taskType;
    private TaskStatus status;

    /**
     * True once the task succeeded or was dead-lettered
     */
    private boolean finished;

    private Integer attempt;
    private String lastError;
    private String result;
    private Instant updatedAt;
    private List<TaskExecutionLogResponse> executionHistory;
}
