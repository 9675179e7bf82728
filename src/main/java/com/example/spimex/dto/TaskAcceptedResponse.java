package com.example.spimex.dto;

import com.example.spimex.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Returned when a task has been handed to the broker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskAcceptedResponse {

    private UUID taskId;
    private TaskType taskType;
    private Instant enqueuedAt;
}
