package com.example.spimex.broker;

import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusRecord {
    private UUID taskId;
    private TaskType taskType;
    private TaskStatus status;
    private int attempt;
    private String lastError;
    private String result;
    private Instant updatedAt;
}
