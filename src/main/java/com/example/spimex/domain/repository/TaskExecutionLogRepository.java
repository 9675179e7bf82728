package com.example.spimex.domain.repository;

import com.example.spimex.domain.entity.TaskExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for TaskExecutionLog entity
 */
@Repository
public interface TaskExecutionLogRepository extends JpaRepository<TaskExecutionLog, UUID> {

    /**
     * Find all execution logs for a task, latest attempt first
     */
    List<TaskExecutionLog> findByTaskIdOrderByAttemptNumberDesc(UUID taskId);
}
