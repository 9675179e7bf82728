package com.example.spimex.config;

import com.example.spimex.broker.RedisTaskQueue;
import com.example.spimex.domain.enums.TaskType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the task pipeline and the bulletin import.
 * <p>
 * Exposes Prometheus metrics for:
 * - Broker queue depths by state
 * - Execution times by task type
 * - Failures, retries and dead-lettered tasks
 * - Imported bulletin rows
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    static final String QUEUE_DEPTH = "spimex_tasks_queue_depth";

    private final MeterRegistry meterRegistry;
    private final RedisTaskQueue taskQueue;

    private final Map<String, AtomicLong> queueDepths = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var state : new String[]{"ready", "processing", "delayed", "dead"}) {
            var depth = new AtomicLong(0);
            queueDepths.put(state, depth);

            Gauge.builder(QUEUE_DEPTH, depth, AtomicLong::get)
                    .tag("state", state)
                    .description("Number of task ids in each broker structure")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh queue depth gauges from the broker
     */
    @Scheduled(fixedDelayString = "${spimex.tasks.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            var depth = taskQueue.depth();
            queueDepths.get("ready").set(depth.getReady());
            queueDepths.get("processing").set(depth.getProcessing());
            queueDepths.get("delayed").set(depth.getDelayed());
            queueDepths.get("dead").set(depth.getDeadLettered());
        } catch (DataAccessException e) {
            log.debug("Queue depth not refreshed, broker unavailable: {}", e.getMessage());
        }
    }

    public Timer.Sample startTaskExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTaskExecution(Timer.Sample sample, TaskType taskType, boolean success) {
        sample.stop(Timer.builder("spimex_task_execution_time")
                .tag("type", taskType.getCode())
                .tag("success", String.valueOf(success))
                .description("Task execution time")
                .register(meterRegistry));
    }

    public void recordTaskFailure(TaskType taskType, String errorType) {
        meterRegistry.counter("spimex_task_failures",
                "type", taskType.getCode(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry(TaskType taskType, int attemptNumber) {
        meterRegistry.counter("spimex_task_retries",
                "type", taskType.getCode(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordDeadLettered(TaskType taskType) {
        meterRegistry.counter("spimex_task_dead_lettered",
                "type", taskType.getCode()
        ).increment();
    }

    public void recordRowsImported(int rows) {
        meterRegistry.counter("spimex_bulletin_rows_imported").increment(rows);
    }
}
