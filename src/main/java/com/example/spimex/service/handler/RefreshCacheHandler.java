package com.example.spimex.service.handler;

import com.example.spimex.broker.TaskMessage;
import com.example.spimex.domain.enums.TaskType;
import com.example.spimex.service.TradingResultsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler that drops every cached read response
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshCacheHandler implements TaskHandler {

    private final TradingResultsCache cache;

    @Override
    public TaskType getTaskType() {
        return TaskType.REFRESH_CACHE;
    }

    @Override
    public TaskExecutionResult execute(TaskMessage message) {
        try {
            cache.evictAll();
            return TaskExecutionResult.success();
        } catch (Exception e) {
            log.error("Cache refresh task {} failed: {}", message.getId(), e.getMessage());
            return TaskExecutionResult.failure(e);
        }
    }
}
