package com.example.spimex.service.handler;

import com.example.spimex.domain.enums.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for task handlers.
 * <p>
 * Collects every TaskHandler bean and looks them up by task type.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getTaskType();
            var previous = handlers.put(type, handler);
            if (previous != null) {
                log.warn("Duplicate handler for task type {}: {} replaces {}",
                        type, handler.getClass().getSimpleName(), previous.getClass().getSimpleName());
            }
            log.info("Registered handler for task type {}: {}", type, handler.getClass().getSimpleName());
        }

        for (var type : TaskType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No handler registered for task type: {}", type);
            }
        }
    }

    public Optional<TaskHandler> getHandler(TaskType taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    /**
     * @throws IllegalArgumentException if no handler is registered
     */
    public TaskHandler getHandlerOrThrow(TaskType taskType) {
        return getHandler(taskType).orElseThrow(() -> new IllegalArgumentException("No handler registered for task type: " + taskType));
    }

    public boolean hasHandler(TaskType taskType) {
        return handlers.containsKey(taskType);
    }

    public Set<TaskType> getRegisteredTypes() {
        return handlers.keySet();
    }
}
