package com.example.spimex.service.handler;

import com.example.spimex.broker.TaskMessage;
import com.example.spimex.domain.enums.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskHandlerRegistry Tests")
class TaskHandlerRegistryTest {

    private TaskHandlerRegistry registry;

    private final TaskHandler importHandler = new TaskHandler() {
        @Override
        public TaskType getTaskType() {
            return TaskType.IMPORT_BULLETINS;
        }

        @Override
        public TaskExecutionResult execute(TaskMessage message) {
            return TaskExecutionResult.success();
        }
    };

    @BeforeEach
    void setUp() {
        registry = new TaskHandlerRegistry(List.of(importHandler));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register and retrieve handlers")
    void shouldRegisterAndRetrieveHandlers() {
        assertThat(registry.getHandler(TaskType.IMPORT_BULLETINS)).containsSame(importHandler);
        assertThat(registry.hasHandler(TaskType.IMPORT_BULLETINS)).isTrue();
        assertThat(registry.getRegisteredTypes()).containsExactly(TaskType.IMPORT_BULLETINS);
    }

    @Test
    @DisplayName("Should return empty for unregistered type")
    void shouldReturnEmptyForUnregisteredType() {
        assertThat(registry.getHandler(TaskType.REFRESH_CACHE)).isEmpty();
        assertThat(registry.hasHandler(TaskType.REFRESH_CACHE)).isFalse();
    }

    @Test
    @DisplayName("Should throw for unregistered type when using getHandlerOrThrow")
    void shouldThrowForUnregisteredType() {
        assertThatThrownBy(() -> registry.getHandlerOrThrow(TaskType.REFRESH_CACHE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No handler registered");
    }

    @Test
    @DisplayName("Should reject a message of another type in default validation")
    void shouldRejectForeignMessage() {
        var message = TaskMessage.create(TaskType.REFRESH_CACHE, Map.of(), 1, "api");

        assertThatThrownBy(() -> importHandler.validate(message))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should double the retry delay per attempt up to the cap")
    void shouldCalculateRetryDelay() {
        var message = TaskMessage.create(TaskType.IMPORT_BULLETINS, Map.of(), 10, "api");

        assertThat(importHandler.calculateNextRetryDelayMs(message, 1000, 60_000)).isEqualTo(1000);
        var third = message.nextAttempt("x").nextAttempt("x");
        assertThat(importHandler.calculateNextRetryDelayMs(third, 1000, 60_000)).isEqualTo(4000);
        var late = third.toBuilder().attempt(12).build();
        assertThat(importHandler.calculateNextRetryDelayMs(late, 1000, 60_000)).isEqualTo(60_000);
    }
}
