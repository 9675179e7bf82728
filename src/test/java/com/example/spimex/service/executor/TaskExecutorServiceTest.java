package com.example.spimex.service.executor;

import com.example.spimex.broker.RedisTaskQueue;
import com.example.spimex.broker.TaskMessage;
import com.example.spimex.broker.TaskStatusStore;
import com.example.spimex.config.MetricsConfig;
import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.entity.TaskExecutionLog;
import com.example.spimex.domain.enums.TaskStatus;
import com.example.spimex.domain.enums.TaskType;
import com.example.spimex.domain.repository.TaskExecutionLogRepository;
import com.example.spimex.service.alert.SlackAlertService;
import com.example.spimex.service.handler.TaskExecutionResult;
import com.example.spimex.service.handler.TaskHandler;
import com.example.spimex.service.handler.TaskHandlerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskExecutorService Tests")
class TaskExecutorServiceTest {

    @Mock
    private RedisTaskQueue taskQueue;

    @Mock
    private TaskStatusStore statusStore;

    @Mock
    private TaskExecutionLogRepository executionLogRepository;

    @Mock
    private TaskHandlerRegistry handlerRegistry;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Spy
    private TaskQueueProperties properties = new TaskQueueProperties();

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> heartbeat;

    @InjectMocks
    private TaskExecutorService taskExecutorService;

    @Captor
    private ArgumentCaptor<TaskMessage> messageCaptor;

    @Captor
    private ArgumentCaptor<TaskExecutionLog> logCaptor;

    private TaskMessage message;
    private TaskHandler handler;
    private Timer.Sample timerSample;

    @BeforeEach
    void setUp() {
        message = TaskMessage.create(TaskType.IMPORT_BULLETINS, Map.of("targetDate", "2024-03-15"), 3, "beat");
        handler = mock(TaskHandler.class);
        timerSample = mock(Timer.Sample.class);
        lenient().doReturn(heartbeat).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Nested
    @DisplayName("execute Tests")
    class ExecuteTests {

        @Test
        @DisplayName("Should acknowledge and record a successful task")
        void shouldExecuteTaskSuccessfully() {
            // Given
            when(metricsConfig.startTaskExecutionTimer()).thenReturn(timerSample);
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.success(Map.of("rowsWritten", 3)));

            // When
            boolean result = taskExecutorService.execute(message);

            // Then
            assertThat(result).isTrue();
            verify(statusStore).record(message, TaskStatus.RUNNING);
            verify(statusStore).markCompleted(eq(message.getId()), anyString());
            verify(taskQueue).acknowledge(message);
            verify(statusStore).record(eq(message), eq(TaskStatus.SUCCEEDED), isNull(), contains("rowsWritten"));
            verify(metricsConfig).recordTaskExecution(timerSample, TaskType.IMPORT_BULLETINS, true);

            verify(executionLogRepository).save(logCaptor.capture());
            var executionLog = logCaptor.getValue();
            assertThat(executionLog.getTaskId()).isEqualTo(message.getId());
            assertThat(executionLog.getAttemptNumber()).isEqualTo(1);
            assertThat(executionLog.getSuccess()).isTrue();
            assertThat(executionLog.getPayload())
                    .containsEntry("origin", "beat")
                    .containsEntry(TaskExecutionLog.MAX_RETRIES, 3)
                    .doesNotContainKey(TaskExecutionLog.RETRYABLE);
        }

        @Test
        @DisplayName("Should acknowledge a duplicate delivery without running it")
        void shouldSkipCompletedTask() {
            when(statusStore.isCompleted(message.getId())).thenReturn(true);

            boolean result = taskExecutorService.execute(message);

            assertThat(result).isTrue();
            verify(taskQueue).acknowledge(message);
            verify(handlerRegistry, never()).getHandlerOrThrow(any());
            verify(executionLogRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should schedule a retry with backoff for a retryable failure")
        void shouldScheduleRetry() {
            // Given
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.failure("HTTP 503", "HTTP_503"));
            when(handler.calculateNextRetryDelayMs(eq(message), anyLong(), anyLong())).thenReturn(60_000L);

            // When
            boolean result = taskExecutorService.execute(message);

            // Then
            assertThat(result).isFalse();
            verify(taskQueue).scheduleRetry(messageCaptor.capture(), eq(Duration.ofMillis(60_000)));
            var retry = messageCaptor.getValue();
            assertThat(retry.getAttempt()).isEqualTo(1);
            assertThat(retry.getLastError()).isEqualTo("HTTP 503");
            verify(statusStore).record(retry, TaskStatus.RETRY_PENDING, "HTTP 503", null);
            verify(metricsConfig).recordRetry(TaskType.IMPORT_BULLETINS, 1);
            verify(taskQueue, never()).deadLetter(any());
            verify(taskQueue, never()).acknowledge(any());
        }

        @Test
        @DisplayName("Should extend the claim while the handler runs and stop afterwards")
        void shouldExtendClaimWhileRunning() {
            // Given
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.success());

            // When
            taskExecutorService.execute(message);

            // Then
            var tick = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).scheduleAtFixedRate(tick.capture(), any(Instant.class), eq(Duration.ofMinutes(10)));
            verify(heartbeat).cancel(false);

            tick.getValue().run();
            verify(taskQueue).extendClaim(message);
        }

        @Test
        @DisplayName("Should keep the heartbeat alive when the broker rejects an extension")
        void shouldTolerateFailedExtension() {
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.success());
            when(taskQueue.extendClaim(message)).thenThrow(new RedisConnectionFailureException("broker down"));

            taskExecutorService.execute(message);

            var tick = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).scheduleAtFixedRate(tick.capture(), any(Instant.class), any(Duration.class));
            tick.getValue().run();
            verify(taskQueue).extendClaim(message);
        }

        @Test
        @DisplayName("Should stop the heartbeat when the handler throws")
        void shouldCancelHeartbeatOnHandlerError() {
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenThrow(new IllegalStateException("boom"));
            when(handler.calculateNextRetryDelayMs(eq(message), anyLong(), anyLong())).thenReturn(60_000L);

            taskExecutorService.execute(message);

            verify(heartbeat).cancel(false);
            verify(taskQueue).scheduleRetry(any(TaskMessage.class), eq(Duration.ofMillis(60_000)));
        }

        @Test
        @DisplayName("Should dead-letter and alert when attempts are exhausted")
        void shouldDeadLetterWhenAttemptsExhausted() {
            // Given
            var lastAttempt = message.nextAttempt("e1").nextAttempt("e2");
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(lastAttempt)).thenReturn(TaskExecutionResult.failure("HTTP 503", "HTTP_503"));

            // When
            taskExecutorService.execute(lastAttempt);

            // Then
            verify(taskQueue).deadLetter(messageCaptor.capture());
            var failed = messageCaptor.getValue();
            assertThat(failed.getAttempt()).isEqualTo(3);
            verify(statusStore).record(failed, TaskStatus.FAILED, "HTTP 503", null);
            verify(metricsConfig).recordDeadLettered(TaskType.IMPORT_BULLETINS);
            verify(slackAlertService).sendDeadLetterAlert(failed, "HTTP_503");
            verify(taskQueue, never()).scheduleRetry(any(), any());
        }

        @Test
        @DisplayName("Should dead-letter a non-retryable failure on the first attempt")
        void shouldDeadLetterPermanentFailure() {
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.permanentFailure("unreadable workbook", "BulletinParseException"));

            taskExecutorService.execute(message);

            verify(taskQueue).deadLetter(any(TaskMessage.class));
            verify(metricsConfig).recordTaskFailure(TaskType.IMPORT_BULLETINS, "BulletinParseException");
            verify(executionLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().getPayload()).containsEntry(TaskExecutionLog.RETRYABLE, false);
            verify(taskQueue, never()).scheduleRetry(any(), any());
        }

        @Test
        @DisplayName("Should dead-letter a message that fails validation without executing it")
        void shouldDeadLetterInvalidMessage() {
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            doThrow(new IllegalArgumentException("targetDate is required")).when(handler).validate(message);

            taskExecutorService.execute(message);

            verify(handler, never()).execute(any());
            verify(slackAlertService).sendDeadLetterAlert(any(TaskMessage.class), eq("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Should settle the message even when the execution log cannot be stored")
        void shouldTolerateStoreOutage() {
            when(handlerRegistry.getHandlerOrThrow(TaskType.IMPORT_BULLETINS)).thenReturn(handler);
            when(handler.execute(message)).thenReturn(TaskExecutionResult.success());
            when(executionLogRepository.save(any())).thenThrow(new CannotCreateTransactionException("store down"));

            boolean result = taskExecutorService.execute(message);

            assertThat(result).isTrue();
            verify(taskQueue).acknowledge(message);
        }
    }
}
