package com.example.spimex.service.executor;

import com.example.spimex.broker.RedisTaskQueue;
import com.example.spimex.broker.TaskMessage;
import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.enums.TaskType;
import com.example.spimex.startup.BrokerReadinessGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskWorker Tests")
class TaskWorkerTest {

    @Mock
    private RedisTaskQueue taskQueue;

    @Mock
    private TaskExecutorService executorService;

    @Mock
    private BrokerReadinessGate brokerGate;

    private ThreadPoolTaskExecutor workerExecutor;
    private TaskWorker worker;
    private TaskMessage message;

    @BeforeEach
    void setUp() {
        var properties = new TaskQueueProperties();
        properties.setWorkerConcurrency(1);
        properties.setClaimTimeoutSeconds(1);

        workerExecutor = new ThreadPoolTaskExecutor();
        workerExecutor.setCorePoolSize(1);
        workerExecutor.setMaxPoolSize(1);
        workerExecutor.setThreadNamePrefix("test-worker-");
        workerExecutor.initialize();

        worker = new TaskWorker(taskQueue, executorService, brokerGate, properties, workerExecutor);
        message = TaskMessage.create(TaskType.REFRESH_CACHE, Map.of(), 3, "api");
    }

    @AfterEach
    void tearDown() {
        worker.stop();
        workerExecutor.shutdown();
    }

    @Test
    @DisplayName("Should execute claimed messages once the broker is available")
    void shouldExecuteClaimedMessages() {
        var claims = new AtomicInteger();
        when(brokerGate.awaitAvailable(any())).thenReturn(true);
        when(taskQueue.claim(any(Duration.class))).thenAnswer(inv -> {
            if (claims.getAndIncrement() == 0) {
                return Optional.of(message);
            }
            Thread.sleep(10);
            return Optional.empty();
        });

        worker.start();

        assertThat(worker.isRunning()).isTrue();
        verify(executorService, timeout(2000)).execute(message);
    }

    @Test
    @DisplayName("Should go back to waiting for the broker after losing the connection")
    void shouldWaitAgainAfterConnectionLoss() {
        var claims = new AtomicInteger();
        when(brokerGate.awaitAvailable(any())).thenReturn(true);
        when(taskQueue.claim(any(Duration.class))).thenAnswer(inv -> {
            if (claims.getAndIncrement() == 0) {
                throw new RedisConnectionFailureException("Connection reset");
            }
            Thread.sleep(10);
            return Optional.of(message);
        });

        worker.start();

        verify(brokerGate, timeout(2000).atLeast(2)).awaitAvailable(any());
        verify(executorService, timeout(2000).atLeast(1)).execute(message);
    }

    @Test
    @DisplayName("Should stop its loops when the context stops")
    void shouldStopLoops() throws InterruptedException {
        when(brokerGate.awaitAvailable(any())).thenReturn(true);
        when(taskQueue.claim(any(Duration.class))).thenAnswer(inv -> {
            Thread.sleep(10);
            return Optional.empty();
        });

        worker.start();
        verify(taskQueue, timeout(2000).atLeast(1)).claim(any(Duration.class));
        worker.stop();

        assertThat(worker.isRunning()).isFalse();
        verify(taskQueue, atLeast(1)).claim(any(Duration.class));
    }
}
