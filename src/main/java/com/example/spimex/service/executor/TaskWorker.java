package com.example.spimex.service.executor;

import com.example.spimex.broker.RedisTaskQueue;
import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.exception.BrokerUnavailableException;
import com.example.spimex.startup.BrokerReadinessGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumer loops of the worker role.
 * <p>
 * Each loop waits for the broker, then claims and executes messages until the context
 * stops. Losing the broker mid-run sends the loop back to waiting; the message it held
 * stays in the processing list and is redelivered after its visibility timeout.
 */
@Slf4j
@Component
@Profile("worker")
public class TaskWorker implements SmartLifecycle {

    private final RedisTaskQueue taskQueue;
    private final TaskExecutorService executorService;
    private final BrokerReadinessGate brokerGate;
    private final TaskQueueProperties properties;
    private final ThreadPoolTaskExecutor workerExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    public TaskWorker(RedisTaskQueue taskQueue,
                      TaskExecutorService executorService,
                      BrokerReadinessGate brokerGate,
                      TaskQueueProperties properties,
                      @Qualifier("taskWorkerExecutor") ThreadPoolTaskExecutor workerExecutor) {
        this.taskQueue = taskQueue;
        this.executorService = executorService;
        this.brokerGate = brokerGate;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        var concurrency = properties.getWorkerConcurrency();
        stopped = new CountDownLatch(concurrency);
        log.info("Starting {} task consumer loops", concurrency);

        for (var i = 0; i < concurrency; i++) {
            workerExecutor.execute(this::consume);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping task consumer loops");
            try {
                stopped.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    void consume() {
        var timeout = Duration.ofSeconds(properties.getClaimTimeoutSeconds());
        try {
            while (running.get()) {
                try {
                    if (!brokerGate.awaitAvailable(running::get)) {
                        break;
                    }
                } catch (BrokerUnavailableException e) {
                    log.error("{}, waiting again", e.getMessage());
                    continue;
                }
                pollUntilDisconnected(timeout);
            }
        } finally {
            stopped.countDown();
            log.debug("Consumer loop on {} finished", Thread.currentThread().getName());
        }
    }

    private void pollUntilDisconnected(Duration timeout) {
        while (running.get()) {
            try {
                taskQueue.claim(timeout).ifPresent(executorService::execute);
            } catch (DataAccessException e) {
                log.warn("Lost connection to broker: {}", e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Consumer loop error: {}", e.getMessage(), e);
            }
        }
    }
}
