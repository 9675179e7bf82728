package com.example.spimex.service.executor;

import com.example.spimex.broker.RedisTaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Periodic broker housekeeping run by every worker.
 * <p>
 * Runs on all replicas without a lock: each move is decided by a ZREM, so concurrent
 * runs never promote or redeliver the same task twice.
 */
@Slf4j
@Service
@Profile("worker")
@RequiredArgsConstructor
public class QueueMaintenanceService {

    private final RedisTaskQueue taskQueue;

    @Scheduled(fixedDelayString = "${spimex.tasks.promote-interval-ms:5000}")
    public void promoteDueRetries() {
        try {
            taskQueue.promoteDueRetries(Instant.now());
        } catch (DataAccessException e) {
            log.debug("Retry promotion skipped, broker unavailable: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${spimex.tasks.reap-interval-ms:60000}")
    public void requeueExpired() {
        try {
            var requeued = taskQueue.requeueExpired(Instant.now());
            if (requeued > 0) {
                log.warn("Redelivered {} tasks whose worker stopped responding", requeued);
            }
        } catch (DataAccessException e) {
            log.debug("Expired claim check skipped, broker unavailable: {}", e.getMessage());
        }
    }
}
