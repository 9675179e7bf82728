package com.example.spimex.startup;

import com.example.spimex.config.ReadinessProperties;
import com.example.spimex.exception.StoreUnavailableException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocks until the relational store accepts connections.
 * <p>
 * Gives up after the configured number of attempts; the resulting
 * {@link StoreUnavailableException} is fatal for the calling process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreReadinessGate {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;
    private final ReadinessProperties properties;

    public void awaitReachable() {
        var attempts = new AtomicInteger();
        var retry = ReadinessRetry.create("store", properties.getStore(), e -> true);

        try {
            Retry.decorateCheckedRunnable(retry, () -> {
                attempts.incrementAndGet();
                checkConnection();
            }).run();
        } catch (Throwable e) {
            log.error("Store unreachable after {} attempts", attempts.get());
            throw new StoreUnavailableException(attempts.get(), e);
        }

        log.info("Store reachable after {} attempt(s)", attempts.get());
    }

    private void checkConnection() throws SQLException {
        try (var connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection failed validation");
            }
        }
    }
}
