package com.example.spimex.startup;

import com.example.spimex.config.ReadinessProperties;
import com.example.spimex.exception.BrokerUnavailableException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Blocks until the broker answers PING.
 * <p>
 * Broker outages are transient for workers and the beat: with the default
 * {@code max-attempts: 0} the gate waits indefinitely, backing off exponentially.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrokerReadinessGate {

    private final StringRedisTemplate redisTemplate;
    private final ReadinessProperties properties;

    public void awaitAvailable() {
        awaitAvailable(() -> true);
    }

    /**
     * Wait for the broker while {@code keepWaiting} holds.
     *
     * @return true once the broker answered, false if waiting was abandoned
     * @throws BrokerUnavailableException when a bounded attempt budget is exhausted
     */
    public boolean awaitAvailable(BooleanSupplier keepWaiting) {
        var attempts = new AtomicInteger();
        var retry = ReadinessRetry.create("broker", properties.getBroker(), e -> keepWaiting.getAsBoolean());

        try {
            Retry.decorateCheckedRunnable(retry, () -> {
                attempts.incrementAndGet();
                ping();
            }).run();
        } catch (Throwable e) {
            if (!keepWaiting.getAsBoolean()) {
                log.info("Stopped waiting for broker after {} attempt(s)", attempts.get());
                return false;
            }
            throw new BrokerUnavailableException("Broker unreachable after " + attempts.get() + " attempts", e);
        }

        if (attempts.get() > 1) {
            log.info("Broker reachable again after {} attempts", attempts.get());
        }
        return true;
    }

    private void ping() {
        var reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new BrokerUnavailableException("Unexpected PING reply: " + reply);
        }
    }
}
