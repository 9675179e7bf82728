package com.example.spimex.startup;

import com.example.spimex.config.ReadinessProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * Builds the exponential-backoff retries used by the readiness gates.
 */
@Slf4j
final class ReadinessRetry {

    private ReadinessRetry() {
    }

    static Retry create(String name, ReadinessProperties.Backoff backoff, Predicate<Throwable> retryOn) {
        var config = RetryConfig.custom()
                .maxAttempts(backoff.effectiveMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        backoff.getInitialInterval(), backoff.getMultiplier(), backoff.getMaxInterval()))
                .retryOnException(retryOn)
                .failAfterMaxAttempts(false)
                .build();

        var retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} not reachable (attempt {}), next try in {}: {}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
