package com.example.spimex.client;

import com.example.spimex.exception.ExternalServiceException;

import java.util.function.Predicate;

/**
 * Retry predicate for outbound calls, referenced from the resilience4j configuration.
 * Client errors such as 403 are final; server errors and I/O failures are retried.
 */
public class RetryableFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException external) {
            return external.isRetryable();
        }
        return true;
    }
}
