package com.example.spimex.exception;

import lombok.Getter;

/**
 * The relational store could not be reached within the configured number of attempts.
 * Fatal for the API process: migrations and serving never start.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final int attempts;

    public StoreUnavailableException(int attempts, Throwable cause) {
        super(String.format("Store unreachable after %d attempts: %s", attempts, cause.getMessage()), cause);
        this.attempts = attempts;
    }
}
