package com.example.spimex.exception;

/**
 * Exception for broker (Redis) communication failures.
 * Transient for worker and beat; surfaced as 503 by the API.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
