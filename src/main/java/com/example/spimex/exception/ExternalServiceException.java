package com.example.spimex.exception;

import lombok.Getter;

/**
 * Exception for external service communication failures
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final boolean retryable;

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, cause.getMessage(), cause);
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String message) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, message));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        // 4xx errors (except 408, 429) are not retryable
        this.retryable = httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
