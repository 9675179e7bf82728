package com.example.spimex.exception;

/**
 * Exception for queries that need at least one stored trading day
 */
public class TradingDataNotFoundException extends RuntimeException {

    public TradingDataNotFoundException(String message) {
        super(message);
    }
}
