package com.example.spimex.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * A downloaded bulletin workbook could not be read or lacks the expected section.
 * Never retryable: the same bytes will fail the same way.
 */
@Getter
public class BulletinParseException extends RuntimeException {

    private final LocalDate tradeDate;

    public BulletinParseException(LocalDate tradeDate, String message) {
        super(String.format("Bulletin %s: %s", tradeDate, message));
        this.tradeDate = tradeDate;
    }

    public BulletinParseException(LocalDate tradeDate, String message, Throwable cause) {
        super(String.format("Bulletin %s: %s", tradeDate, message), cause);
        this.tradeDate = tradeDate;
    }
}
