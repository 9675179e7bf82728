package com.example.spimex.exception;

/**
 * Thrown at startup when database connection settings are missing, malformed,
 * or given in two shapes that disagree.
 */
public class InvalidConnectionSettingsException extends RuntimeException {

    public InvalidConnectionSettingsException(String message) {
        super(message);
    }
}
