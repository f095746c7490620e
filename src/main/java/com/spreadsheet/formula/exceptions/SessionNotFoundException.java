package com.spreadsheet.formula.exceptions;

/**
 * Thrown when attempting to reach an engine session ID
 * that doesn't exist (or was already closed).
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
