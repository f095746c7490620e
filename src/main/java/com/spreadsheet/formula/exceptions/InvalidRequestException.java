package com.spreadsheet.formula.exceptions;

/**
 * Thrown when an engine request is structurally wrong:
 * unknown message type, or a payload field that is missing or of the wrong type.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
