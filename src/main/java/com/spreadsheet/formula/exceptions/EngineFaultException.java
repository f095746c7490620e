package com.spreadsheet.formula.exceptions;

/**
 * Wraps an unexpected failure inside an engine worker,
 * or a worker that did not answer in time.
 */
public class EngineFaultException extends RuntimeException {
    public EngineFaultException(String message) {
        super(message);
    }

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
