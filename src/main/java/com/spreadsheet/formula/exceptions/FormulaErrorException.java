package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.ErrorKind;

/**
 * Thrown inside a function implementation or a coercion to signal
 * a spreadsheet error value (e.g. #VALUE!, #DIV/0!).
 * The evaluator catches it and turns it into the cell's value,
 * so it never crosses the message boundary.
 */
public class FormulaErrorException extends RuntimeException {
    private final ErrorKind errorKind;

    public FormulaErrorException(ErrorKind errorKind) {
        this(errorKind, errorKind.getDescription());
    }

    public FormulaErrorException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
