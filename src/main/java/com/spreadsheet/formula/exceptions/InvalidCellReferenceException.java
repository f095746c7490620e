package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request names a cell id that is malformed
 * or lies outside the grid.
 * For example, "Cell AA1 is outside the grid GridBounds{26x100}".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
