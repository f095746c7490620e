package com.spreadsheet.formula.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of spreadsheet error values a cell can hold.
 * Each kind maps to exactly one display token, e.g. DIV_ZERO -> "#DIV/0!".
 */
public enum ErrorKind {
    PARSE("#ERROR!", "Malformed formula"),
    NAME("#NAME?", "Unknown function name"),
    VALUE("#VALUE!", "Invalid value type"),
    REF("#REF!", "Invalid reference"),
    DIV_ZERO("#DIV/0!", "Division by zero"),
    CIRCULAR("#CIRCULAR!", "Circular reference"),
    NOT_AVAILABLE("#N/A", "Value not available"),
    NUM("#NUM!", "Invalid number"),
    NULL("#NULL!", "Null range");

    private final String token;
    private final String description;

    ErrorKind(String token, String description) {
        this.token = token;
        this.description = description;
    }

    public String getToken() {
        return token;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Looks up an error kind by its display token (case-insensitive), e.g. "#ref!" -> REF.
     */
    public static Optional<ErrorKind> fromToken(String token) {
        return Arrays.stream(values())
                .filter(kind -> kind.token.equalsIgnoreCase(token))
                .findFirst();
    }
}
