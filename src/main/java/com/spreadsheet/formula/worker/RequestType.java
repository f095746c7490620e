package com.spreadsheet.formula.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message types a client may send to an engine worker.
 * UNKNOWN stands for anything else, which the worker answers with an error message.
 */
public enum RequestType {
    LOAD("load"),
    SET_FORMULA("setFormula"),
    SET_CELL_VALUE("setCellValue"),
    CLEAR_CELL("clearCell"),
    COPY_CELL("copyCell"),
    UNKNOWN("unknown");

    private final String wireName;

    RequestType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Allows case-insensitive JSON input.
     * For example, "setFormula", "SETFORMULA" and "set_formula" all map to SET_FORMULA.
     */
    @JsonCreator
    public static RequestType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (RequestType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
