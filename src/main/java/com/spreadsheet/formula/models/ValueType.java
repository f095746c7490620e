package com.spreadsheet.formula.models;

/**
 * Enumerates the runtime types a formula value can take.
 * RANGE only exists while a range is passed into a function;
 * it is never stored as a cell's cached value.
 */
public enum ValueType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    EMPTY,
    RANGE
}
