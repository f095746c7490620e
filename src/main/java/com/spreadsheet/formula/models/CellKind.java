package com.spreadsheet.formula.models;

/**
 * What a cell's raw input holds: nothing, a plain literal, or a formula.
 */
public enum CellKind {
    EMPTY,
    LITERAL,
    FORMULA
}
