package com.spreadsheet.formula.models;

/**
 * Read-only view of one cell as returned by the REST surface:
 * the cell id, what was typed into it and the value it shows.
 */
public class CellView {
    private final String cellId;
    private final String input;
    private final FormulaValue value;

    public CellView(String cellId, String input, FormulaValue value) {
        this.cellId = cellId;
        this.input = input;
        this.value = value;
    }

    public String getCellId() {
        return cellId;
    }

    public String getInput() {
        return input;
    }

    public FormulaValue getValue() {
        return value;
    }
}
