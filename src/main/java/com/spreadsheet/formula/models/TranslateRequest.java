package com.spreadsheet.formula.models;

/**
 * Body of POST /formula/translate: a formula and the paste offset to shift it by.
 */
public class TranslateRequest {
    private String formula;
    private int rowDelta;
    private int colDelta;

    // Default constructor needed for JSON deserialization
    public TranslateRequest() {
    }

    public TranslateRequest(String formula, int rowDelta, int colDelta) {
        this.formula = formula;
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
    }

    public String getFormula() {
        return formula;
    }
    public int getRowDelta() {
        return rowDelta;
    }
    public int getColDelta() {
        return colDelta;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setRowDelta(int rowDelta) {
        this.rowDelta = rowDelta;
    }
    public void setColDelta(int colDelta) {
        this.colDelta = colDelta;
    }
}
