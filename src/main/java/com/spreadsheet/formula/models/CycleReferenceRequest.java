package com.spreadsheet.formula.models;

/**
 * Body of POST /formula/cycle-reference. Without a cursorOffset every reference cycles.
 */
public class CycleReferenceRequest {
    private String formula;
    private Integer cursorOffset;

    // Default constructor needed for JSON deserialization
    public CycleReferenceRequest() {
    }

    public CycleReferenceRequest(String formula, Integer cursorOffset) {
        this.formula = formula;
        this.cursorOffset = cursorOffset;
    }

    public String getFormula() {
        return formula;
    }
    public Integer getCursorOffset() {
        return cursorOffset;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setCursorOffset(Integer cursorOffset) {
        this.cursorOffset = cursorOffset;
    }
}
