package com.spreadsheet.formula.models;

import com.spreadsheet.formula.parser.ast.AstNode;

/**
 * Represents a single spreadsheet cell as the engine stores it.
 * Stores:
 * - the normalized cell id ("B7")
 * - rawInput (literal text or "=..." formula, as typed)
 * - kind (empty, literal or formula)
 * - ast (only for formulas; a ParseFailure root for malformed ones)
 * - cachedValue (the last computed result)
 */
public class CellRecord {
    private final String cellId;
    private String rawInput;
    private CellKind kind;
    private AstNode ast;
    private FormulaValue cachedValue = FormulaValue.EMPTY;

    public CellRecord(String cellId) {
        this.cellId = cellId;
        this.kind = CellKind.EMPTY;
        this.rawInput = "";
    }

    public static CellRecord literal(String cellId, String rawInput, FormulaValue value) {
        CellRecord record = new CellRecord(cellId);
        record.rawInput = rawInput;
        record.kind = value.isEmpty() ? CellKind.EMPTY : CellKind.LITERAL;
        record.cachedValue = value;
        return record;
    }

    public static CellRecord formula(String cellId, String rawInput, AstNode ast) {
        CellRecord record = new CellRecord(cellId);
        record.rawInput = rawInput;
        record.kind = CellKind.FORMULA;
        record.ast = ast;
        return record;
    }

    /**
     * Copy used to restore the cell if a request fails half-way.
     */
    public CellRecord copy() {
        CellRecord copy = new CellRecord(cellId);
        copy.rawInput = rawInput;
        copy.kind = kind;
        copy.ast = ast;
        copy.cachedValue = cachedValue;
        return copy;
    }

    public String getCellId() {
        return cellId;
    }

    public String getRawInput() {
        return rawInput;
    }

    public CellKind getKind() {
        return kind;
    }

    public boolean isFormula() {
        return kind == CellKind.FORMULA;
    }

    public AstNode getAst() {
        return ast;
    }

    public FormulaValue getCachedValue() {
        return cachedValue;
    }

    public void setCachedValue(FormulaValue cachedValue) {
        this.cachedValue = cachedValue;
    }

    public ValueType getValueType() {
        return cachedValue.getType();
    }

    public ErrorKind getErrorKind() {
        return cachedValue.getErrorKind();
    }
}
