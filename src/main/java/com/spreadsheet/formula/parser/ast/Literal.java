package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

/**
 * A constant: number, string, boolean, or a written error value such as #REF!.
 * Numbers keep their source text so "1.50" prints back as written.
 */
public class Literal extends AstNode {
    private final FormulaValue value;
    private final String sourceText;

    public Literal(FormulaValue value, String sourceText) {
        this.value = value;
        this.sourceText = sourceText;
    }

    public static Literal of(FormulaValue value) {
        return new Literal(value, null);
    }

    public static Literal error(ErrorKind kind) {
        return new Literal(FormulaValue.error(kind), kind.getToken());
    }

    public FormulaValue getValue() {
        return value;
    }

    public String getSourceText() {
        return sourceText;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }
}
