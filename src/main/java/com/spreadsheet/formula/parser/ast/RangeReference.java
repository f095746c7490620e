package com.spreadsheet.formula.parser.ast;

import java.util.Objects;

/**
 * A rectangular range "start:end". The endpoints keep their written order;
 * min/max normalization happens only when the range is expanded.
 */
public class RangeReference extends AstNode {
    private final CellReference start;
    private final CellReference end;

    public RangeReference(CellReference start, CellReference end) {
        this.start = start;
        this.end = end;
    }

    public CellReference getStart() {
        return start;
    }

    public CellReference getEnd() {
        return end;
    }

    public int getMinColumn() {
        return Math.min(start.getColumn(), end.getColumn());
    }

    public int getMaxColumn() {
        return Math.max(start.getColumn(), end.getColumn());
    }

    public int getMinRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getMaxRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public String toReferenceText() {
        return start.toReferenceText() + ":" + end.toReferenceText();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitRangeReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeReference)) {
            return false;
        }
        RangeReference that = (RangeReference) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return toReferenceText();
    }
}
