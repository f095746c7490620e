package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.CellAddress;

import java.util.Objects;

/**
 * A single-cell reference with independent absolute flags per axis.
 * Column and row are 1-based and may lie outside the grid; that is
 * only checked when the reference is evaluated or translated.
 */
public class CellReference extends AstNode {
    private final int column;
    private final int row;
    private final boolean columnAbsolute;
    private final boolean rowAbsolute;

    public CellReference(int column, int row, boolean columnAbsolute, boolean rowAbsolute) {
        this.column = column;
        this.row = row;
        this.columnAbsolute = columnAbsolute;
        this.rowAbsolute = rowAbsolute;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    /**
     * Storage key of the referenced cell, without absolute markers.
     */
    public String toCellId() {
        return CellAddress.toId(column, row);
    }

    /**
     * Written form, e.g. "$A1".
     */
    public String toReferenceText() {
        return (columnAbsolute ? "$" : "") + CellAddress.columnLetters(column)
                + (rowAbsolute ? "$" : "") + row;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitCellReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return column == that.column && row == that.row
                && columnAbsolute == that.columnAbsolute && rowAbsolute == that.rowAbsolute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row, columnAbsolute, rowAbsolute);
    }

    @Override
    public String toString() {
        return toReferenceText();
    }
}
