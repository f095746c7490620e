package com.spreadsheet.formula.models;

/**
 * The addressable area of the grid: columns 1..maxColumns and rows 1..maxRows.
 */
public class GridBounds {

    private final int maxColumns;
    private final int maxRows;

    public GridBounds(int maxColumns, int maxRows) {
        if (maxColumns < 1 || maxRows < 1) {
            throw new IllegalArgumentException("Grid must have at least one row and one column");
        }
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public boolean contains(int column, int row) {
        return column >= 1 && column <= maxColumns && row >= 1 && row <= maxRows;
    }

    @Override
    public String toString() {
        return "GridBounds{" + maxColumns + "x" + maxRows + "}";
    }
}
