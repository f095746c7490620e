package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A concrete cell position, 1-based on both axes.
 * Column 1 is "A", column 27 is "AA"; row 1 is "1".
 */
public class CellAddress {

    private static final Pattern CELL_ID_PATTERN = Pattern.compile("^\\$?([A-Z]+)\\$?([0-9]+)$");

    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        this.column = column;
        this.row = row;
    }

    /**
     * Parses a cell id such as "B7" or "$B$7" (absolute markers are ignored)
     * and checks it against the grid.
     */
    public static CellAddress parse(String cellId, GridBounds bounds) {
        if (cellId == null) {
            throw new InvalidCellReferenceException("Cell id is missing");
        }
        Matcher matcher = CELL_ID_PATTERN.matcher(cellId.trim().toUpperCase());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("Not a cell reference: " + cellId);
        }
        int column = columnIndex(matcher.group(1));
        int row = parseRow(matcher.group(2));
        if (!bounds.contains(column, row)) {
            throw new InvalidCellReferenceException("Cell " + cellId + " is outside the grid " + bounds);
        }
        return new CellAddress(column, row);
    }

    /**
     * Normalizes a cell id to its canonical key, e.g. "$b$7" -> "B7".
     */
    public static String normalize(String cellId, GridBounds bounds) {
        return parse(cellId, bounds).toId();
    }

    /**
     * "A" -> 1, "Z" -> 26, "AA" -> 27. Saturates at Integer.MAX_VALUE for absurdly long names.
     */
    public static int columnIndex(String letters) {
        long index = 0;
        for (int i = 0; i < letters.length(); i++) {
            index = index * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
            if (index > Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
        }
        return (int) index;
    }

    /**
     * 1 -> "A", 26 -> "Z", 27 -> "AA".
     */
    public static String columnLetters(int column) {
        StringBuilder letters = new StringBuilder();
        int n = column;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return letters.toString();
    }

    public static int parseRow(String digits) {
        // more than 9 digits can't be a real row
        if (digits.length() > 9) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(digits);
    }

    public static String toId(int column, int row) {
        return columnLetters(column) + row;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public String toId() {
        return toId(column, row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @Override
    public String toString() {
        return toId();
    }
}
