package com.spreadsheet.formula.parser;

/**
 * One lexical unit of a formula: its kind, its text and its offset
 * in the tokenized input (the formula without the leading "=").
 * Reference tokens also carry their parsed parts.
 */
public class Token {

    /**
     * The pieces of a written cell reference, e.g. "$B7" -> B, 7, column absolute.
     */
    public static class RefParts {
        private final String columnLetters;
        private final String rowDigits;
        private final boolean columnAbsolute;
        private final boolean rowAbsolute;

        public RefParts(String columnLetters, String rowDigits, boolean columnAbsolute, boolean rowAbsolute) {
            this.columnLetters = columnLetters;
            this.rowDigits = rowDigits;
            this.columnAbsolute = columnAbsolute;
            this.rowAbsolute = rowAbsolute;
        }

        public String getColumnLetters() {
            return columnLetters;
        }

        public String getRowDigits() {
            return rowDigits;
        }

        public boolean isColumnAbsolute() {
            return columnAbsolute;
        }

        public boolean isRowAbsolute() {
            return rowAbsolute;
        }
    }

    private final TokenKind kind;
    private final String text;
    private final int position;
    private final RefParts reference;
    private final RefParts rangeEnd;

    public Token(TokenKind kind, String text, int position) {
        this(kind, text, position, null, null);
    }

    public Token(TokenKind kind, String text, int position, RefParts reference, RefParts rangeEnd) {
        this.kind = kind;
        this.text = text;
        this.position = position;
        this.reference = reference;
        this.rangeEnd = rangeEnd;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Offset just past the last character of this token in the tokenized input.
     * Only meaningful for tokens whose text is the exact source slice (references, identifiers, numbers).
     */
    public int getEndPosition() {
        return position + text.length();
    }

    /**
     * For CELL_REF the reference itself, for RANGE_REF the start endpoint.
     */
    public RefParts getReference() {
        return reference;
    }

    public RefParts getRangeEnd() {
        return rangeEnd;
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + position;
    }
}
