package com.spreadsheet.formula.parser.ast;

/**
 * Root marker for a formula that could not be parsed.
 * The engine stores it and shows #ERROR! without evaluating anything.
 */
public class ParseFailure extends AstNode {
    private final String message;
    private final int position;

    public ParseFailure(String message, int position) {
        this.message = message;
        this.position = position;
    }

    public String getMessage() {
        return message;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitParseFailure(this);
    }

    @Override
    public String toString() {
        return "ParseFailure{" + message + " at " + position + "}";
    }
}
