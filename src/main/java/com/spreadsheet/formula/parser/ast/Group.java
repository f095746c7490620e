package com.spreadsheet.formula.parser.ast;

/**
 * A parenthesized expression. Kept in the tree so a printed formula
 * shows the parentheses the user wrote.
 */
public class Group extends AstNode {
    private final AstNode expression;

    public Group(AstNode expression) {
        this.expression = expression;
    }

    public AstNode getExpression() {
        return expression;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitGroup(this);
    }
}
