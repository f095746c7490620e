package com.spreadsheet.formula.parser.ast;

public class BinaryOp extends AstNode {
    private final Operator operator;
    private final AstNode left;
    private final AstNode right;

    public BinaryOp(Operator operator, AstNode left, AstNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public AstNode getLeft() {
        return left;
    }

    public AstNode getRight() {
        return right;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
