package com.spreadsheet.formula.parser.ast;

public class UnaryOp extends AstNode {
    private final Operator operator;
    private final AstNode operand;

    public UnaryOp(Operator operator, AstNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public AstNode getOperand() {
        return operand;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
