package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.parser.ast.AstNode;
import com.spreadsheet.formula.parser.ast.AstVisitor;
import com.spreadsheet.formula.parser.ast.BinaryOp;
import com.spreadsheet.formula.parser.ast.CellReference;
import com.spreadsheet.formula.parser.ast.FunctionCall;
import com.spreadsheet.formula.parser.ast.Group;
import com.spreadsheet.formula.parser.ast.Literal;
import com.spreadsheet.formula.parser.ast.ParseFailure;
import com.spreadsheet.formula.parser.ast.RangeReference;
import com.spreadsheet.formula.parser.ast.UnaryOp;

import java.util.stream.Collectors;

/**
 * Renders an AST back to formula text, e.g. "=SUM($A1:B2)*2".
 * Whitespace is not preserved; parentheses are, through Group nodes.
 */
public class FormulaPrinter implements AstVisitor<String> {

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    public static String print(AstNode ast) {
        return "=" + ast.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(Literal node) {
        if (node.getSourceText() != null) {
            return node.getSourceText();
        }
        FormulaValue value = node.getValue();
        if (value.isString()) {
            return '"' + value.getText().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return value.toDisplayString();
    }

    @Override
    public String visitCellReference(CellReference node) {
        return node.toReferenceText();
    }

    @Override
    public String visitRangeReference(RangeReference node) {
        return node.toReferenceText();
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return node.getOperator().getSymbol() + node.getOperand().accept(this);
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return node.getLeft().accept(this) + node.getOperator().getSymbol() + node.getRight().accept(this);
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        return node.getName() + "("
                + node.getArguments().stream().map(arg -> arg.accept(this)).collect(Collectors.joining(","))
                + ")";
    }

    @Override
    public String visitGroup(Group node) {
        return "(" + node.getExpression().accept(this) + ")";
    }

    @Override
    public String visitParseFailure(ParseFailure node) {
        throw new IllegalArgumentException("Cannot print a formula that failed to parse: " + node.getMessage());
    }
}
