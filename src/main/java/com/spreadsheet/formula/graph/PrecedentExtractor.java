package com.spreadsheet.formula.graph;

import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.GridBounds;
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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the cell ids a formula reads, ranges expanded to every cell they cover.
 * References outside the grid are skipped; they evaluate to #REF! and can never change.
 */
public class PrecedentExtractor implements AstVisitor<Void> {

    private final GridBounds bounds;
    private final Set<String> precedents = new LinkedHashSet<>();

    private PrecedentExtractor(GridBounds bounds) {
        this.bounds = bounds;
    }

    public static Set<String> extract(AstNode ast, GridBounds bounds) {
        PrecedentExtractor extractor = new PrecedentExtractor(bounds);
        if (ast != null) {
            ast.accept(extractor);
        }
        return extractor.precedents;
    }

    @Override
    public Void visitLiteral(Literal node) {
        return null;
    }

    @Override
    public Void visitCellReference(CellReference node) {
        if (bounds.contains(node.getColumn(), node.getRow())) {
            precedents.add(node.toCellId());
        }
        return null;
    }

    @Override
    public Void visitRangeReference(RangeReference node) {
        CellReference start = node.getStart();
        CellReference end = node.getEnd();
        if (!bounds.contains(start.getColumn(), start.getRow()) || !bounds.contains(end.getColumn(), end.getRow())) {
            return null;
        }
        for (int row = node.getMinRow(); row <= node.getMaxRow(); row++) {
            for (int column = node.getMinColumn(); column <= node.getMaxColumn(); column++) {
                precedents.add(CellAddress.toId(column, row));
            }
        }
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        return node.getOperand().accept(this);
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        node.getLeft().accept(this);
        return node.getRight().accept(this);
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        for (AstNode argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    @Override
    public Void visitGroup(Group node) {
        return node.getExpression().accept(this);
    }

    @Override
    public Void visitParseFailure(ParseFailure node) {
        return null;
    }
}
