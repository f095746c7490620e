package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.models.ErrorKind;
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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reference arithmetic for copy/paste and the F4 absolute/relative toggle.
 * <p>
 * Translation shifts every relative axis by the paste offset and leaves absolute axes
 * alone. A reference pushed off the grid becomes a #REF! literal; coordinates are never
 * clamped or wrapped.
 */
public class ReferenceAdjuster {

    private final GridBounds bounds;

    public ReferenceAdjuster(GridBounds bounds) {
        this.bounds = bounds;
    }

    /**
     * Returns a copy of {@code ast} with all references shifted by the given offset.
     */
    public AstNode translate(AstNode ast, int rowDelta, int colDelta) {
        return ast.accept(new Translator(rowDelta, colDelta));
    }

    /**
     * Translates formula text, e.g. ("=A1+$B$2", 1, 1) -> "=B2+$B$2".
     * Non-formula text and formulas that do not parse are returned unchanged.
     */
    public String translateFormula(String formula, int rowDelta, int colDelta) {
        if (formula == null || !formula.startsWith("=")) {
            return formula;
        }
        AstNode ast = Parser.parseFormula(formula);
        if (ast instanceof ParseFailure) {
            return formula;
        }
        return FormulaPrinter.print(translate(ast, rowDelta, colDelta));
    }

    /**
     * Next step of the F4 cycle: A1 -> $A$1 -> A$1 -> $A1 -> A1.
     */
    public static CellReference cycleAbsolute(CellReference ref) {
        boolean col = ref.isColumnAbsolute();
        boolean row = ref.isRowAbsolute();
        if (!col && !row) {
            return withFlags(ref, true, true);
        } else if (col && row) {
            return withFlags(ref, false, true);
        } else if (!col) {
            return withFlags(ref, true, false);
        } else {
            return withFlags(ref, false, false);
        }
    }

    /**
     * Cycles a range as one unit: both endpoints take the start endpoint's next state,
     * so "B1:B3" -> "$B$1:$B$3" -> "B$1:B$3" -> "$B1:$B3" -> "B1:B3".
     */
    public static RangeReference cycleAbsolute(RangeReference range) {
        CellReference start = cycleAbsolute(range.getStart());
        CellReference end = withFlags(range.getEnd(), start.isColumnAbsolute(), start.isRowAbsolute());
        return new RangeReference(start, end);
    }

    /**
     * Applies the F4 toggle to formula text. When the cursor sits on (or right after) a
     * reference, only that reference cycles; otherwise every reference in the formula does.
     * Everything outside the reference tokens is kept exactly as written.
     *
     * @param formula      the full formula text including the leading "="
     * @param cursorOffset caret position within {@code formula}
     */
    public String cycleReferenceAt(String formula, int cursorOffset) {
        if (formula == null || !formula.startsWith("=")) {
            return formula;
        }
        List<Token> references = new Tokenizer(formula.substring(1)).tokenize().stream()
                .filter(t -> t.getKind() == TokenKind.CELL_REF || t.getKind() == TokenKind.RANGE_REF)
                .collect(Collectors.toList());

        // token positions are relative to the text after "="
        int caret = cursorOffset - 1;
        List<Token> targets = references.stream()
                .filter(t -> caret >= t.getPosition() && caret <= t.getEndPosition())
                .limit(1)
                .collect(Collectors.toList());
        if (targets.isEmpty()) {
            targets = references;
        }

        StringBuilder result = new StringBuilder(formula);
        // replace right to left so earlier offsets stay valid
        for (int i = targets.size() - 1; i >= 0; i--) {
            Token token = targets.get(i);
            int start = token.getPosition() + 1;
            int end = token.getEndPosition() + 1;
            result.replace(start, end, cycledText(token));
        }
        return result.toString();
    }

    private static String cycledText(Token token) {
        CellReference start = Parser.toReference(token.getReference());
        if (token.getKind() == TokenKind.RANGE_REF) {
            return cycleAbsolute(new RangeReference(start, Parser.toReference(token.getRangeEnd()))).toReferenceText();
        }
        return cycleAbsolute(start).toReferenceText();
    }

    private static CellReference withFlags(CellReference ref, boolean columnAbsolute, boolean rowAbsolute) {
        return new CellReference(ref.getColumn(), ref.getRow(), columnAbsolute, rowAbsolute);
    }

    /**
     * Rebuilds the tree with shifted references.
     */
    private class Translator implements AstVisitor<AstNode> {
        private final int rowDelta;
        private final int colDelta;

        Translator(int rowDelta, int colDelta) {
            this.rowDelta = rowDelta;
            this.colDelta = colDelta;
        }

        private CellReference shift(CellReference ref) {
            int column = ref.isColumnAbsolute() ? ref.getColumn() : ref.getColumn() + colDelta;
            int row = ref.isRowAbsolute() ? ref.getRow() : ref.getRow() + rowDelta;
            if (!bounds.contains(column, row)) {
                return null;
            }
            return new CellReference(column, row, ref.isColumnAbsolute(), ref.isRowAbsolute());
        }

        @Override
        public AstNode visitLiteral(Literal node) {
            return node;
        }

        @Override
        public AstNode visitCellReference(CellReference node) {
            CellReference shifted = shift(node);
            return shifted == null ? Literal.error(ErrorKind.REF) : shifted;
        }

        @Override
        public AstNode visitRangeReference(RangeReference node) {
            CellReference start = shift(node.getStart());
            CellReference end = shift(node.getEnd());
            if (start == null || end == null) {
                return Literal.error(ErrorKind.REF);
            }
            return new RangeReference(start, end);
        }

        @Override
        public AstNode visitUnaryOp(UnaryOp node) {
            return new UnaryOp(node.getOperator(), node.getOperand().accept(this));
        }

        @Override
        public AstNode visitBinaryOp(BinaryOp node) {
            return new BinaryOp(node.getOperator(), node.getLeft().accept(this), node.getRight().accept(this));
        }

        @Override
        public AstNode visitFunctionCall(FunctionCall node) {
            return new FunctionCall(node.getName(), node.getArguments().stream()
                    .map(arg -> arg.accept(this))
                    .collect(Collectors.toList()));
        }

        @Override
        public AstNode visitGroup(Group node) {
            return new Group(node.getExpression().accept(this));
        }

        @Override
        public AstNode visitParseFailure(ParseFailure node) {
            return node;
        }
    }
}
