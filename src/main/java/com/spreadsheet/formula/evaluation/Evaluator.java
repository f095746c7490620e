package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.functions.FunctionDefinition;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.GridBounds;
import com.spreadsheet.formula.parser.ast.AstNode;
import com.spreadsheet.formula.parser.ast.AstVisitor;
import com.spreadsheet.formula.parser.ast.BinaryOp;
import com.spreadsheet.formula.parser.ast.CellReference;
import com.spreadsheet.formula.parser.ast.FunctionCall;
import com.spreadsheet.formula.parser.ast.Group;
import com.spreadsheet.formula.parser.ast.Literal;
import com.spreadsheet.formula.parser.ast.Operator;
import com.spreadsheet.formula.parser.ast.ParseFailure;
import com.spreadsheet.formula.parser.ast.RangeReference;
import com.spreadsheet.formula.parser.ast.UnaryOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tree-walking evaluator.
 * <p>
 * References read cached values from a {@link CellValueSource}; precedents are never
 * evaluated inline, so callers must evaluate cells in dependency order. Operands and
 * arguments are evaluated left to right, depth first, and the first error met becomes
 * the result of the whole expression.
 */
public class Evaluator {

    private final FunctionRegistry functionRegistry;
    private final GridBounds bounds;

    public Evaluator(FunctionRegistry functionRegistry, GridBounds bounds) {
        this.functionRegistry = functionRegistry;
        this.bounds = bounds;
    }

    /**
     * Evaluates a formula root. Never throws for formula-level problems; they come back
     * as error values. An empty result (e.g. "=A1" on a blank A1) is reported as 0.
     */
    public FormulaValue evaluate(AstNode ast, CellValueSource source) {
        FormulaValue result = ast.accept(new EvaluationVisitor(source));
        if (result.isEmpty()) {
            return FormulaValue.number(0);
        }
        if (result.isRange()) {
            try {
                return TypeCoercion.singleValue(result);
            } catch (FormulaErrorException e) {
                return FormulaValue.error(e.getErrorKind());
            }
        }
        return result;
    }

    private class EvaluationVisitor implements AstVisitor<FormulaValue> {
        private final CellValueSource source;

        EvaluationVisitor(CellValueSource source) {
            this.source = source;
        }

        @Override
        public FormulaValue visitLiteral(Literal node) {
            return node.getValue();
        }

        @Override
        public FormulaValue visitCellReference(CellReference node) {
            if (!bounds.contains(node.getColumn(), node.getRow())) {
                return FormulaValue.error(ErrorKind.REF);
            }
            return source.getValue(node.toCellId());
        }

        @Override
        public FormulaValue visitRangeReference(RangeReference node) {
            // a bare range has no single value
            return FormulaValue.error(ErrorKind.REF);
        }

        @Override
        public FormulaValue visitUnaryOp(UnaryOp node) {
            FormulaValue operand = node.getOperand().accept(this);
            if (operand.isError()) {
                return operand;
            }
            try {
                double number = TypeCoercion.toNumber(operand);
                return numberResult(node.getOperator() == Operator.MINUS ? -number : number);
            } catch (FormulaErrorException e) {
                return FormulaValue.error(e.getErrorKind());
            }
        }

        @Override
        public FormulaValue visitBinaryOp(BinaryOp node) {
            FormulaValue left = node.getLeft().accept(this);
            if (left.isError()) {
                return left;
            }
            FormulaValue right = node.getRight().accept(this);
            if (right.isError()) {
                return right;
            }
            try {
                return apply(node.getOperator(), left, right);
            } catch (FormulaErrorException e) {
                return FormulaValue.error(e.getErrorKind());
            }
        }

        @Override
        public FormulaValue visitFunctionCall(FunctionCall node) {
            FunctionDefinition function = functionRegistry.get(node.getName());
            if (function == null) {
                return FormulaValue.error(ErrorKind.NAME);
            }
            List<FormulaValue> args = new ArrayList<>(node.getArguments().size());
            for (AstNode argument : node.getArguments()) {
                FormulaValue value = argument instanceof RangeReference
                        ? expandRange((RangeReference) argument)
                        : argument.accept(this);
                if (value.isError() && !function.isErrorTolerant()) {
                    return firstRangeError(args).orElse(value);
                }
                args.add(value);
            }
            return function.invoke(args);
        }

        /**
         * An error cell inside an earlier range argument precedes a later argument's error.
         */
        private Optional<FormulaValue> firstRangeError(List<FormulaValue> earlier) {
            for (FormulaValue argument : earlier) {
                if (argument instanceof RangeValue) {
                    for (FormulaValue cell : ((RangeValue) argument).getValues()) {
                        if (cell.isError()) {
                            return Optional.of(cell);
                        }
                    }
                }
            }
            return Optional.empty();
        }

        @Override
        public FormulaValue visitGroup(Group node) {
            return node.getExpression().accept(this);
        }

        @Override
        public FormulaValue visitParseFailure(ParseFailure node) {
            return FormulaValue.error(ErrorKind.PARSE);
        }

        private FormulaValue expandRange(RangeReference range) {
            if (!bounds.contains(range.getStart().getColumn(), range.getStart().getRow())
                    || !bounds.contains(range.getEnd().getColumn(), range.getEnd().getRow())) {
                return FormulaValue.error(ErrorKind.REF);
            }
            int width = range.getMaxColumn() - range.getMinColumn() + 1;
            int height = range.getMaxRow() - range.getMinRow() + 1;
            List<FormulaValue> values = new ArrayList<>(width * height);
            for (int row = range.getMinRow(); row <= range.getMaxRow(); row++) {
                for (int column = range.getMinColumn(); column <= range.getMaxColumn(); column++) {
                    values.add(source.getValue(CellAddress.toId(column, row)));
                }
            }
            return new RangeValue(values, width, height);
        }
    }

    private static FormulaValue apply(Operator operator, FormulaValue left, FormulaValue right) {
        switch (operator) {
            case PLUS:
                return numberResult(TypeCoercion.toNumber(left) + TypeCoercion.toNumber(right));
            case MINUS:
                return numberResult(TypeCoercion.toNumber(left) - TypeCoercion.toNumber(right));
            case MULTIPLY:
                return numberResult(TypeCoercion.toNumber(left) * TypeCoercion.toNumber(right));
            case DIVIDE:
                double dividend = TypeCoercion.toNumber(left);
                double divisor = TypeCoercion.toNumber(right);
                if (divisor == 0) {
                    return FormulaValue.error(ErrorKind.DIV_ZERO);
                }
                return numberResult(dividend / divisor);
            case POWER:
                double base = TypeCoercion.toNumber(left);
                double exponent = TypeCoercion.toNumber(right);
                if (base == 0 && exponent < 0) {
                    return FormulaValue.error(ErrorKind.DIV_ZERO);
                }
                return numberResult(Math.pow(base, exponent));
            case CONCAT:
                return FormulaValue.string(TypeCoercion.toText(left) + TypeCoercion.toText(right));
            case EQUAL:
                return FormulaValue.bool(TypeCoercion.compare(left, right) == 0);
            case NOT_EQUAL:
                return FormulaValue.bool(TypeCoercion.compare(left, right) != 0);
            case LESS:
                return FormulaValue.bool(TypeCoercion.compare(left, right) < 0);
            case LESS_EQUAL:
                return FormulaValue.bool(TypeCoercion.compare(left, right) <= 0);
            case GREATER:
                return FormulaValue.bool(TypeCoercion.compare(left, right) > 0);
            case GREATER_EQUAL:
                return FormulaValue.bool(TypeCoercion.compare(left, right) >= 0);
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private static FormulaValue numberResult(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return FormulaValue.error(ErrorKind.NUM);
        }
        return FormulaValue.number(value);
    }
}
