package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.ValueType;

import java.util.regex.Pattern;

/**
 * Spreadsheet conversions between numbers, strings and booleans.
 * <p>
 * Cross-type ordering used by comparisons is fixed: every number is less than every
 * string, and every string is less than every boolean. Strings compare case-insensitively.
 * An empty cell compares as the other operand's zero value (0, "" or FALSE).
 */
public final class TypeCoercion {

    private static final Pattern NUMERIC = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private TypeCoercion() {
    }

    /**
     * Strict numeric conversion used by arithmetic operators.
     *
     * @throws FormulaErrorException #VALUE! for non-numeric text, or the value's own error
     */
    public static double toNumber(FormulaValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBoolean() ? 1 : 0;
            case EMPTY:
                return 0;
            case STRING:
                String text = value.getText().trim();
                if (text.isEmpty()) {
                    return 0;
                }
                if (isNumeric(text)) {
                    return Double.parseDouble(text);
                }
                throw new FormulaErrorException(ErrorKind.VALUE, "Expected a number, got text: " + value.getText());
            case ERROR:
                throw new FormulaErrorException(value.getErrorKind());
            default:
                return toNumber(singleValue(value));
        }
    }

    /**
     * Lenient conversion used by aggregates: text that is not a number counts as 0.
     */
    public static double toNumberOrZero(FormulaValue value) {
        if (value.isString() && !isNumeric(value.getText().trim())) {
            return 0;
        }
        return toNumber(value);
    }

    /**
     * Display-string conversion used by "&amp;" and text functions.
     */
    public static String toText(FormulaValue value) {
        if (value.isError()) {
            throw new FormulaErrorException(value.getErrorKind());
        }
        if (value.isRange()) {
            return toText(singleValue(value));
        }
        return value.toDisplayString();
    }

    /**
     * Numbers are true when non-zero; "TRUE"/"FALSE" text maps to the boolean;
     * any other non-empty text is true.
     */
    public static boolean toBoolean(FormulaValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0;
            case EMPTY:
                return false;
            case STRING:
                String text = value.getText().trim();
                if (text.equalsIgnoreCase("TRUE")) {
                    return true;
                }
                if (text.equalsIgnoreCase("FALSE")) {
                    return false;
                }
                return !text.isEmpty();
            case ERROR:
                throw new FormulaErrorException(value.getErrorKind());
            default:
                return toBoolean(singleValue(value));
        }
    }

    public static boolean isNumeric(String text) {
        return text != null && NUMERIC.matcher(text).matches();
    }

    /**
     * Total order over non-error values, see class comment.
     *
     * @return negative, zero or positive like {@link Comparable#compareTo}
     */
    public static int compare(FormulaValue left, FormulaValue right) {
        FormulaValue a = left.isEmpty() ? zeroLike(right) : left;
        FormulaValue b = right.isEmpty() ? zeroLike(left) : right;

        int rankA = typeRank(a.getType());
        int rankB = typeRank(b.getType());
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (a.getType()) {
            case NUMBER:
                return Double.compare(a.getNumber(), b.getNumber());
            case STRING:
                return a.getText().compareToIgnoreCase(b.getText());
            case BOOLEAN:
                return Boolean.compare(a.getBoolean(), b.getBoolean());
            default:
                return 0;
        }
    }

    /**
     * Interprets typed (non-formula) cell input: numbers, TRUE/FALSE, otherwise text.
     * Blank input means an empty cell.
     */
    public static FormulaValue parseLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return FormulaValue.EMPTY;
        }
        String trimmed = input.trim();
        if (isNumeric(trimmed)) {
            return FormulaValue.number(Double.parseDouble(trimmed));
        }
        if (trimmed.equalsIgnoreCase("TRUE") || trimmed.equalsIgnoreCase("FALSE")) {
            return FormulaValue.bool(trimmed.equalsIgnoreCase("TRUE"));
        }
        return FormulaValue.string(input);
    }

    /**
     * A 1x1 range used where a single value is expected; larger ranges are #VALUE!.
     */
    public static FormulaValue singleValue(FormulaValue value) {
        if (!value.isRange()) {
            return value;
        }
        RangeValue range = (RangeValue) value;
        if (range.size() == 1) {
            return range.getValues().get(0);
        }
        throw new FormulaErrorException(ErrorKind.VALUE, "Expected a single value but got a range");
    }

    private static FormulaValue zeroLike(FormulaValue other) {
        switch (other.getType()) {
            case STRING:
                return FormulaValue.string("");
            case BOOLEAN:
                return FormulaValue.FALSE;
            default:
                return FormulaValue.number(0);
        }
    }

    private static int typeRank(ValueType type) {
        switch (type) {
            case NUMBER:
                return 0;
            case STRING:
                return 1;
            case BOOLEAN:
                return 2;
            default:
                return 3;
        }
    }
}
