package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluation.RangeValue;
import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers shared by the built-in function libraries.
 */
final class FunctionSupport {

    private static final Pattern CRITERIA = Pattern.compile("^(>=|<=|<>|>|<|=)(.*)$", Pattern.DOTALL);

    private FunctionSupport() {
    }

    /**
     * Expands range arguments into their cells, in argument order then row-major.
     *
     * @throws FormulaErrorException with the kind of the first error cell met
     */
    static List<FormulaValue> flatten(List<FormulaValue> args) {
        List<FormulaValue> values = new ArrayList<>();
        for (FormulaValue arg : args) {
            if (arg.isRange()) {
                values.addAll(((RangeValue) arg).getValues());
            } else {
                values.add(arg);
            }
        }
        for (FormulaValue value : values) {
            if (value.isError()) {
                throw new FormulaErrorException(value.getErrorKind());
            }
        }
        return values;
    }

    /**
     * Views any argument as a range; a scalar becomes a 1x1 range.
     */
    static RangeValue asRange(FormulaValue value) {
        if (value.isRange()) {
            return (RangeValue) value;
        }
        return new RangeValue(Collections.singletonList(value), 1, 1);
    }

    /**
     * True for numbers and for non-empty text that reads as a number.
     */
    static boolean isNumeric(FormulaValue value) {
        if (value.isNumber()) {
            return true;
        }
        return value.isString() && TypeCoercion.isNumeric(value.getText().trim());
    }

    static FormulaValue scalar(FormulaValue value) {
        return TypeCoercion.singleValue(value);
    }

    static double number(FormulaValue value) {
        return TypeCoercion.toNumber(value);
    }

    static String text(FormulaValue value) {
        return TypeCoercion.toText(value);
    }

    /**
     * Numeric argument truncated toward negative infinity, as spreadsheet positions are.
     */
    static int integer(FormulaValue value) {
        double number = TypeCoercion.toNumber(value);
        if (number >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (number <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) Math.floor(number);
    }

    static FormulaValue optional(List<FormulaValue> args, int index, FormulaValue fallback) {
        return index < args.size() ? args.get(index) : fallback;
    }

    /**
     * Lookup equality: blanks equal "", text is case-insensitive, numbers and numeric
     * text compare by value, anything else by display text.
     */
    static boolean valuesEqual(FormulaValue a, FormulaValue b) {
        FormulaValue left = a.isEmpty() ? FormulaValue.string("") : a;
        FormulaValue right = b.isEmpty() ? FormulaValue.string("") : b;
        if (left.getType() == right.getType()) {
            if (left.isString()) {
                return left.getText().equalsIgnoreCase(right.getText());
            }
            return left.equals(right);
        }
        if (isNumeric(left) && isNumeric(right)) {
            return TypeCoercion.toNumber(left) == TypeCoercion.toNumber(right);
        }
        return left.toDisplayString().equalsIgnoreCase(right.toDisplayString());
    }

    /**
     * Builds the cell test used by SUMIF and COUNTIF. Numbers and booleans match by
     * value; text criteria may start with a comparison operator (">10", "<>apple"),
     * otherwise they match case-insensitively.
     */
    static Predicate<FormulaValue> criteria(FormulaValue criteria) {
        FormulaValue single = scalar(criteria);
        if (single.isNumber() || single.isBoolean()) {
            double expected = TypeCoercion.toNumber(single);
            return value -> !value.isError() && TypeCoercion.toNumberOrZero(value) == expected;
        }
        String criteriaText = text(single);
        Matcher matcher = CRITERIA.matcher(criteriaText);
        if (!matcher.matches()) {
            return value -> !value.isError() && value.toDisplayString().equalsIgnoreCase(criteriaText);
        }
        String operator = matcher.group(1);
        String operand = matcher.group(2).trim();
        if (TypeCoercion.isNumeric(operand)) {
            double expected = Double.parseDouble(operand);
            return value -> isNumeric(value) && compareWith(operator, Double.compare(number(value), expected));
        }
        String lowerOperand = operand.toLowerCase(Locale.ROOT);
        return value -> !value.isError()
                && compareWith(operator, value.toDisplayString().toLowerCase(Locale.ROOT).compareTo(lowerOperand));
    }

    private static boolean compareWith(String operator, int comparison) {
        switch (operator) {
            case ">":
                return comparison > 0;
            case "<":
                return comparison < 0;
            case ">=":
                return comparison >= 0;
            case "<=":
                return comparison <= 0;
            case "<>":
                return comparison != 0;
            default:
                return comparison == 0;
        }
    }

    static FormulaErrorException error(ErrorKind kind, String message) {
        return new FormulaErrorException(kind, message);
    }
}
