package com.spreadsheet.formula.models;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable result of evaluating a formula or reading a literal cell.
 * Holds exactly one of: a number, a string, a boolean, an error kind, or nothing (EMPTY).
 */
@JsonSerialize(using = FormulaValueSerializer.class)
public class FormulaValue {

    public static final FormulaValue EMPTY = new FormulaValue(ValueType.EMPTY, 0d, null, false, null);
    public static final FormulaValue TRUE = new FormulaValue(ValueType.BOOLEAN, 0d, null, true, null);
    public static final FormulaValue FALSE = new FormulaValue(ValueType.BOOLEAN, 0d, null, false, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorKind errorKind;

    protected FormulaValue(ValueType type, double number, String text, boolean bool, ErrorKind errorKind) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.errorKind = errorKind;
    }

    public static FormulaValue number(double value) {
        return new FormulaValue(ValueType.NUMBER, value, null, false, null);
    }

    public static FormulaValue string(String value) {
        return new FormulaValue(ValueType.STRING, 0d, value == null ? "" : value, false, null);
    }

    public static FormulaValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FormulaValue error(ErrorKind kind) {
        return new FormulaValue(ValueType.ERROR, 0d, null, false, Objects.requireNonNull(kind));
    }

    public ValueType getType() {
        return type;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBoolean() {
        return bool;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isString() {
        return type == ValueType.STRING;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isRange() {
        return type == ValueType.RANGE;
    }

    /**
     * The text a cell shows for this value: numbers without a trailing ".0",
     * booleans as TRUE/FALSE, errors as their token, empty as "".
     */
    public String toDisplayString() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return errorKind.getToken();
            default:
                return "";
        }
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaValue)) {
            return false;
        }
        FormulaValue other = (FormulaValue) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case STRING:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case ERROR:
                return errorKind == other.errorKind;
            default:
                return type == ValueType.EMPTY;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, errorKind);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return String.valueOf(number);
            case STRING:
                return '"' + text + '"';
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return errorKind.getToken();
            default:
                return type.name();
        }
    }
}
