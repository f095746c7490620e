package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.ValueType;

import java.util.Collections;
import java.util.List;

/**
 * A range argument expanded into its cell values, row-major, with its shape.
 * Only ever handed to function implementations.
 */
public class RangeValue extends FormulaValue {

    private final List<FormulaValue> values;
    private final int width;
    private final int height;

    public RangeValue(List<FormulaValue> values, int width, int height) {
        super(ValueType.RANGE, 0d, null, false, null);
        if (values.size() != width * height) {
            throw new IllegalArgumentException("Range of " + width + "x" + height + " needs "
                    + (width * height) + " values, got " + values.size());
        }
        this.values = Collections.unmodifiableList(values);
        this.width = width;
        this.height = height;
    }

    public List<FormulaValue> getValues() {
        return values;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @param row    0-based row within the range
     * @param column 0-based column within the range
     */
    public FormulaValue get(int row, int column) {
        return values.get(row * width + column);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeValue)) {
            return false;
        }
        RangeValue that = (RangeValue) o;
        return width == that.width && height == that.height && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode() * 31 + width;
    }

    @Override
    public String toString() {
        return "Range" + width + "x" + height + values;
    }
}
