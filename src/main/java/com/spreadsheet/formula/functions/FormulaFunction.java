package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.FormulaValue;

import java.util.List;

/**
 * A built-in spreadsheet function. Arguments arrive already evaluated, left to right;
 * a range argument arrives as a {@link com.spreadsheet.formula.evaluation.RangeValue}.
 * Implementations signal spreadsheet errors by returning an error value or by throwing
 * {@link com.spreadsheet.formula.exceptions.FormulaErrorException}.
 */
@FunctionalInterface
public interface FormulaFunction {

    FormulaValue apply(List<FormulaValue> args);
}
