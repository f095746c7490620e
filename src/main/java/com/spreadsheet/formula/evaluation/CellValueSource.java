package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.models.FormulaValue;

/**
 * Read access to cached cell values while a formula is evaluated.
 * Implementations never evaluate anything; they return what is already computed.
 */
@FunctionalInterface
public interface CellValueSource {

    /**
     * @param cellId normalized id such as "B7"
     * @return the cached value, or {@link FormulaValue#EMPTY} for a cell never written
     */
    FormulaValue getValue(String cellId);
}
