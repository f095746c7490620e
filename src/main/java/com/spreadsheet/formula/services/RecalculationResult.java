package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.FormulaValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one committed mutation.
 * - updates: the edited cells plus every recalculated cell whose value changed
 * - evaluated: formula cells evaluated, in evaluation order
 * - circular: cells found on a reference cycle
 */
public class RecalculationResult {
    private final Map<String, FormulaValue> updates;
    private final List<String> evaluated;
    private final Set<String> circular;

    public RecalculationResult(Map<String, FormulaValue> updates, List<String> evaluated, Set<String> circular) {
        this.updates = Collections.unmodifiableMap(updates);
        this.evaluated = Collections.unmodifiableList(evaluated);
        this.circular = Collections.unmodifiableSet(circular);
    }

    public Map<String, FormulaValue> getUpdates() {
        return updates;
    }

    public List<String> getEvaluated() {
        return evaluated;
    }

    public Set<String> getCircular() {
        return circular;
    }
}
