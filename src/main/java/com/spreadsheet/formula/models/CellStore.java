package com.spreadsheet.formula.models;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The authoritative map of cell id -> CellRecord for one engine.
 * Records are created lazily on first write and removed on clear.
 * Not thread-safe: only the owning worker touches it.
 */
public class CellStore {

    // Key format: normalized cell id, e.g. "B7"
    private final Map<String, CellRecord> cells = new LinkedHashMap<>();

    public CellRecord get(String cellId) {
        return cells.get(cellId);
    }

    /**
     * Cached value for a cell, EMPTY when the cell was never written.
     */
    public FormulaValue getValue(String cellId) {
        CellRecord record = cells.get(cellId);
        return record == null ? FormulaValue.EMPTY : record.getCachedValue();
    }

    public void put(CellRecord record) {
        cells.put(record.getCellId(), record);
    }

    public void remove(String cellId) {
        cells.remove(cellId);
    }

    /**
     * Puts back a snapshot taken earlier; a null snapshot means the cell did not exist.
     */
    public void restore(String cellId, CellRecord snapshot) {
        if (snapshot == null) {
            cells.remove(cellId);
        } else {
            cells.put(cellId, snapshot);
        }
    }

    public Collection<CellRecord> records() {
        return cells.values();
    }
}
