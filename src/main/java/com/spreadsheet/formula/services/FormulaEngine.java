package com.spreadsheet.formula.services;

import com.spreadsheet.formula.evaluation.CellValueSource;
import com.spreadsheet.formula.evaluation.Evaluator;
import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.graph.DependencyGraph;
import com.spreadsheet.formula.graph.PrecedentExtractor;
import com.spreadsheet.formula.graph.RecalculationPlan;
import com.spreadsheet.formula.models.*;
import com.spreadsheet.formula.parser.Parser;
import com.spreadsheet.formula.parser.ReferenceAdjuster;
import com.spreadsheet.formula.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Owns one sheet's cells and dependency graph and applies edits to them:
 * 1) Normalize the cell id (else throw InvalidCellReferenceException).
 * 2) Snapshot the cell and its edges so the edit can be reverted.
 * 3) Store the new content, re-parse formulas, rebuild the cell's edges.
 * 4) Recalculate the cell and its transitive dependents into a pending buffer.
 * 5) Commit the buffer and report which displayed values changed.
 * Not thread-safe; an {@link com.spreadsheet.formula.worker.EngineWorker} serializes access.
 */
public class FormulaEngine {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEngine.class);

    private final GridBounds bounds;
    private final Evaluator evaluator;
    private final ReferenceAdjuster referenceAdjuster;

    private CellStore store = new CellStore();
    private DependencyGraph graph = new DependencyGraph();

    public FormulaEngine(GridBounds bounds, FunctionRegistry functionRegistry) {
        this.bounds = bounds;
        this.evaluator = new Evaluator(functionRegistry, bounds);
        this.referenceAdjuster = new ReferenceAdjuster(bounds);
    }

    public GridBounds getBounds() {
        return bounds;
    }

    /**
     * Stores a formula (text starting with "=") and recalculates. Text without "=" is
     * stored as a literal. Re-submitting the formula a cell already holds changes nothing.
     */
    public RecalculationResult setFormula(String cellId, String formula) {
        String id = CellAddress.normalize(cellId, bounds);
        if (formula == null || !formula.startsWith("=")) {
            return setCellValue(id, formula);
        }
        CellRecord existing = store.get(id);
        if (existing != null && existing.isFormula() && formula.equals(existing.getRawInput())) {
            Map<String, FormulaValue> updates = new LinkedHashMap<>();
            updates.put(id, existing.getCachedValue());
            return new RecalculationResult(updates, Collections.emptyList(), Collections.emptySet());
        }
        AstNode ast = Parser.parseFormula(formula);
        return commit(id, CellRecord.formula(id, formula, ast), PrecedentExtractor.extract(ast, bounds));
    }

    /**
     * Stores typed input: numbers, TRUE/FALSE or text. Input starting with "=" is a formula;
     * blank input clears the cell.
     */
    public RecalculationResult setCellValue(String cellId, String value) {
        String id = CellAddress.normalize(cellId, bounds);
        if (value != null && value.startsWith("=")) {
            return setFormula(id, value);
        }
        FormulaValue literal = TypeCoercion.parseLiteral(value);
        if (literal.isEmpty()) {
            return clearCell(id);
        }
        return commit(id, CellRecord.literal(id, value, literal), Collections.emptySet());
    }

    /**
     * Empties the cell; formulas reading it now see a blank.
     */
    public RecalculationResult clearCell(String cellId) {
        String id = CellAddress.normalize(cellId, bounds);
        return commit(id, null, Collections.emptySet());
    }

    /**
     * Copies {@code sourceCellId} onto {@code targetCellId}. Formulas have their relative
     * references shifted by the distance between the two cells.
     */
    public RecalculationResult copyCell(String sourceCellId, String targetCellId) {
        CellAddress source = CellAddress.parse(sourceCellId, bounds);
        CellAddress target = CellAddress.parse(targetCellId, bounds);
        CellRecord record = store.get(source.toId());
        if (record == null) {
            return clearCell(target.toId());
        }
        if (!record.isFormula()) {
            return setCellValue(target.toId(), record.getRawInput());
        }
        String translated = referenceAdjuster.translateFormula(record.getRawInput(),
                target.getRow() - source.getRow(), target.getColumn() - source.getColumn());
        return setFormula(target.toId(), translated);
    }

    /**
     * Replaces the whole sheet. The new cells are built aside and swapped in only when
     * every cell id is valid and the full recalculation succeeded.
     */
    public RecalculationResult load(Map<String, String> cells) {
        CellStore previousStore = store;
        DependencyGraph previousGraph = graph;
        store = new CellStore();
        graph = new DependencyGraph();
        try {
            List<String> loaded = new ArrayList<>();
            for (Map.Entry<String, String> entry : cells.entrySet()) {
                String id = CellAddress.normalize(entry.getKey(), bounds);
                String raw = entry.getValue();
                if (raw != null && raw.startsWith("=")) {
                    AstNode ast = Parser.parseFormula(raw);
                    store.put(CellRecord.formula(id, raw, ast));
                    graph.setPrecedents(id, PrecedentExtractor.extract(ast, bounds));
                } else {
                    FormulaValue literal = TypeCoercion.parseLiteral(raw);
                    if (!literal.isEmpty()) {
                        store.put(CellRecord.literal(id, raw, literal));
                    }
                }
                loaded.add(id);
            }
            RecalculationResult result = recalculate(loaded);
            logger.info("Loaded {} cells, {} formulas evaluated", loaded.size(), result.getEvaluated().size());
            return result;
        } catch (RuntimeException | StackOverflowError e) {
            store = previousStore;
            graph = previousGraph;
            throw e;
        }
    }

    // ----------------------------------------------------------------
    // Read-only views
    // ----------------------------------------------------------------

    public FormulaValue getValue(String cellId) {
        return store.getValue(CellAddress.normalize(cellId, bounds));
    }

    public CellView getCell(String cellId) {
        String id = CellAddress.normalize(cellId, bounds);
        CellRecord record = store.get(id);
        if (record == null) {
            return new CellView(id, "", FormulaValue.EMPTY);
        }
        return new CellView(id, record.getRawInput(), record.getCachedValue());
    }

    /**
     * Every non-empty cell with its displayed value, in first-write order.
     */
    public Map<String, FormulaValue> getValues() {
        Map<String, FormulaValue> values = new LinkedHashMap<>();
        for (CellRecord record : store.records()) {
            values.put(record.getCellId(), record.getCachedValue());
        }
        return values;
    }

    public Set<String> getPrecedents(String cellId) {
        return graph.getPrecedents(CellAddress.normalize(cellId, bounds));
    }

    public Set<String> getDependents(String cellId) {
        return graph.getDependents(CellAddress.normalize(cellId, bounds));
    }

    public Map<String, Set<String>> getPrecedentGraph() {
        return copyOf(graph.getPrecedentGraph());
    }

    public Map<String, Set<String>> getDependentGraph() {
        return copyOf(graph.getDependentGraph());
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Writes one cell (null record = clear) and recalculates. Any failure puts the
     * cell record and its edges back exactly as they were before rethrowing.
     */
    private RecalculationResult commit(String cellId, CellRecord record, Set<String> precedents) {
        CellRecord oldRecord = store.get(cellId);
        CellRecord snapshot = oldRecord == null ? null : oldRecord.copy();
        Set<String> oldPrecedents = graph.getPrecedents(cellId);

        try {
            if (record == null) {
                store.remove(cellId);
            } else {
                store.put(record);
            }
            graph.setPrecedents(cellId, precedents);
            return recalculate(Collections.singletonList(cellId));
        } catch (RuntimeException | StackOverflowError e) {
            logger.warn("Reverting {} after failed update: {}", cellId, e.toString());
            store.restore(cellId, snapshot);
            graph.setPrecedents(cellId, oldPrecedents);
            throw e;
        }
    }

    /**
     * Evaluates everything downstream of {@code changed} into a pending buffer and
     * commits it in one step, so a failure half-way leaves no partial values behind.
     */
    private RecalculationResult recalculate(Collection<String> changed) {
        RecalculationPlan plan = graph.planRecalculation(changed);

        Map<String, FormulaValue> pending = new LinkedHashMap<>();
        for (String cell : plan.getCircular()) {
            pending.put(cell, FormulaValue.error(ErrorKind.CIRCULAR));
        }
        CellValueSource source = id -> pending.containsKey(id) ? pending.get(id) : store.getValue(id);

        List<String> evaluated = new ArrayList<>();
        for (String cell : plan.getOrder()) {
            CellRecord record = store.get(cell);
            if (record == null || !record.isFormula()) {
                continue;
            }
            pending.put(cell, evaluator.evaluate(record.getAst(), source));
            evaluated.add(cell);
        }
        if (!plan.getCircular().isEmpty()) {
            logger.debug("Circular references: {}", plan.getCircular());
        }
        logger.debug("Recalculated {} in order {}", changed, evaluated);

        Map<String, FormulaValue> updates = new LinkedHashMap<>();
        for (String cell : changed) {
            updates.put(cell, pending.containsKey(cell) ? pending.get(cell) : store.getValue(cell));
        }
        for (Map.Entry<String, FormulaValue> entry : pending.entrySet()) {
            CellRecord record = store.get(entry.getKey());
            if (record == null) {
                continue;
            }
            FormulaValue previous = record.getCachedValue();
            record.setCachedValue(entry.getValue());
            if (!previous.equals(entry.getValue())) {
                updates.put(entry.getKey(), entry.getValue());
            }
        }
        return new RecalculationResult(updates, evaluated, plan.getCircular());
    }

    private static Map<String, Set<String>> copyOf(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> copy = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            copy.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        return copy;
    }
}
