package com.spreadsheet.formula.worker;

import com.spreadsheet.formula.exceptions.EngineFaultException;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.exceptions.InvalidRequestException;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.services.FormulaEngine;
import com.spreadsheet.formula.services.RecalculationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Runs one {@link FormulaEngine} on its own single thread. Requests are processed one
 * at a time, each to completion (recalculation included) before the next starts, so the
 * engine is never touched concurrently. A ready message is emitted once, before any
 * response. Faults inside a request become error messages; the worker stays alive.
 */
public class EngineWorker {

    private static final Logger logger = LoggerFactory.getLogger(EngineWorker.class);

    private final long sessionId;
    private final FormulaEngine engine;
    private final MessageSink sink;
    private final ExecutorService executor;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();

    public EngineWorker(long sessionId, FormulaEngine engine, MessageSink sink) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.sink = sink;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "formula-engine-" + sessionId);
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(() -> {
            emit(EngineMessage.ready());
            ready.complete(null);
        });
    }

    public long getSessionId() {
        return sessionId;
    }

    /**
     * Completes once the ready message has been emitted.
     */
    public CompletableFuture<Void> whenReady() {
        return ready;
    }

    /**
     * Queues a request. The future completes with the messages emitted for it,
     * in order; it never completes exceptionally for faults inside the request.
     */
    public CompletableFuture<List<EngineMessage>> submit(EngineRequest request) {
        return CompletableFuture.supplyAsync(() -> handle(request), executor);
    }

    /**
     * Runs a read against the engine on the worker thread, after every request queued before it.
     */
    public <T> CompletableFuture<T> query(Function<FormulaEngine, T> reader) {
        return CompletableFuture.supplyAsync(() -> reader.apply(engine), executor);
    }

    public void shutdown() {
        executor.shutdownNow();
        logger.info("Engine worker {} stopped", sessionId);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    // ----------------------------------------------------------------
    // Request dispatch (worker thread only)
    // ----------------------------------------------------------------

    private List<EngineMessage> handle(EngineRequest request) {
        RequestType type = request.getType() == null ? RequestType.UNKNOWN : request.getType();
        Map<String, Object> payload = request.getPayload() == null ? Collections.emptyMap() : request.getPayload();
        List<EngineMessage> messages = new ArrayList<>();
        try {
            switch (type) {
                case LOAD:
                    Map<String, String> cells = cellsOf(payload);
                    messages.add(EngineMessage.updates(engine.load(cells).getUpdates()));
                    messages.add(EngineMessage.loadComplete(cells.size()));
                    break;
                case SET_FORMULA:
                    messages.add(updates(engine.setFormula(
                            requireString(payload, "cellId"), requireString(payload, "formulaString"))));
                    break;
                case SET_CELL_VALUE:
                    messages.add(updates(engine.setCellValue(
                            requireString(payload, "cellId"), toInput(payload.get("value")))));
                    break;
                case CLEAR_CELL:
                    messages.add(updates(engine.clearCell(requireString(payload, "cellId"))));
                    break;
                case COPY_CELL:
                    messages.add(updates(engine.copyCell(
                            requireString(payload, "sourceCellId"), requireString(payload, "targetCellId"))));
                    break;
                default:
                    throw new InvalidRequestException("Unknown message type");
            }
        } catch (InvalidRequestException | InvalidCellReferenceException e) {
            logger.warn("Session {} rejected {}: {}", sessionId, type.getWireName(), e.getMessage());
            messages.clear();
            messages.add(EngineMessage.error(e.getMessage(), type));
        } catch (RuntimeException | StackOverflowError e) {
            EngineFaultException fault = new EngineFaultException("Failed to process " + type.getWireName(), e);
            logger.error("Session {}: {}", sessionId, fault.getMessage(), e);
            messages.clear();
            messages.add(EngineMessage.error(fault.getMessage() + ": " + e.getMessage(), type));
        }
        messages.forEach(this::emit);
        return messages;
    }

    private EngineMessage updates(RecalculationResult result) {
        return EngineMessage.updates(result.getUpdates());
    }

    private void emit(EngineMessage message) {
        try {
            sink.send(message);
        } catch (RuntimeException e) {
            logger.error("Session {}: message sink failed for {}", sessionId, message.getType(), e);
        }
    }

    private static String requireString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            throw new InvalidRequestException("Missing payload field '" + key + "'");
        }
        return toInput(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> cellsOf(Map<String, Object> payload) {
        Object cells = payload.get("cells");
        if (!(cells instanceof Map)) {
            throw new InvalidRequestException("Missing payload field 'cells'");
        }
        Map<String, String> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) cells).entrySet()) {
            inputs.put(entry.getKey(), toInput(entry.getValue()));
        }
        return inputs;
    }

    /**
     * JSON scalars as the text a user would have typed: null is blank,
     * booleans are TRUE/FALSE, 3.0 is "3".
     */
    private static String toInput(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return FormulaValue.formatNumber(((Number) value).doubleValue());
        }
        return value.toString();
    }
}
