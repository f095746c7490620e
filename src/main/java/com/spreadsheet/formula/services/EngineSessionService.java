package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.EngineProperties;
import com.spreadsheet.formula.exceptions.EngineFaultException;
import com.spreadsheet.formula.exceptions.SessionNotFoundException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.GridBounds;
import com.spreadsheet.formula.worker.EngineMessage;
import com.spreadsheet.formula.worker.EngineRequest;
import com.spreadsheet.formula.worker.EngineWorker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one {@link EngineWorker} per editing session and routes REST calls to it.
 * Every call, reads included, goes through the session's worker thread.
 */
@Service
public class EngineSessionService {

    private static final Logger logger = LoggerFactory.getLogger(EngineSessionService.class);

    // All sessions live here in memory; nothing is persisted
    private final Map<Long, EngineWorker> sessions = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    private final GridBounds gridBounds;
    private final FunctionRegistry functionRegistry;
    private final long requestTimeoutMs;

    public EngineSessionService(EngineProperties properties, GridBounds gridBounds, FunctionRegistry functionRegistry) {
        this.gridBounds = gridBounds;
        this.functionRegistry = functionRegistry;
        this.requestTimeoutMs = properties.getWorker().getRequestTimeoutMs();
    }

    /**
     * Starts a new engine and returns its session id.
     */
    public long createSession() {
        long id = idGenerator.getAndIncrement();
        EngineWorker worker = new EngineWorker(id, new FormulaEngine(gridBounds, functionRegistry),
                message -> logger.debug("Session {} emitted {}", id, message));
        sessions.put(id, worker);
        logger.info("Created engine session {} with grid {}", id, gridBounds);
        return id;
    }

    /**
     * Waits until the session's worker has announced it is ready.
     */
    public boolean awaitReady(long sessionId) {
        await(getWorker(sessionId).whenReady());
        return true;
    }

    public List<EngineMessage> handle(long sessionId, EngineRequest request) {
        return await(getWorker(sessionId).submit(request));
    }

    public Map<String, FormulaValue> getValues(long sessionId) {
        return await(getWorker(sessionId).query(FormulaEngine::getValues));
    }

    public CellView getCell(long sessionId, String cellId) {
        return await(getWorker(sessionId).query(engine -> engine.getCell(cellId)));
    }

    public Map<String, Set<String>> getPrecedentGraph(long sessionId) {
        return await(getWorker(sessionId).query(FormulaEngine::getPrecedentGraph));
    }

    public Map<String, Set<String>> getDependentGraph(long sessionId) {
        return await(getWorker(sessionId).query(FormulaEngine::getDependentGraph));
    }

    public void closeSession(long sessionId) {
        EngineWorker worker = sessions.remove(sessionId);
        if (worker == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        worker.shutdown();
        logger.info("Closed engine session {}", sessionId);
    }

    /**
     * Retrieves a session's worker by ID. Throws if not found.
     */
    EngineWorker getWorker(long sessionId) {
        EngineWorker worker = sessions.get(sessionId);
        if (worker == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return worker;
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(EngineWorker::shutdown);
        sessions.clear();
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // reads report bad cell ids the same way the controllers would
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EngineFaultException("Engine request failed", e.getCause());
        } catch (TimeoutException e) {
            throw new EngineFaultException("Engine did not answer within " + requestTimeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineFaultException("Interrupted while waiting for the engine", e);
        }
    }
}
