package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.services.EngineSessionService;
import com.spreadsheet.formula.worker.EngineMessage;
import com.spreadsheet.formula.worker.EngineRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for formula engine sessions.
 * "/engine" is the base path.
 */
@RestController
@RequestMapping("/engine")
public class EngineController {

    @Autowired
    private EngineSessionService sessionService;

    /**
     * POST /engine
     * Starts a new engine session and waits for its ready signal.
     * Returns { "sessionId": 1, "ready": true }.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createSession() {
        long sessionId = sessionService.createSession();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("ready", sessionService.awaitReady(sessionId));
        return ResponseEntity.ok(body);
    }

    /**
     * POST /engine/{sessionId}/messages
     * Body: { "type": "setFormula", "payload": { "cellId": "C1", "formulaString": "=A1+B1" } }.
     * Returns the messages the engine emitted for it, e.g.
     * [ { "type": "updates", "payload": { "updates": { "C1": 15 } } } ].
     * Problems inside the request come back as an "error" message, not an HTTP error.
     */
    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<List<EngineMessage>> sendMessage(@PathVariable long sessionId,
                                                           @RequestBody EngineRequest request) {
        return ResponseEntity.ok(sessionService.handle(sessionId, request));
    }

    /**
     * GET /engine/{sessionId}/cells
     * Returns every non-empty cell with its displayed value: { "A1": 5, "C1": "#DIV/0!" }.
     */
    @GetMapping("/{sessionId}/cells")
    public ResponseEntity<Map<String, FormulaValue>> getCells(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionService.getValues(sessionId));
    }

    /**
     * GET /engine/{sessionId}/cells/{cellId}
     * Returns { "cellId": "C1", "input": "=A1+B1", "value": 15 }.
     */
    @GetMapping("/{sessionId}/cells/{cellId}")
    public ResponseEntity<CellView> getCell(@PathVariable long sessionId, @PathVariable String cellId) {
        return ResponseEntity.ok(sessionService.getCell(sessionId, cellId));
    }

    /**
     * GET /engine/{sessionId}/precedents
     * For each formula cell => the set of cells it reads.
     */
    @GetMapping("/{sessionId}/precedents")
    public ResponseEntity<Map<String, Set<String>>> getPrecedents(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionService.getPrecedentGraph(sessionId));
    }

    /**
     * GET /engine/{sessionId}/dependents
     * For each referenced cell => the set of formula cells that read it.
     */
    @GetMapping("/{sessionId}/dependents")
    public ResponseEntity<Map<String, Set<String>>> getDependents(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionService.getDependentGraph(sessionId));
    }

    /**
     * DELETE /engine/{sessionId}
     * Stops the session's worker.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable long sessionId) {
        sessionService.closeSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
