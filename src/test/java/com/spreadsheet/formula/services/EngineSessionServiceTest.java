package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.EngineProperties;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.exceptions.SessionNotFoundException;
import com.spreadsheet.formula.functions.BuiltInFunctions;
import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.GridBounds;
import com.spreadsheet.formula.worker.EngineMessage;
import com.spreadsheet.formula.worker.EngineRequest;
import com.spreadsheet.formula.worker.MessageType;
import com.spreadsheet.formula.worker.RequestType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EngineSessionService.
 */
class EngineSessionServiceTest {

    private EngineSessionService service;

    @BeforeEach
    void setUp() {
        service = new EngineSessionService(new EngineProperties(), new GridBounds(26, 100),
                BuiltInFunctions.createRegistry(Clock.systemUTC()));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static EngineRequest setFormula(String cellId, String formula) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("cellId", cellId);
        payload.put("formulaString", formula);
        return new EngineRequest(RequestType.SET_FORMULA, payload);
    }

    /**
     * Test that new sessions get distinct ids and become ready.
     */
    @Test
    void testCreateSession() {
        long first = service.createSession();
        long second = service.createSession();

        assertNotEquals(first, second);
        assertTrue(service.awaitReady(first));
    }

    /**
     * Test that sessions do not share cells.
     */
    @Test
    void testSessionsAreIsolated() {
        long first = service.createSession();
        long second = service.createSession();

        List<EngineMessage> messages = service.handle(first, setFormula("A1", "=2*21"));

        assertEquals(MessageType.UPDATES, messages.get(0).getType());
        assertEquals(FormulaValue.number(42), service.getValues(first).get("A1"));
        assertTrue(service.getValues(second).isEmpty());
    }

    /**
     * Test the read views.
     */
    @Test
    void testReads() {
        long id = service.createSession();
        service.handle(id, setFormula("B1", "=A1+1"));

        CellView cell = service.getCell(id, "b1");
        assertEquals("B1", cell.getCellId());
        assertEquals("=A1+1", cell.getInput());
        assertEquals(FormulaValue.number(1), cell.getValue());
        assertEquals(Set.of("A1"), service.getPrecedentGraph(id).get("B1"));
        assertEquals(Set.of("B1"), service.getDependentGraph(id).get("A1"));
    }

    /**
     * Test that a read with a bad cell id surfaces the engine's exception.
     */
    @Test
    void testBadCellRead() {
        long id = service.createSession();

        assertThrows(InvalidCellReferenceException.class, () -> service.getCell(id, "A0"));
    }

    /**
     * Test that closed and unknown sessions are rejected.
     */
    @Test
    void testCloseSession() {
        long id = service.createSession();
        service.closeSession(id);

        assertThrows(SessionNotFoundException.class, () -> service.getValues(id));
        assertThrows(SessionNotFoundException.class, () -> service.closeSession(id));
        assertThrows(SessionNotFoundException.class, () -> service.handle(999L, setFormula("A1", "=1")));
    }
}
