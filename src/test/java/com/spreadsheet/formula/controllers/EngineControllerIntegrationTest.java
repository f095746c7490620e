package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.FormulaEngineApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests drive an engine session through the message endpoint and read it back.
 */
@SpringBootTest(
        classes = FormulaEngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class EngineControllerIntegrationTest {

    @LocalServerPort
    int port;

    private String baseUrl() {
        return "http://localhost:" + port + "/engine";
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    @SuppressWarnings("rawtypes")
    private long createSession(RestTemplate restTemplate) {
        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl(), null, Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Boolean.TRUE, response.getBody().get("ready"));
        return ((Number) response.getBody().get("sessionId")).longValue();
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private List<Map> send(RestTemplate restTemplate, long sessionId, String body) {
        ResponseEntity<List> response = restTemplate.postForEntity(
                baseUrl() + "/" + sessionId + "/messages", json(body), List.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    @SuppressWarnings("rawtypes")
    private static Map updatesOf(Map message) {
        assertEquals("updates", message.get("type"));
        return (Map) ((Map) message.get("payload")).get("updates");
    }

    /**
     * Tests setting values and a formula, then changing a precedent.
     */
    @Test
    @SuppressWarnings("rawtypes")
    void testFormulaRecalculation() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        send(restTemplate, sessionId, "{\"type\":\"setCellValue\",\"payload\":{\"cellId\":\"A1\",\"value\":5}}");
        send(restTemplate, sessionId, "{\"type\":\"setCellValue\",\"payload\":{\"cellId\":\"B1\",\"value\":\"10\"}}");
        List<Map> created = send(restTemplate, sessionId,
                "{\"type\":\"setFormula\",\"payload\":{\"cellId\":\"C1\",\"formulaString\":\"=A1+B1\"}}");
        assertEquals(15, ((Number) updatesOf(created.get(0)).get("C1")).intValue());

        List<Map> changed = send(restTemplate, sessionId,
                "{\"type\":\"setCellValue\",\"payload\":{\"cellId\":\"A1\",\"value\":20}}");
        Map updates = updatesOf(changed.get(0));
        assertEquals(2, updates.size());
        assertEquals(30, ((Number) updates.get("C1")).intValue());

        ResponseEntity<Map> cell = restTemplate.getForEntity(baseUrl() + "/" + sessionId + "/cells/c1", Map.class);
        assertEquals("C1", cell.getBody().get("cellId"));
        assertEquals("=A1+B1", cell.getBody().get("input"));
        assertEquals(30, ((Number) cell.getBody().get("value")).intValue());
    }

    /**
     * Tests that error values travel as their display tokens and blanks as null.
     */
    @Test
    @SuppressWarnings("rawtypes")
    void testErrorValuesAndBlanks() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        send(restTemplate, sessionId, "{\"type\":\"setFormula\",\"payload\":{\"cellId\":\"A1\",\"formulaString\":\"=1/0\"}}");
        send(restTemplate, sessionId, "{\"type\":\"setFormula\",\"payload\":{\"cellId\":\"A2\",\"formulaString\":\"=B2\"}}");
        send(restTemplate, sessionId, "{\"type\":\"setFormula\",\"payload\":{\"cellId\":\"B2\",\"formulaString\":\"=A2\"}}");
        List<Map> cleared = send(restTemplate, sessionId, "{\"type\":\"clearCell\",\"payload\":{\"cellId\":\"A1\"}}");

        assertTrue(updatesOf(cleared.get(0)).containsKey("A1"));
        assertNull(updatesOf(cleared.get(0)).get("A1"));

        ResponseEntity<Map> cells = restTemplate.getForEntity(baseUrl() + "/" + sessionId + "/cells", Map.class);
        assertEquals("#CIRCULAR!", cells.getBody().get("A2"));
        assertEquals("#CIRCULAR!", cells.getBody().get("B2"));
        assertFalse(cells.getBody().containsKey("A1"));
    }

    /**
     * Tests load followed by loadComplete, and a copy with reference translation.
     */
    @Test
    @SuppressWarnings("rawtypes")
    void testLoadAndCopy() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        List<Map> loaded = send(restTemplate, sessionId, "{\"type\":\"load\",\"payload\":{\"cells\":"
                + "{\"A1\":10,\"A2\":30,\"B1\":100,\"B2\":200,\"A3\":\"=A1+A2\"}}}");
        assertEquals(2, loaded.size());
        assertEquals(40, ((Number) updatesOf(loaded.get(0)).get("A3")).intValue());
        assertEquals("loadComplete", loaded.get(1).get("type"));
        assertEquals(5, ((Number) ((Map) loaded.get(1).get("payload")).get("cellCount")).intValue());

        List<Map> copied = send(restTemplate, sessionId,
                "{\"type\":\"copyCell\",\"payload\":{\"sourceCellId\":\"A3\",\"targetCellId\":\"B3\"}}");
        assertEquals(300, ((Number) updatesOf(copied.get(0)).get("B3")).intValue());

        ResponseEntity<Map> precedents = restTemplate.getForEntity(
                baseUrl() + "/" + sessionId + "/precedents", Map.class);
        assertEquals(List.of("B1", "B2"), precedents.getBody().get("B3"));

        ResponseEntity<Map> dependents = restTemplate.getForEntity(
                baseUrl() + "/" + sessionId + "/dependents", Map.class);
        assertEquals(List.of("A3"), dependents.getBody().get("A1"));
    }

    /**
     * Tests that bad messages are answered with error messages rather than HTTP errors.
     */
    @Test
    @SuppressWarnings("rawtypes")
    void testErrorMessages() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        List<Map> unknown = send(restTemplate, sessionId, "{\"type\":\"explode\",\"payload\":{}}");
        assertEquals("error", unknown.get(0).get("type"));
        assertEquals("unknown", ((Map) unknown.get(0).get("payload")).get("requestType"));

        List<Map> badCell = send(restTemplate, sessionId,
                "{\"type\":\"setFormula\",\"payload\":{\"cellId\":\"ZZ1\",\"formulaString\":\"=1\"}}");
        assertEquals("error", badCell.get(0).get("type"));
        assertEquals("setFormula", ((Map) badCell.get(0).get("payload")).get("requestType"));
    }

    /**
     * Tests closing a session and the 404s that follow.
     */
    @Test
    void testCloseSession() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        ResponseEntity<Void> deleted = restTemplate.exchange(
                baseUrl() + "/" + sessionId, HttpMethod.DELETE, null, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, deleted.getStatusCode());

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(baseUrl() + "/" + sessionId + "/cells", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
    }

    /**
     * Tests that reading an invalid cell id is a 400.
     */
    @Test
    void testInvalidCellRead() {
        RestTemplate restTemplate = new RestTemplate();
        long sessionId = createSession(restTemplate);

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(baseUrl() + "/" + sessionId + "/cells/A0", Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
    }
}
