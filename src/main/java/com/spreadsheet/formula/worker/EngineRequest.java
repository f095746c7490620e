package com.spreadsheet.formula.worker;

import java.util.HashMap;
import java.util.Map;

/**
 * One inbound message: a type plus a free-form payload, e.g.
 * { "type": "setFormula", "payload": { "cellId": "C1", "formulaString": "=A1+B1" } }.
 */
public class EngineRequest {
    private RequestType type;
    private Map<String, Object> payload = new HashMap<>();

    // Default constructor needed for JSON deserialization
    public EngineRequest() {
    }

    public EngineRequest(RequestType type, Map<String, Object> payload) {
        this.type = type;
        this.payload = payload;
    }

    public RequestType getType() {
        return type;
    }

    public void setType(RequestType type) {
        this.type = type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    @Override
    public String toString() {
        return "EngineRequest{type=" + type + ", payload=" + payload + "}";
    }
}
