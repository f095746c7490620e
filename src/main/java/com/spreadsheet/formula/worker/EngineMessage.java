package com.spreadsheet.formula.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spreadsheet.formula.models.FormulaValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One outbound message. Payload shapes:
 * - ready: {}
 * - updates: { "updates": { cellId: value } }
 * - loadComplete: { "cellCount": n }
 * - error: { "message": text, "requestType": type }
 */
public class EngineMessage {
    private final MessageType type;
    private final Map<String, Object> payload;

    @JsonCreator
    public EngineMessage(@JsonProperty("type") MessageType type,
                         @JsonProperty("payload") Map<String, Object> payload) {
        this.type = type;
        this.payload = payload;
    }

    public static EngineMessage ready() {
        return new EngineMessage(MessageType.READY, Collections.emptyMap());
    }

    public static EngineMessage updates(Map<String, FormulaValue> updates) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("updates", updates);
        return new EngineMessage(MessageType.UPDATES, payload);
    }

    public static EngineMessage loadComplete(int cellCount) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cellCount", cellCount);
        return new EngineMessage(MessageType.LOAD_COMPLETE, payload);
    }

    public static EngineMessage error(String message, RequestType requestType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("requestType", requestType);
        return new EngineMessage(MessageType.ERROR, payload);
    }

    public MessageType getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "EngineMessage{type=" + type + ", payload=" + payload + "}";
    }
}
