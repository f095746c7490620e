package com.spreadsheet.formula.worker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message types an engine worker emits.
 */
public enum MessageType {
    READY("ready"),
    UPDATES("updates"),
    LOAD_COMPLETE("loadComplete"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
