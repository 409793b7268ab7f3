package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Sender {
    SCAMMER("scammer"),
    AGENT("agent");

    private final String wireName;

    Sender(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Anything the caller labels other than "agent" (e.g. "scammer", "user") is the counterpart.
     */
    @JsonCreator
    public static Sender fromLabel(String label) {
        return label != null && AGENT.wireName.equalsIgnoreCase(label.trim()) ? AGENT : SCAMMER;
    }
}
