package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TerminationReason {
    NONE("none"),
    MAX_TURNS("max_turns"),
    EXTRACTED_SUCCESS("extracted_success"),
    USER_QUIT("user_quit");

    private final String wireName;

    TerminationReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != NONE;
    }

    @JsonCreator
    public static TerminationReason fromWireName(String value) {
        if (value == null) return NONE;
        for (TerminationReason reason : values()) {
            if (reason.wireName.equalsIgnoreCase(value.trim()) || reason.name().equalsIgnoreCase(value.trim())) {
                return reason;
            }
        }
        return NONE;
    }
}
