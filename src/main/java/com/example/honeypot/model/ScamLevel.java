package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-tier scam classification. Declaration order is severity order.
 */
public enum ScamLevel {
    SAFE("safe"),
    SUSPECTED("suspected"),
    CONFIRMED("confirmed");

    private final String wireName;

    ScamLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isAtLeast(ScamLevel other) {
        return this.ordinal() >= other.ordinal();
    }

    public static ScamLevel max(ScamLevel a, ScamLevel b) {
        if (a == null) return b == null ? SAFE : b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonCreator
    public static ScamLevel fromWireName(String value) {
        if (value == null) return SAFE;
        for (ScamLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(value.trim()) || level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return SAFE;
    }
}
