package com.example.honeypot.model;

import java.util.List;

/**
 * Result of scoring one inbound message. {@code matchedRules} is empty when no rule fired.
 */
public record Classification(ScamLevel level, double confidence, List<String> matchedRules) {

    public Classification {
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
    }

    public boolean ruleFired() {
        return !matchedRules.isEmpty();
    }
}
