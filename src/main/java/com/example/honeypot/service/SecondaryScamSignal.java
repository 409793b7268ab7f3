package com.example.honeypot.service;

import com.example.honeypot.model.ScamLevel;

import java.util.List;
import java.util.Optional;

/**
 * Optional second opinion for messages on which no classification rule fired.
 */
public interface SecondaryScamSignal {

    /**
     * @return the coerced level, or empty when the signal is disabled, unavailable or unparseable
     */
    Optional<ScamLevel> score(String message, List<String> history);
}
