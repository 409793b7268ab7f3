package com.example.honeypot.service;

import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.model.TerminationReason;

/**
 * What one webhook turn produced. {@code committed} is false when the turn was abandoned and nothing was saved.
 */
public record TurnOutcome(
        String sessionId,
        String reply,
        ScamLevel level,
        TerminationReason terminationReason,
        DispatchResult dispatch,
        boolean committed) {

    static TurnOutcome abandoned(String sessionId, String reply) {
        return new TurnOutcome(sessionId, reply, null, null, DispatchResult.SKIPPED, false);
    }
}
