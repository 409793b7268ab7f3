package com.example.honeypot.service;

import com.example.honeypot.model.ScamLevel;

/**
 * Stages of processing one inbound message.
 */
public enum TurnStage {
    DETECT,
    EXTRACT,
    RESPOND,
    EVALUATE_TERMINATION,
    DONE;

    /**
     * Transition function. {@code level} is only consulted when leaving {@link #DETECT}: safe messages skip extraction.
     */
    public TurnStage next(ScamLevel level) {
        return switch (this) {
            case DETECT -> level == ScamLevel.SAFE ? RESPOND : EXTRACT;
            case EXTRACT -> RESPOND;
            case RESPOND -> EVALUATE_TERMINATION;
            case EVALUATE_TERMINATION, DONE -> DONE;
        };
    }
}
