package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Session;
import com.example.honeypot.model.TerminationReason;
import org.springframework.stereotype.Component;

@Component
public class TerminationPolicy {

    private final int maxTurns;
    private final int minIntelligenceFields;
    private final KeywordLexicon quitPhrases;

    public TerminationPolicy(HoneypotProperties properties) {
        this.maxTurns = properties.getTermination().getMaxTurns();
        this.minIntelligenceFields = Math.max(1, properties.getTermination().getMinIntelligenceFields());
        this.quitPhrases = new KeywordLexicon(properties.getTermination().getQuitPhrases());
    }

    /**
     * Decides why, if at all, the conversation is over after this turn. A reason already recorded on the
     * session is kept.
     */
    public TerminationReason evaluate(Session session, String inboundText) {
        TerminationReason current = session.getTerminationReason();
        if (current != null && current.isTerminal()) {
            return current;
        }
        if (session.isConfirmed()
                && session.getExtractedIntelligence() != null
                && session.getExtractedIntelligence().highValueCount() >= minIntelligenceFields) {
            return TerminationReason.EXTRACTED_SUCCESS;
        }
        if (quitPhrases.anyMatch(inboundText)) {
            return TerminationReason.USER_QUIT;
        }
        if (maxTurns > 0 && session.getTurnCount() >= maxTurns) {
            return TerminationReason.MAX_TURNS;
        }
        return TerminationReason.NONE;
    }
}
