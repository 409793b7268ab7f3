package com.example.honeypot.model;

/**
 * Payload of the one-time callback describing a finished, confirmed engagement.
 */
public record FinalReport(
        String sessionId,
        boolean scamDetected,
        int totalMessagesExchanged,
        ExtractedIntelligence extractedIntelligence,
        String agentNotes) {

    public static FinalReport from(Session session) {
        String notes = session.getAgentNotes();
        return new FinalReport(
                session.getSessionId(),
                session.isConfirmed(),
                session.getMessageCount(),
                session.getExtractedIntelligence() != null
                        ? session.getExtractedIntelligence().copy()
                        : ExtractedIntelligence.empty(),
                notes == null || notes.isBlank() ? "Scam engagement completed." : notes);
    }
}
