package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {
    private String sessionId;
    @Builder.Default
    private List<Message> messages = new ArrayList<>();
    private int messageCount;
    @Setter(AccessLevel.NONE)
    private int turnCount;
    @Setter(AccessLevel.NONE)
    private double scamConfidence;
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private ScamLevel scamLevel = ScamLevel.SAFE;
    @Builder.Default
    private ExtractedIntelligence extractedIntelligence = ExtractedIntelligence.empty();
    @Builder.Default
    private TerminationReason terminationReason = TerminationReason.NONE;
    @Setter(AccessLevel.NONE)
    private boolean callbackSent;
    @Builder.Default
    private CallbackStatus callbackStatus = CallbackStatus.NOT_ATTEMPTED;
    @Builder.Default
    private String agentNotes = "";
    private String channel;
    private String language;
    private Instant createdAt;
    private Instant updatedAt;

    public static Session fresh(String sessionId) {
        return Session.builder()
                .sessionId(sessionId)
                .createdAt(Instant.now())
                .build();
    }

    /**
     * Appends to the log, keeping only the newest {@code retained} entries. {@link #messageCount} keeps the total.
     */
    public void appendMessage(Message message, int retained) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        messageCount++;
        while (retained > 0 && messages.size() > retained) {
            messages.remove(0);
        }
    }

    public int advanceTurn() {
        return ++turnCount;
    }

    /**
     * Raises the level; a lower level is ignored.
     */
    public void raiseLevel(ScamLevel level, double confidence) {
        ScamLevel current = scamLevel == null ? ScamLevel.SAFE : scamLevel;
        if (level != null && level.ordinal() > current.ordinal()) {
            scamLevel = level;
            scamConfidence = confidence;
        } else if (level == current) {
            scamConfidence = Math.max(scamConfidence, confidence);
        }
    }

    public void markCallbackSent() {
        callbackSent = true;
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return scamLevel == ScamLevel.CONFIRMED;
    }
}
