package com.example.honeypot.llm;

import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.service.SecondaryScamSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the language model for a level on messages no rule caught. The answer is coerced to the three-level
 * scale by looking for the quoted level name, strongest first.
 */
@Component
public class ModelScamScorer implements SecondaryScamSignal {

    private static final Logger logger = LoggerFactory.getLogger(ModelScamScorer.class);

    static final String SYSTEM_PROMPT = """
            You are a scam detection system. Analyze the message and conversation for scam indicators.

            SCAM INDICATORS:
            - Urgency or fear tactics (account blocked, legal action)
            - Requests for OTP, PIN or passwords
            - Suspicious links or UPI IDs
            - Impersonation of bank or government officials
            - Offers that are too good to be true

            RESPONSE FORMAT (JSON only):
            {"scam_level": "safe" | "suspected" | "confirmed", "reasoning": "brief explanation"}

            Be conservative: only answer "confirmed" if there is clear evidence of scam intent.""";

    private final LanguageModelClient client;

    public ModelScamScorer(LanguageModelClient client) {
        this.client = client;
    }

    @Override
    public Optional<ScamLevel> score(String message, List<String> history) {
        if (!client.isEnabled() || message == null || message.isBlank()) {
            return Optional.empty();
        }
        StringBuilder context = new StringBuilder();
        if (history != null && !history.isEmpty()) {
            context.append("Previous messages:\n");
            history.forEach(h -> context.append("- ").append(h).append('\n'));
            context.append('\n');
        }
        context.append("Current message: ").append(message);

        Optional<ScamLevel> level = client.complete(SYSTEM_PROMPT, context.toString()).flatMap(ModelScamScorer::coerce);
        level.ifPresent(l -> logger.debug("Model scored message as {}", l.getWireName()));
        return level;
    }

    static Optional<ScamLevel> coerce(String answer) {
        String content = answer.toLowerCase(Locale.ROOT);
        if (content.contains("\"confirmed\"")) return Optional.of(ScamLevel.CONFIRMED);
        if (content.contains("\"suspected\"")) return Optional.of(ScamLevel.SUSPECTED);
        if (content.contains("\"safe\"")) return Optional.of(ScamLevel.SAFE);
        String bare = content.replaceAll("[^a-z]", "");
        for (ScamLevel level : ScamLevel.values()) {
            if (bare.equals(level.getWireName())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
