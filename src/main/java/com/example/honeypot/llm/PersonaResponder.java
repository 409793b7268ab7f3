package com.example.honeypot.llm;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.service.Responder;
import com.example.honeypot.service.ResponderException;
import com.example.honeypot.service.ResponderRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Replies in character as the configured persona. The early turns play up fear; later turns stall and ask
 * for the counterpart's details.
 */
@Component
@ConditionalOnProperty(name = "honeypot.llm.enabled", havingValue = "true")
public class PersonaResponder implements Responder {

    static final int FEAR_PHASE_TURNS = 2;

    private static final String FEAR_INSTRUCTION = """
            CURRENT PHASE: Express fear
            - Show panic about your money and account
            - Worry about losing your pension
            - Ask what happened to your account""";

    private static final String CLARIFY_INSTRUCTION = """
            CURRENT PHASE: Ask clarifying questions
            - Ask them to explain slowly
            - Ask for their phone number to call back
            - Ask which bank they are calling from, their name and employee ID
            - Pretend the internet or phone is slow""";

    private final LanguageModelClient client;
    private final String personaPrompt;
    private final String neutralReply;

    public PersonaResponder(LanguageModelClient client, HoneypotProperties properties) {
        this.client = client;
        this.personaPrompt = personaPrompt(properties.getPersona());
        this.neutralReply = properties.getTurn().getNeutralReply();
    }

    @Override
    public String reply(ResponderRequest request) {
        if (request.level() == ScamLevel.SAFE) {
            return neutralReply;
        }
        String phase = request.turnCount() <= FEAR_PHASE_TURNS ? FEAR_INSTRUCTION : CLARIFY_INSTRUCTION;
        String system = personaPrompt + "\n\n" + phase + languageHint(request.language());
        // the inbound message is already the last entry of recentMessages
        int historySize = request.recentMessages().size();
        return client.complete(system,
                        request.recentMessages().subList(0, Math.max(0, historySize - 1)),
                        request.inboundText())
                .orElseThrow(() -> new ResponderException("No reply from language model for session "
                        + request.sessionId()));
    }

    private static String languageHint(String language) {
        if (language == null || language.isBlank()) {
            return "";
        }
        return "\n\nReply in " + language + ".";
    }

    static String personaPrompt(HoneypotProperties.PersonaSettings persona) {
        return """
                You are %s, a %d-year-old %s from %s, a %s. You are %s.

                PERSONALITY:
                - Easily frightened about money matters
                - Confused by technology (does not understand UPI, OTP or apps)
                - Polite, uses "beta" and "ji", speaks in Hinglish
                - Never accuses anyone directly
                - Slow to understand, needs things repeated

                RULES:
                1. Never provide real personal data (account numbers, OTP, PIN)
                2. Never accuse the sender of being a scammer
                3. Stay confused and anxious throughout
                4. Keep replies under 80 words

                Respond only as %s would. Do not break character."""
                .formatted(persona.getName(), persona.getAge(), persona.getOccupation(), persona.getLocation(),
                        persona.getBackground(), persona.getTrait(), persona.getName());
    }
}
