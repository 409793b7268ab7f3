package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.ScamLevel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Replies from the configured stalling script, picked by turn number. Used when no language model is configured.
 */
@Component
@ConditionalOnProperty(name = "honeypot.llm.enabled", havingValue = "false", matchIfMissing = true)
public class ScriptedResponder implements Responder {

    private final List<String> scriptedReplies;
    private final String safeReply;

    public ScriptedResponder(HoneypotProperties properties) {
        this.scriptedReplies = List.copyOf(properties.getPersona().getScriptedReplies());
        this.safeReply = properties.getTurn().getNeutralReply();
    }

    @Override
    public String reply(ResponderRequest request) {
        if (request.level() == ScamLevel.SAFE || scriptedReplies.isEmpty()) {
            return safeReply;
        }
        int index = Math.floorMod(request.turnCount() - 1, scriptedReplies.size());
        return scriptedReplies.get(index);
    }
}
