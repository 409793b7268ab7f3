package com.example.honeypot.service;

import com.example.honeypot.model.Message;
import com.example.honeypot.model.ScamLevel;

import java.util.List;

public record ResponderRequest(
        String sessionId,
        String inboundText,
        List<Message> recentMessages,
        ScamLevel level,
        int turnCount,
        String language) {

    public ResponderRequest {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }
}
