package com.example.honeypot.store;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Component
public class SessionCodec {

    private static final Logger logger = LoggerFactory.getLogger(SessionCodec.class);

    private final ObjectMapper objectMapper;
    private final int maxSerializedBytes;

    public SessionCodec(ObjectMapper objectMapper, HoneypotProperties properties) {
        this.objectMapper = objectMapper;
        this.maxSerializedBytes = properties.getSession().getMaxSerializedBytes();
    }

    public String encode(Session session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            int size = json.getBytes(StandardCharsets.UTF_8).length;
            if (maxSerializedBytes > 0 && size > maxSerializedBytes) {
                logger.warn("Session {} serialized to {} bytes, above the {} byte target",
                        session.getSessionId(), size, maxSerializedBytes);
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session " + session.getSessionId() + " is not serializable", e);
        }
    }

    /**
     * Unreadable payloads are reported as absent so the caller starts from a fresh session.
     */
    public Optional<Session> decode(String sessionId, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable stored state for session {}: {}", sessionId, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
