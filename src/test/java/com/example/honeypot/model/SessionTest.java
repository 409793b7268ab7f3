package com.example.honeypot.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private static Message scammer(String text) {
        return Message.builder().sender(Sender.SCAMMER).text(text).timestamp(Instant.now()).build();
    }

    @Test
    void testLevelOnlyRises() {
        Session session = Session.fresh("s1");

        session.raiseLevel(ScamLevel.CONFIRMED, 0.9);
        session.raiseLevel(ScamLevel.SAFE, 0.1);
        session.raiseLevel(ScamLevel.SUSPECTED, 0.6);

        assertEquals(ScamLevel.CONFIRMED, session.getScamLevel());
        assertEquals(0.9, session.getScamConfidence());
        assertTrue(session.isConfirmed());
    }

    @Test
    void testLogKeepsNewestEntries() {
        Session session = Session.fresh("s1");
        for (int i = 1; i <= 6; i++) {
            session.appendMessage(scammer("m" + i), 4);
        }

        assertEquals(6, session.getMessageCount());
        assertEquals(List.of("m3", "m4", "m5", "m6"),
                session.getMessages().stream().map(Message::getText).toList());
    }

    @Test
    void testAnyNonAgentLabelIsScammer() {
        assertEquals(Sender.AGENT, Sender.fromLabel(" Agent "));
        assertEquals(Sender.SCAMMER, Sender.fromLabel("user"));
        assertEquals(Sender.SCAMMER, Sender.fromLabel(null));
    }
}
