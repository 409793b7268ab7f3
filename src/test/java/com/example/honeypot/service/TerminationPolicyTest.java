package com.example.honeypot.service;

import com.example.honeypot.TestFixtures;
import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.model.Session;
import com.example.honeypot.model.TerminationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TerminationPolicyTest {

    private TerminationPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new TerminationPolicy(TestFixtures.properties());
    }

    private static Session sessionAtTurn(int turns, ScamLevel level) {
        Session session = Session.fresh("s1");
        for (int i = 0; i < turns; i++) {
            session.advanceTurn();
        }
        session.raiseLevel(level, 0.5);
        return session;
    }

    @Test
    void testOngoingConversationIsNotTerminated() {
        Session session = sessionAtTurn(3, ScamLevel.SUSPECTED);

        assertEquals(TerminationReason.NONE, policy.evaluate(session, "what is your branch?"));
    }

    @Test
    void testConfirmedWithIntelligenceEndsAsSuccess() {
        Session session = sessionAtTurn(2, ScamLevel.CONFIRMED);
        session.setExtractedIntelligence(ExtractedIntelligence.builder().upiIds(List.of("a@upi")).build());

        assertEquals(TerminationReason.EXTRACTED_SUCCESS, policy.evaluate(session, "pay now"));
    }

    @Test
    void testKeywordsAloneDoNotCountAsIntelligence() {
        Session session = sessionAtTurn(2, ScamLevel.CONFIRMED);
        session.setExtractedIntelligence(ExtractedIntelligence.builder().suspiciousKeywords(List.of("otp")).build());

        assertEquals(TerminationReason.NONE, policy.evaluate(session, "send otp"));
    }

    @Test
    void testSuspectedWithIntelligenceKeepsGoing() {
        Session session = sessionAtTurn(2, ScamLevel.SUSPECTED);
        session.setExtractedIntelligence(ExtractedIntelligence.builder().phoneNumbers(List.of("9876543210")).build());

        assertEquals(TerminationReason.NONE, policy.evaluate(session, "call me"));
    }

    @Test
    void testTurnCeilingEndsConversation() {
        assertEquals(TerminationReason.NONE, policy.evaluate(sessionAtTurn(9, ScamLevel.SAFE), "hi"));
        assertEquals(TerminationReason.MAX_TURNS, policy.evaluate(sessionAtTurn(10, ScamLevel.SAFE), "hi"));
    }

    @Test
    void testQuitPhraseEndsConversation() {
        Session session = sessionAtTurn(1, ScamLevel.SUSPECTED);

        assertEquals(TerminationReason.USER_QUIT, policy.evaluate(session, "OK forget this, I am not interested"));
    }

    @Test
    void testReasonIsKeptOnceSet() {
        Session session = sessionAtTurn(10, ScamLevel.CONFIRMED);
        session.setTerminationReason(TerminationReason.USER_QUIT);
        session.setExtractedIntelligence(ExtractedIntelligence.builder().upiIds(List.of("a@upi")).build());

        assertEquals(TerminationReason.USER_QUIT, policy.evaluate(session, "hello again"));
    }
}
