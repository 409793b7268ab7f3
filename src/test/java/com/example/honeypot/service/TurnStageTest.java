package com.example.honeypot.service;

import com.example.honeypot.model.ScamLevel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TurnStageTest {

    @Test
    void testSafeMessageSkipsExtraction() {
        assertEquals(TurnStage.RESPOND, TurnStage.DETECT.next(ScamLevel.SAFE));
    }

    @Test
    void testScamMessageGoesThroughExtraction() {
        assertEquals(TurnStage.EXTRACT, TurnStage.DETECT.next(ScamLevel.SUSPECTED));
        assertEquals(TurnStage.EXTRACT, TurnStage.DETECT.next(ScamLevel.CONFIRMED));
        assertEquals(TurnStage.RESPOND, TurnStage.EXTRACT.next(ScamLevel.CONFIRMED));
    }

    @Test
    void testEveryPathEndsInDone() {
        for (ScamLevel level : ScamLevel.values()) {
            TurnStage stage = TurnStage.DETECT;
            int steps = 0;
            while (stage != TurnStage.DONE) {
                stage = stage.next(level);
                assertTrue(++steps <= TurnStage.values().length);
            }
            assertEquals(TurnStage.DONE, stage.next(level));
        }
    }
}
