package com.example.honeypot.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractedIntelligenceTest {

    @Test
    void testMergeIsOrderedUnion() {
        ExtractedIntelligence first = ExtractedIntelligence.builder()
                .upiIds(List.of("Scammer@UPI", "pay@ybl"))
                .suspiciousKeywords(List.of("urgent"))
                .build();
        ExtractedIntelligence second = ExtractedIntelligence.builder()
                .upiIds(List.of("pay@ybl", "new@okaxis", " "))
                .phoneNumbers(List.of("9876543210"))
                .build();

        ExtractedIntelligence merged = first.merge(second);

        assertEquals(List.of("scammer@upi", "pay@ybl", "new@okaxis"), merged.getUpiIds());
        assertEquals(List.of("9876543210"), merged.getPhoneNumbers());
        assertEquals(4, merged.highValueCount());
        // inputs are untouched
        assertEquals(2, first.getUpiIds().size());
    }

    @Test
    void testKeywordsAloneAreNotHighValue() {
        ExtractedIntelligence keywords = ExtractedIntelligence.builder()
                .suspiciousKeywords(List.of("blocked", "kyc"))
                .build();

        assertEquals(0, keywords.highValueCount());
        assertFalse(keywords.isEmpty());
        assertTrue(ExtractedIntelligence.empty().merge(null).isEmpty());
    }
}
