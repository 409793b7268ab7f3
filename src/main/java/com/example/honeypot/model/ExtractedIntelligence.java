package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Intelligence accumulated over a session. Each field behaves as an insertion-ordered set of
 * normalized values; {@link #merge(ExtractedIntelligence)} is a per-field union and never removes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedIntelligence {
    @Builder.Default
    private List<String> bankAccounts = new ArrayList<>();
    @Builder.Default
    private List<String> upiIds = new ArrayList<>();
    @Builder.Default
    private List<String> phishingLinks = new ArrayList<>();
    @Builder.Default
    private List<String> phoneNumbers = new ArrayList<>();
    @Builder.Default
    private List<String> suspiciousKeywords = new ArrayList<>();

    public static ExtractedIntelligence empty() {
        return new ExtractedIntelligence();
    }

    /**
     * Returns a new instance holding the union of this and {@code other}; values already present keep
     * their position, new ones are appended in the order {@code other} lists them.
     */
    public ExtractedIntelligence merge(ExtractedIntelligence other) {
        if (other == null) {
            return copy();
        }
        return ExtractedIntelligence.builder()
                .bankAccounts(union(bankAccounts, other.bankAccounts))
                .upiIds(union(upiIds, other.upiIds))
                .phishingLinks(union(phishingLinks, other.phishingLinks))
                .phoneNumbers(union(phoneNumbers, other.phoneNumbers))
                .suspiciousKeywords(union(suspiciousKeywords, other.suspiciousKeywords))
                .build();
    }

    public ExtractedIntelligence copy() {
        return merge(empty());
    }

    /**
     * Count of values that identify the actor: accounts, payment ids, links and phones. Keywords are not counted.
     */
    @JsonIgnore
    public int highValueCount() {
        return size(bankAccounts) + size(upiIds) + size(phishingLinks) + size(phoneNumbers);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return highValueCount() == 0 && size(suspiciousKeywords) == 0;
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> union(Collection<String> first, Collection<String> second) {
        LinkedHashSet<String> merged = new LinkedHashSet<>();
        addNormalized(merged, first);
        addNormalized(merged, second);
        return new ArrayList<>(merged);
    }

    private static void addNormalized(LinkedHashSet<String> target, Collection<String> values) {
        if (values == null) return;
        for (String value : values) {
            String normalized = normalize(value);
            if (!normalized.isEmpty()) {
                target.add(normalized);
            }
        }
    }

    private static int size(Collection<String> values) {
        return values == null ? 0 : values.size();
    }
}
