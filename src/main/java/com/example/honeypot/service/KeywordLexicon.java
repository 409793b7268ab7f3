package com.example.honeypot.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Case-insensitive whole-word phrase matcher over a configured word list.
 */
public class KeywordLexicon {

    private final Map<String, Pattern> patterns = new LinkedHashMap<>();

    public KeywordLexicon(List<String> phrases) {
        if (phrases == null) return;
        for (String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) continue;
            String normalized = phrase.trim().toLowerCase(Locale.ROOT);
            patterns.computeIfAbsent(normalized, p -> Pattern.compile(
                    "(?<![\\p{L}\\p{N}])" + Pattern.quote(p) + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
    }

    /**
     * @return matched phrases, lower-cased, in lexicon order
     */
    public List<String> matches(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty()) return found;
        patterns.forEach((phrase, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(phrase);
            }
        });
        return found;
    }

    public boolean anyMatch(String text) {
        if (text == null || text.isEmpty()) return false;
        return patterns.values().stream().anyMatch(p -> p.matcher(text).find());
    }

    public int size() {
        return patterns.size();
    }
}
