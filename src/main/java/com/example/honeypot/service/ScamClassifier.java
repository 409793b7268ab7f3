package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Classification;
import com.example.honeypot.model.ScamLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule-based scorer. Pure: the same message, history and current level always give the same result.
 * <p>
 * Confirmed-tier rules win over suspected-tier rules, and the outcome is never below {@code currentLevel}.
 */
@Service
public class ScamClassifier {

    private final KeywordLexicon confirmedLexicon;
    private final KeywordLexicon suspectedLexicon;
    private final IntelligencePatterns patterns;
    private final Pattern anomalousSender;
    private final HoneypotProperties.ClassificationSettings settings;

    public ScamClassifier(HoneypotProperties properties, IntelligencePatterns patterns) {
        this.settings = properties.getClassification();
        this.confirmedLexicon = new KeywordLexicon(settings.getConfirmedKeywords());
        this.suspectedLexicon = new KeywordLexicon(settings.getSuspectedKeywords());
        this.patterns = patterns;
        String senderPattern = settings.getAnomalousSenderPattern();
        this.anomalousSender = senderPattern == null || senderPattern.isBlank() ? null : Pattern.compile(senderPattern);
    }

    public Classification classify(String message, List<String> history, ScamLevel currentLevel) {
        return classify(message, null, history, currentLevel);
    }

    public Classification classify(String message, String senderLabel, List<String> history, ScamLevel currentLevel) {
        List<String> confirmedRules = new ArrayList<>();
        for (String keyword : confirmedLexicon.matches(message)) {
            confirmedRules.add("confirmed-keyword:" + keyword);
        }
        if (!patterns.findUpiIds(message).isEmpty()) {
            confirmedRules.add("payment-identifier");
        }
        if (!patterns.findBankAccounts(message).isEmpty()) {
            confirmedRules.add("bank-account");
        }
        if (!patterns.findLinks(message).isEmpty()) {
            confirmedRules.add("link");
        }

        List<String> suspectedRules = new ArrayList<>();
        for (String keyword : suspectedLexicon.matches(message)) {
            suspectedRules.add("suspected-keyword:" + keyword);
        }
        if (senderLabel != null && anomalousSender != null && anomalousSender.matcher(senderLabel.trim()).matches()) {
            suspectedRules.add("anomalous-sender");
        }
        if (historyIsSuspicious(history)) {
            suspectedRules.add("history-context");
        }

        ScamLevel ruleLevel;
        List<String> matched = new ArrayList<>();
        if (!confirmedRules.isEmpty()) {
            ruleLevel = ScamLevel.CONFIRMED;
            matched.addAll(confirmedRules);
            matched.addAll(suspectedRules);
        } else if (!suspectedRules.isEmpty()) {
            ruleLevel = ScamLevel.SUSPECTED;
            matched.addAll(suspectedRules);
        } else {
            ruleLevel = ScamLevel.SAFE;
        }

        ScamLevel level = ScamLevel.max(ruleLevel, currentLevel);
        return new Classification(level, confidenceFor(level), matched);
    }

    /**
     * Combines an externally obtained level with what the session already established.
     */
    public Classification combine(Classification ruleResult, ScamLevel externalLevel) {
        ScamLevel level = ScamLevel.max(ruleResult.level(), externalLevel);
        List<String> matched = new ArrayList<>(ruleResult.matchedRules());
        if (level != ruleResult.level()) {
            matched.add("model-signal:" + level.getWireName());
        }
        return new Classification(level, confidenceFor(level), matched);
    }

    public double confidenceFor(ScamLevel level) {
        return switch (level) {
            case CONFIRMED -> settings.getConfirmedConfidence();
            case SUSPECTED -> settings.getSuspectedConfidence();
            case SAFE -> settings.getSafeConfidence();
        };
    }

    private boolean historyIsSuspicious(List<String> history) {
        if (history == null || history.isEmpty()) {
            return false;
        }
        int window = Math.max(settings.getHistoryWindow(), 0);
        List<String> recent = history.subList(Math.max(0, history.size() - window), history.size());
        for (String text : recent) {
            if (confirmedLexicon.anyMatch(text) || suspectedLexicon.anyMatch(text)) {
                return true;
            }
        }
        return false;
    }
}
