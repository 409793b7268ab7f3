package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.ExtractedIntelligence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Finds intelligence in a message and merges it into what the session already holds.
 * <p>
 * The pattern pass always runs. The secondary pass runs only when the pattern pass found fewer high-value
 * values than the sufficiency threshold, and each of its candidates must pass the same format rules.
 */
@Service
public class IntelligenceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(IntelligenceExtractor.class);

    private final IntelligencePatterns patterns;
    private final KeywordLexicon keywordLexicon;
    private final SecondaryIntelligenceSource secondarySource;
    private final int sufficiencyThreshold;
    private final boolean secondaryEnabled;

    public IntelligenceExtractor(IntelligencePatterns patterns,
                                 SecondaryIntelligenceSource secondarySource,
                                 HoneypotProperties properties) {
        this.patterns = patterns;
        this.secondarySource = secondarySource;
        HoneypotProperties.ExtractionSettings settings = properties.getExtraction();
        List<String> keywords = new ArrayList<>(settings.getSuspiciousKeywords());
        if (keywords.isEmpty()) {
            keywords.addAll(properties.getClassification().getConfirmedKeywords());
            keywords.addAll(properties.getClassification().getSuspectedKeywords());
        }
        this.keywordLexicon = new KeywordLexicon(keywords);
        this.sufficiencyThreshold = settings.getSufficiencyThreshold();
        this.secondaryEnabled = settings.isSecondaryEnabled();
    }

    public ExtractedIntelligence extract(String message, ExtractedIntelligence existing) {
        return extract(message, List.of(), existing);
    }

    public ExtractedIntelligence extract(String message, List<String> context, ExtractedIntelligence existing) {
        ExtractedIntelligence found = primaryPass(message);
        if (secondaryEnabled && found.highValueCount() < sufficiencyThreshold) {
            found = found.merge(secondaryPass(message, context));
        }
        ExtractedIntelligence base = existing == null ? ExtractedIntelligence.empty() : existing;
        return base.merge(found);
    }

    ExtractedIntelligence primaryPass(String message) {
        return ExtractedIntelligence.builder()
                .bankAccounts(patterns.findBankAccounts(message))
                .upiIds(patterns.findUpiIds(message))
                .phishingLinks(patterns.findLinks(message))
                .phoneNumbers(patterns.findPhoneNumbers(message))
                .suspiciousKeywords(keywordLexicon.matches(message))
                .build();
    }

    private ExtractedIntelligence secondaryPass(String message, List<String> context) {
        ExtractedIntelligence proposed = secondarySource.propose(message, context).orElse(null);
        if (proposed == null) {
            return ExtractedIntelligence.empty();
        }
        return ExtractedIntelligence.builder()
                .bankAccounts(accept("bankAccounts", proposed.getBankAccounts(),
                        patterns::isBankAccount, patterns::normalizeAccount))
                .upiIds(accept("upiIds", proposed.getUpiIds(), patterns::isUpiId, patterns::normalizeUpi))
                .phishingLinks(accept("phishingLinks", proposed.getPhishingLinks(),
                        patterns::isLink, patterns::normalizeLink))
                .phoneNumbers(accept("phoneNumbers", proposed.getPhoneNumbers(),
                        patterns::isPhoneNumber, patterns::normalizePhone))
                .build();
    }

    private List<String> accept(String field, List<String> candidates,
                                Predicate<String> valid, Function<String, String> normalizer) {
        List<String> accepted = new ArrayList<>();
        if (candidates == null) return accepted;
        for (String candidate : candidates) {
            if (candidate != null && valid.test(candidate)) {
                accepted.add(normalizer.apply(candidate));
            } else {
                logger.debug("Rejected secondary {} candidate that fails format validation", field);
            }
        }
        return accepted;
    }
}
