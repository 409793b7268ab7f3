package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Format rules for the extracted fields. Used both to find values in free text and to validate candidates
 * proposed by the secondary extraction pass; a value is only ever accepted if it passes these rules.
 */
@Component
public class IntelligencePatterns {

    private static final Pattern UPI = Pattern.compile(
            "(?<![\\w.@-])([a-zA-Z0-9._-]{2,})@([a-zA-Z]{2,})(?![\\w@-]|\\.[a-zA-Z])");
    private static final Pattern UPI_EXACT = Pattern.compile("[a-z0-9._-]{2,}@[a-z]{2,}");

    private static final Pattern PHONE = Pattern.compile("(?<![\\d+])(?:\\+?91[\\s-]?)?([6-9]\\d{9})(?!\\d)");
    private static final Pattern PHONE_EXACT = Pattern.compile("[6-9]\\d{9}");

    private static final Pattern LINK = Pattern.compile("(?i)(?:https?://|www\\.)[^\\s<>\"']+");
    private static final Pattern LINK_EXACT = Pattern.compile("(?:https?://|www\\.)[^\\s<>\"']+\\.[^\\s<>\"']+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)\\]}'\"]+$");

    private static final Pattern DIGIT_RUN = Pattern.compile("(?<!\\d)(\\d{9,18})(?!\\d)");
    private static final Pattern ACCOUNT_EXACT = Pattern.compile("\\d{9,18}");

    private final Set<String> excludedEmailDomains;
    private final List<String> accountContextWords;
    private final int accountContextWindow;

    public IntelligencePatterns(HoneypotProperties properties) {
        HoneypotProperties.ExtractionSettings settings = properties.getExtraction();
        this.excludedEmailDomains = new HashSet<>();
        settings.getExcludedEmailDomains().forEach(d -> excludedEmailDomains.add(d.trim().toLowerCase(Locale.ROOT)));
        this.accountContextWords = settings.getBankAccountContextWords().stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .filter(w -> !w.isEmpty())
                .toList();
        this.accountContextWindow = Math.max(settings.getBankAccountContextWindow(), 0);
    }

    public List<String> findUpiIds(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null) return new ArrayList<>(found);
        Matcher m = UPI.matcher(text);
        while (m.find()) {
            String candidate = normalizeUpi(m.group());
            if (isUpiId(candidate)) {
                found.add(candidate);
            }
        }
        return new ArrayList<>(found);
    }

    public List<String> findPhoneNumbers(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null) return new ArrayList<>(found);
        Matcher m = PHONE.matcher(text);
        while (m.find()) {
            found.add(m.group(1));
        }
        return new ArrayList<>(found);
    }

    public List<String> findLinks(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null) return new ArrayList<>(found);
        Matcher m = LINK.matcher(text);
        while (m.find()) {
            String candidate = normalizeLink(m.group());
            if (isLink(candidate)) {
                found.add(candidate);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Digit runs of 9-18 digits preceded, within the context window, by an account-related word.
     * Bare numbers are left alone so that amounts are not reported as accounts, and a phone-shaped number is
     * never an account whatever precedes it; see {@link #isBankAccount(String)}.
     */
    public List<String> findBankAccounts(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null) return new ArrayList<>(found);
        String lower = text.toLowerCase(Locale.ROOT);
        Matcher m = DIGIT_RUN.matcher(text);
        while (m.find()) {
            int from = Math.max(0, m.start() - accountContextWindow);
            String before = lower.substring(from, m.start());
            if (isBankAccount(m.group(1)) && hasAccountContext(before)) {
                found.add(m.group(1));
            }
        }
        return new ArrayList<>(found);
    }

    public boolean isUpiId(String candidate) {
        String value = normalizeUpi(candidate);
        if (!UPI_EXACT.matcher(value).matches()) {
            return false;
        }
        String handle = value.substring(value.indexOf('@') + 1);
        return !excludedEmailDomains.contains(handle);
    }

    public boolean isPhoneNumber(String candidate) {
        return PHONE_EXACT.matcher(normalizePhone(candidate)).matches();
    }

    public boolean isLink(String candidate) {
        return LINK_EXACT.matcher(normalizeLink(candidate)).matches();
    }

    /**
     * Format rule for an account number, shared by the text scan and the check on proposed candidates.
     * A phone-shaped number is not an account.
     */
    public boolean isBankAccount(String candidate) {
        String digits = stripSeparators(candidate);
        return ACCOUNT_EXACT.matcher(digits).matches() && !PHONE_EXACT.matcher(digits).matches();
    }

    public String normalizePhone(String candidate) {
        String digits = stripSeparators(candidate);
        if (digits.startsWith("+")) {
            digits = digits.substring(1);
        }
        if (digits.length() == 12 && digits.startsWith("91")) {
            digits = digits.substring(2);
        } else if (digits.length() == 11 && digits.startsWith("0")) {
            digits = digits.substring(1);
        }
        return digits;
    }

    public String normalizeAccount(String candidate) {
        return stripSeparators(candidate);
    }

    public String normalizeUpi(String candidate) {
        return candidate == null ? "" : candidate.trim().toLowerCase(Locale.ROOT);
    }

    public String normalizeLink(String candidate) {
        if (candidate == null) return "";
        String value = candidate.trim();
        value = TRAILING_PUNCTUATION.matcher(value).replaceAll("");
        return value.toLowerCase(Locale.ROOT);
    }

    private boolean hasAccountContext(String before) {
        for (String word : accountContextWords) {
            if (before.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String stripSeparators(String candidate) {
        return candidate == null ? "" : candidate.trim().replaceAll("[\\s-]", "");
    }
}
