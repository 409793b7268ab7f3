package com.example.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the engine takes from outside: lexicons, thresholds, ceilings, timeouts and capacities.
 */
@Data
@ConfigurationProperties(prefix = "honeypot")
public class HoneypotProperties {

    private SessionSettings session = new SessionSettings();
    private StoreSettings store = new StoreSettings();
    private ClassificationSettings classification = new ClassificationSettings();
    private ExtractionSettings extraction = new ExtractionSettings();
    private TerminationSettings termination = new TerminationSettings();
    private TurnSettings turn = new TurnSettings();
    private CallbackSettings callback = new CallbackSettings();
    private LlmSettings llm = new LlmSettings();
    private PersonaSettings persona = new PersonaSettings();
    private SecuritySettings security = new SecuritySettings();

    @Data
    public static class SessionSettings {
        private String keyPrefix = "honeypot:session:";
        private String claimKeyPrefix = "honeypot:callback:";
        private Duration ttl = Duration.ofHours(1);
        private int maxStoredMessages = 4;
        private int maxStoredTextLength = 120;
        private int maxSerializedBytes = 1024;
    }

    @Data
    public static class StoreSettings {
        private Duration remoteTimeout = Duration.ofSeconds(2);
        private int fallbackCapacity = 1000;
        private int executorThreads = 8;
        private long recoveryProbeMs = 10_000;
    }

    @Data
    public static class ClassificationSettings {
        private List<String> confirmedKeywords = new ArrayList<>();
        private List<String> suspectedKeywords = new ArrayList<>();
        private String anomalousSenderPattern = "^(?:[A-Za-z]{2}-[A-Za-z0-9]{6}|\\+?\\d{5,})$";
        private double confirmedConfidence = 0.9;
        private double suspectedConfidence = 0.6;
        private double safeConfidence = 0.1;
        private int historyWindow = 5;
    }

    @Data
    public static class ExtractionSettings {
        private List<String> suspiciousKeywords = new ArrayList<>();
        private List<String> excludedEmailDomains = new ArrayList<>(
                List.of("gmail", "yahoo", "hotmail", "outlook", "email", "mail", "proton"));
        private List<String> bankAccountContextWords = new ArrayList<>(
                List.of("account", "acct", "a/c", "ac no", "acc no", "beneficiary", "transfer", "deposit", "credit"));
        private int bankAccountContextWindow = 40;
        private int sufficiencyThreshold = 1;
        private boolean secondaryEnabled = true;
    }

    @Data
    public static class TerminationSettings {
        private int maxTurns = 10;
        private int minIntelligenceFields = 1;
        private List<String> quitPhrases = new ArrayList<>();
    }

    @Data
    public static class TurnSettings {
        private Duration budget = Duration.ofSeconds(28);
        private Duration responderTimeout = Duration.ofSeconds(12);
        private int executorThreads = 16;
        private String fallbackReply = "Sorry beta, I think my internet is slow. Please tell me again what to do?";
        private String neutralReply = "Hello, I think there is some confusion. Who is this?";
    }

    @Data
    public static class CallbackSettings {
        private String url = "https://hackathon.guvi.in/api/updateHoneyPotFinalResult";
        private Duration attemptTimeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(4);
        private Duration deliveryBudget = Duration.ofSeconds(12);
    }

    @Data
    public static class LlmSettings {
        private boolean enabled = false;
        private Duration timeout = Duration.ofSeconds(8);
        private int executorThreads = 8;
    }

    @Data
    public static class PersonaSettings {
        private String name = "Ramesh Kumar";
        private int age = 67;
        private String location = "Pune";
        private String occupation = "Ex-Government Clerk";
        private String background = "regular savings account holder at SBI";
        private String trait = "anxious and very polite";
        private List<String> scriptedReplies = new ArrayList<>();
    }

    @Data
    public static class SecuritySettings {
        /** Blank disables the check. */
        private String apiKey = "";
        private String headerName = "X-API-KEY";
        private List<String> protectedPaths = new ArrayList<>(List.of("/webhook", "/api/"));
    }
}
