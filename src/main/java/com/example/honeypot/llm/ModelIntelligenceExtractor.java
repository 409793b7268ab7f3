package com.example.honeypot.llm;

import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.service.SecondaryIntelligenceSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the language model for identifiers the patterns missed. Whatever it returns is only a proposal;
 * the extractor re-validates every value.
 */
@Component
public class ModelIntelligenceExtractor implements SecondaryIntelligenceSource {

    private static final Logger logger = LoggerFactory.getLogger(ModelIntelligenceExtractor.class);

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    static final String SYSTEM_PROMPT = """
            Extract any suspicious data from the message.

            Return JSON only:
            {
              "upiIds": ["UPI IDs like abc@upi, xyz@paytm"],
              "phoneNumbers": ["10-digit phone numbers"],
              "phishingLinks": ["URLs"],
              "bankAccounts": ["bank account numbers"]
            }

            If nothing is found, return empty lists. JSON only, no explanation.""";

    private final LanguageModelClient client;
    private final ObjectMapper objectMapper;

    public ModelIntelligenceExtractor(LanguageModelClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ExtractedIntelligence> propose(String message, List<String> context) {
        if (!client.isEnabled() || message == null || message.isBlank()) {
            return Optional.empty();
        }
        return client.complete(SYSTEM_PROMPT, message).flatMap(this::parse);
    }

    Optional<ExtractedIntelligence> parse(String answer) {
        String json = answer;
        Matcher fenced = FENCED.matcher(answer);
        if (fenced.find()) {
            json = fenced.group(1);
        }
        try {
            JsonNode root = objectMapper.readTree(json.trim());
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            return Optional.of(ExtractedIntelligence.builder()
                    .upiIds(strings(root.get("upiIds")))
                    .phoneNumbers(strings(root.get("phoneNumbers")))
                    .phishingLinks(strings(root.get("phishingLinks")))
                    .bankAccounts(strings(root.get("bankAccounts")))
                    .build());
        } catch (Exception e) {
            logger.debug("Unparseable extraction answer from model: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                String text = item.asText();
                if (!text.isBlank()) {
                    values.add(text);
                }
            }
        }
        return values;
    }
}
