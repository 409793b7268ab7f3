package com.example.honeypot.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound webhook payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookRequest {

    @NotBlank
    private String sessionId;

    @NotNull
    @Valid
    private MessageInput message;

    @Builder.Default
    private List<MessageInput> conversationHistory = new ArrayList<>();

    @Builder.Default
    private Metadata metadata = new Metadata();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class MessageInput {
        @NotBlank
        private String sender;
        @NotNull
        private String text;
        private Instant timestamp;

        public Message toMessage() {
            return Message.builder()
                    .sender(Sender.fromLabel(sender))
                    .text(text)
                    .timestamp(timestamp != null ? timestamp : Instant.now())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Metadata {
        @Builder.Default
        private String channel = "SMS";
        private String language;
        private String locale;
    }
}
