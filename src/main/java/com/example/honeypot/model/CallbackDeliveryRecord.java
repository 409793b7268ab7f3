package com.example.honeypot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("callback_deliveries")
public class CallbackDeliveryRecord {
    @Id
    private String id;
    private String sessionId;
    private CallbackStatus status;
    private int attempts;
    private Integer httpStatus;
    private String error;
    private Instant ts;
    private Map<String, Object> payload;
}
