package com.example.honeypot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of a session's conversation log. Never modified after it is appended.
 */
@Value
@Builder
@Jacksonized
public class Message {
    Sender sender;
    String text;
    Instant timestamp;

    public Message truncated(int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return this;
        }
        return new Message(sender, text.substring(0, maxLength), timestamp);
    }
}
