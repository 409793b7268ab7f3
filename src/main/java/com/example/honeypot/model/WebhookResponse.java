package com.example.honeypot.model;

public record WebhookResponse(String status, String reply) {

    public static WebhookResponse success(String reply) {
        return new WebhookResponse("success", reply);
    }
}
