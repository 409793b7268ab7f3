package com.example.honeypot.model;

public enum CallbackStatus {
    NOT_ATTEMPTED,
    DELIVERED,
    FAILED
}
