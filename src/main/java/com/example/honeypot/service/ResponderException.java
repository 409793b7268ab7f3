package com.example.honeypot.service;

public class ResponderException extends RuntimeException {

    public ResponderException(String message) {
        super(message);
    }

    public ResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
