package com.example.honeypot.controller;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.WebhookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * The webhook never answers with an error status: malformed input and unexpected failures get HTTP 200 with
 * the neutral reply.
 */
@RestControllerAdvice(assignableTypes = WebhookController.class)
public class WebhookExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(WebhookExceptionHandler.class);

    private final String neutralReply;

    public WebhookExceptionHandler(HoneypotProperties properties) {
        this.neutralReply = properties.getTurn().getNeutralReply();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public WebhookResponse invalid(MethodArgumentNotValidException e) {
        logger.warn("Rejected webhook payload: {} field error(s)", e.getBindingResult().getErrorCount());
        return WebhookResponse.success(neutralReply);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public WebhookResponse unreadable(Exception e) {
        logger.warn("Unreadable webhook payload: {}", e.getMessage());
        return WebhookResponse.success(neutralReply);
    }

    @ExceptionHandler(Exception.class)
    public WebhookResponse unexpected(Exception e) {
        logger.error("Unexpected failure handling webhook", e);
        return WebhookResponse.success(neutralReply);
    }
}
