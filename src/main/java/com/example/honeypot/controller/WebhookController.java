package com.example.honeypot.controller;

import com.example.honeypot.model.WebhookRequest;
import com.example.honeypot.model.WebhookResponse;
import com.example.honeypot.service.ConversationOrchestrator;
import com.example.honeypot.service.TurnOutcome;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

    private final ConversationOrchestrator orchestrator;

    public WebhookController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/webhook", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public WebhookResponse webhook(@Valid @RequestBody WebhookRequest request) {
        TurnOutcome outcome = orchestrator.handle(request);
        logger.debug("Session {} turn finished: level={}, reason={}, dispatch={}, committed={}",
                outcome.sessionId(), outcome.level(), outcome.terminationReason(), outcome.dispatch(),
                outcome.committed());
        return WebhookResponse.success(outcome.reply());
    }
}
