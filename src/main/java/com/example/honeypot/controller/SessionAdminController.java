package com.example.honeypot.controller;

import com.example.honeypot.model.CallbackDeliveryRecord;
import com.example.honeypot.model.Session;
import com.example.honeypot.repo.CallbackDeliveryRepo;
import com.example.honeypot.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operator access to stored sessions.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionAdminController {

    private static final Logger logger = LoggerFactory.getLogger(SessionAdminController.class);

    private final SessionStore sessionStore;
    private final CallbackDeliveryRepo deliveryRepo;

    public SessionAdminController(SessionStore sessionStore, CallbackDeliveryRepo deliveryRepo) {
        this.sessionStore = sessionStore;
        this.deliveryRepo = deliveryRepo;
    }

    /**
     * Unknown or expired ids answer with a fresh default session, as the store does.
     */
    @GetMapping("/{sessionId}")
    public Session get(@PathVariable String sessionId) {
        return sessionStore.load(sessionId);
    }

    @GetMapping("/{sessionId}/deliveries")
    public List<CallbackDeliveryRecord> deliveries(@PathVariable String sessionId) {
        return deliveryRepo.findBySessionIdOrderByTsAsc(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String sessionId) {
        sessionStore.delete(sessionId);
        logger.info("Session {} deleted on request", sessionId);
        return ResponseEntity.ok(Map.of("status", "deleted", "sessionId", sessionId));
    }
}
