package com.example.honeypot.controller;

import com.example.honeypot.kv.KvClient;
import com.example.honeypot.model.CallbackStatus;
import com.example.honeypot.repo.CallbackDeliveryRepo;
import com.example.honeypot.store.TieredSessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final TieredSessionStore sessionStore;
    private final CallbackDeliveryRepo deliveryRepo;

    public HealthController(KvClient kvClient, TieredSessionStore sessionStore, CallbackDeliveryRepo deliveryRepo) {
        this.kvClient = kvClient;
        this.sessionStore = sessionStore;
        this.deliveryRepo = deliveryRepo;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("service", "honeypot-engine");
        health.put("version", "1.0.0");

        // Test Redis connection
        try {
            health.put("redis", kvClient.ping() ? "UP" : "DOWN");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }
        health.put("fallbackMode", sessionStore.isDegraded());
        health.put("fallbackSize", sessionStore.fallbackSize());

        // Delivery ledger doubles as the MongoDB check
        try {
            health.put("failedDeliveries", deliveryRepo.countByStatus(CallbackStatus.FAILED));
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
