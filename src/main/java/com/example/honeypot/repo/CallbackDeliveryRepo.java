package com.example.honeypot.repo;

import com.example.honeypot.model.CallbackDeliveryRecord;
import com.example.honeypot.model.CallbackStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CallbackDeliveryRepo extends MongoRepository<CallbackDeliveryRecord, String> {
    List<CallbackDeliveryRecord> findBySessionIdOrderByTsAsc(String sessionId);
    long countByStatus(CallbackStatus status);
}
