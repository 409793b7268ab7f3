package com.example.honeypot.store;

import com.example.honeypot.model.Session;

import java.time.Duration;

/**
 * Persistence of session state. Implementations never surface backend failures to callers.
 */
public interface SessionStore {

    /**
     * @return the stored session, or a fresh default session when none exists or it has expired
     */
    Session load(String sessionId);

    void save(String sessionId, Session session, Duration ttl);

    /**
     * Atomically claims the right to send the final report for a session.
     *
     * @return {@code true} for exactly one caller per session; {@code false} for every later caller
     */
    boolean tryClaimCallback(String sessionId);

    void delete(String sessionId);

    boolean isDegraded();
}
