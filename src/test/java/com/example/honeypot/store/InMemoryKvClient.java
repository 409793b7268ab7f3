package com.example.honeypot.store;

import com.example.honeypot.kv.KvClient;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed stand-in for Redis that can be switched into failing or slow mode. TTLs are ignored.
 */
public class InMemoryKvClient implements KvClient {

    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean failing;
    private volatile long delayMs;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    public Map<String, String> data() {
        return data;
    }

    public int calls() {
        return calls.get();
    }

    private void checkAvailable() {
        calls.incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failing) {
            throw new IllegalStateException("Connection refused");
        }
    }

    @Override
    public Optional<String> get(String key) {
        checkAvailable();
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        checkAvailable();
        data.put(key, value);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        checkAvailable();
        return data.putIfAbsent(key, value) == null;
    }

    @Override
    public boolean exists(String key) {
        checkAvailable();
        return data.containsKey(key);
    }

    @Override
    public void del(String... keys) {
        checkAvailable();
        for (String key : keys) {
            data.remove(key);
        }
    }

    @Override
    public boolean ping() {
        checkAvailable();
        return true;
    }
}
