package com.example.honeypot.kv;

import java.time.Duration;
import java.util.Optional;

public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    /** Conditional set; {@code true} only for the caller that created the key. */
    boolean setIfAbsent(String key, String value, Duration ttl);
    boolean exists(String key);
    void del(String... keys);
    boolean ping();
}
