package com.example.honeypot.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process tier used while the remote store is unreachable. Bounded by entry count; every entry
 * expires a fixed time after its last write, like the remote keys. Contents do not survive a restart.
 */
public class FallbackSessionCache {

    private final Cache<String, Entry> sessions;
    private final Cache<String, Boolean> claims;

    public FallbackSessionCache(int capacity, Duration claimTtl, Ticker ticker) {
        this.sessions = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfter(new WriteTtlExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.claims = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfterWrite(claimTtl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<String> get(String key) {
        Entry entry = sessions.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.json());
    }

    public void put(String key, String json, Duration ttl) {
        sessions.put(key, new Entry(json, ttl));
    }

    public void remove(String key) {
        sessions.invalidate(key);
    }

    public void forgetClaim(String key) {
        claims.invalidate(key);
    }

    /**
     * @return {@code true} only for the first caller for {@code key}
     */
    public boolean claim(String key) {
        return claims.asMap().putIfAbsent(key, Boolean.TRUE) == null;
    }

    public void markClaimed(String key) {
        claims.put(key, Boolean.TRUE);
    }

    public boolean isClaimed(String key) {
        return claims.getIfPresent(key) != null;
    }

    public long size() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }

    private record Entry(String json, Duration ttl) {
    }

    private static final class WriteTtlExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return nanos(value.ttl());
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return nanos(value.ttl());
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long nanos(Duration ttl) {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                return Long.MAX_VALUE;
            }
            return ttl.toNanos();
        }
    }
}
