package com.example.honeypot.kv;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean created = (ttl == null || ttl.isZero() || ttl.isNegative())
                ? redis.opsForValue().setIfAbsent(key, value)
                : redis.opsForValue().setIfAbsent(key, value, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public void del(String... keys) {
        redis.delete(Arrays.asList(keys));
    }

    @Override
    public boolean ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(pong);
    }
}
