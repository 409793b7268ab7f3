package com.example.honeypot.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per session id, created on demand and dropped when no thread holds or waits for it.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentHashMap<String, LockHolder> locks = new ConcurrentHashMap<>();

    /**
     * @return a lease to close when done, or empty if the lock was not granted within {@code wait}
     */
    public Optional<Lease> tryAcquire(String sessionId, Duration wait) throws InterruptedException {
        LockHolder holder = locks.compute(sessionId, (id, existing) -> {
            LockHolder h = existing != null ? existing : new LockHolder();
            h.users++;
            return h;
        });
        boolean granted = false;
        try {
            long waitNanos = wait == null || wait.isNegative() ? 0 : wait.toNanos();
            granted = holder.lock.tryLock(waitNanos, TimeUnit.NANOSECONDS);
        } finally {
            if (!granted) {
                release(sessionId);
            }
        }
        return granted ? Optional.of(new Lease(sessionId, holder)) : Optional.empty();
    }

    public int activeCount() {
        return locks.size();
    }

    private void release(String sessionId) {
        locks.computeIfPresent(sessionId, (id, h) -> --h.users == 0 ? null : h);
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    public final class Lease implements AutoCloseable {
        private final String sessionId;
        private final LockHolder holder;
        private boolean closed;

        private Lease(String sessionId, LockHolder holder) {
            this.sessionId = sessionId;
            this.holder = holder;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            holder.lock.unlock();
            release(sessionId);
        }
    }
}
