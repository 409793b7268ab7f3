package com.example.honeypot.store;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.kv.KvClient;
import com.example.honeypot.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Redis-backed session store with an in-process fallback tier.
 * <p>
 * Every remote call is bounded by {@code honeypot.store.remote-timeout}. The first remote failure switches the
 * store into degraded mode: reads and writes are served by {@link FallbackSessionCache} until
 * {@link #probeRemote()} sees the remote tier answer again. Writes always go through to the fallback tier too.
 * Sessions written, claimed or deleted while degraded are replayed to the remote tier before the store leaves
 * degraded mode, and {@link #load(String)} takes the newer copy when both tiers hold one.
 * <p>
 * While degraded, state is local to this process and is not shared with other instances.
 */
@Service
public class TieredSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(TieredSessionStore.class);

    private static final String CLAIMED = "1";

    private final KvClient kvClient;
    private final FallbackSessionCache fallback;
    private final SessionCodec codec;
    private final ExecutorService storeExecutor;
    private final String keyPrefix;
    private final String claimKeyPrefix;
    private final Duration sessionTtl;
    private final long remoteTimeoutMs;
    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final Set<String> pendingWrites = ConcurrentHashMap.newKeySet();
    private final Set<String> pendingDeletes = ConcurrentHashMap.newKeySet();

    public TieredSessionStore(KvClient kvClient,
                              FallbackSessionCache fallback,
                              SessionCodec codec,
                              @Qualifier("storeExecutor") ExecutorService storeExecutor,
                              HoneypotProperties properties) {
        this.kvClient = kvClient;
        this.fallback = fallback;
        this.codec = codec;
        this.storeExecutor = storeExecutor;
        this.keyPrefix = properties.getSession().getKeyPrefix();
        this.claimKeyPrefix = properties.getSession().getClaimKeyPrefix();
        this.sessionTtl = properties.getSession().getTtl();
        this.remoteTimeoutMs = properties.getStore().getRemoteTimeout().toMillis();
    }

    @Override
    public Session load(String sessionId) {
        String key = sessionKey(sessionId);
        String claimKey = claimKey(sessionId);

        Optional<String> stored = Optional.empty();
        boolean claimed = fallback.isClaimed(claimKey);
        if (!degraded.get()) {
            try {
                stored = remote("GET", key, () -> kvClient.get(key));
                if (!claimed) {
                    claimed = remote("EXISTS", claimKey, () -> kvClient.exists(claimKey));
                }
            } catch (RemoteStoreException e) {
                degrade("load", sessionId, e);
            }
        }
        Optional<Session> remoteCopy = stored.flatMap(json -> codec.decode(sessionId, json));
        Optional<Session> localCopy = fallback.get(key).flatMap(json -> codec.decode(sessionId, json));

        Session session = newer(remoteCopy, localCopy)
                .orElseGet(() -> {
                    logger.info("Starting new session {}", sessionId);
                    return Session.fresh(sessionId);
                });
        if (claimed) {
            session.markCallbackSent();
        }
        return session;
    }

    @Override
    public void save(String sessionId, Session session, Duration ttl) {
        String key = sessionKey(sessionId);
        session.setUpdatedAt(Instant.now());
        String json = codec.encode(session);

        fallback.put(key, json, ttl);
        if (degraded.get()) {
            pendingWrites.add(sessionId);
            logger.debug("Session {} saved to fallback tier only", sessionId);
            return;
        }
        try {
            remote("SET", key, () -> {
                kvClient.set(key, json, ttl);
                return Boolean.TRUE;
            });
        } catch (RemoteStoreException e) {
            pendingWrites.add(sessionId);
            degrade("save", sessionId, e);
        }
    }

    @Override
    public boolean tryClaimCallback(String sessionId) {
        String claimKey = claimKey(sessionId);
        if (fallback.isClaimed(claimKey)) {
            return false;
        }
        if (!degraded.get()) {
            try {
                boolean won = remote("SETNX", claimKey, () -> kvClient.setIfAbsent(claimKey, CLAIMED, sessionTtl));
                fallback.markClaimed(claimKey);
                return won;
            } catch (RemoteStoreException e) {
                degrade("claim", sessionId, e);
            }
        }
        boolean won = fallback.claim(claimKey);
        if (won) {
            pendingWrites.add(sessionId);
        }
        return won;
    }

    @Override
    public void delete(String sessionId) {
        String key = sessionKey(sessionId);
        String claimKey = claimKey(sessionId);
        fallback.remove(key);
        fallback.forgetClaim(claimKey);
        pendingWrites.remove(sessionId);
        if (degraded.get()) {
            pendingDeletes.add(sessionId);
            return;
        }
        try {
            remote("DEL", key, () -> {
                kvClient.del(key, claimKey);
                return Boolean.TRUE;
            });
        } catch (RemoteStoreException e) {
            pendingDeletes.add(sessionId);
            degrade("delete", sessionId, e);
        }
    }

    @Override
    public boolean isDegraded() {
        return degraded.get();
    }

    public long fallbackSize() {
        return fallback.size();
    }

    /**
     * Pings the remote tier and, when it answers, replays what was changed while degraded before leaving
     * degraded mode.
     *
     * @return whether the remote tier is in use after the probe
     */
    public boolean probeRemote() {
        if (!degraded.get()) {
            return true;
        }
        try {
            if (!remote("PING", "-", kvClient::ping)) {
                return false;
            }
            replayPending();
            if (degraded.compareAndSet(true, false)) {
                logger.info("Remote session store reachable again, resuming remote persistence");
            }
            // changes that raced with the switch
            replayPending();
            return true;
        } catch (RemoteStoreException e) {
            logger.debug("Remote session store still unreachable: {}", e.getMessage());
            degraded.set(true);
            return false;
        }
    }

    int pendingCount() {
        return pendingWrites.size() + pendingDeletes.size();
    }

    private void replayPending() {
        int replayed = 0;
        while (!pendingDeletes.isEmpty() || !pendingWrites.isEmpty()) {
            for (String sessionId : List.copyOf(pendingDeletes)) {
                pendingDeletes.remove(sessionId);
                String key = sessionKey(sessionId);
                String claimKey = claimKey(sessionId);
                try {
                    remote("DEL", key, () -> {
                        kvClient.del(key, claimKey);
                        return Boolean.TRUE;
                    });
                } catch (RemoteStoreException e) {
                    pendingDeletes.add(sessionId);
                    throw e;
                }
                replayed++;
            }
            for (String sessionId : List.copyOf(pendingWrites)) {
                pendingWrites.remove(sessionId);
                try {
                    replayWrite(sessionId);
                } catch (RemoteStoreException e) {
                    pendingWrites.add(sessionId);
                    throw e;
                }
                replayed++;
            }
        }
        if (replayed > 0) {
            logger.info("Replayed {} session change(s) from the fallback tier to the remote store", replayed);
        }
    }

    private void replayWrite(String sessionId) {
        String key = sessionKey(sessionId);
        String claimKey = claimKey(sessionId);
        Optional<String> json = fallback.get(key);
        if (json.isPresent()) {
            Optional<Session> remoteCopy = remote("GET", key, () -> kvClient.get(key))
                    .flatMap(stored -> codec.decode(sessionId, stored));
            Optional<Session> localCopy = json.flatMap(stored -> codec.decode(sessionId, stored));
            if (localCopy.isPresent() && newer(remoteCopy, localCopy).orElse(null) == localCopy.get()) {
                remote("SET", key, () -> {
                    kvClient.set(key, json.get(), sessionTtl);
                    return Boolean.TRUE;
                });
            }
        }
        if (fallback.isClaimed(claimKey)) {
            remote("SETNX", claimKey, () -> kvClient.setIfAbsent(claimKey, CLAIMED, sessionTtl));
        }
    }

    /**
     * The copy with more turns, then the later write. Ties go to the remote copy.
     */
    static Optional<Session> newer(Optional<Session> remoteCopy, Optional<Session> localCopy) {
        if (remoteCopy.isEmpty()) return localCopy;
        if (localCopy.isEmpty()) return remoteCopy;
        Comparator<Session> order = Comparator.comparingInt(Session::getTurnCount)
                .thenComparing(Session::getUpdatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        return order.compare(localCopy.get(), remoteCopy.get()) > 0 ? localCopy : remoteCopy;
    }

    private <T> T remote(String operation, String key, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, storeExecutor);
        try {
            return future.get(remoteTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RemoteStoreException(operation + " " + key + " timed out after " + remoteTimeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RemoteStoreException(operation + " " + key + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteStoreException(operation + " " + key + " interrupted", e);
        }
    }

    private void degrade(String operation, String sessionId, RemoteStoreException e) {
        if (degraded.compareAndSet(false, true)) {
            logger.warn("Remote session store unavailable during {} for session {}, switching to fallback tier: {}",
                    operation, sessionId, e.getMessage());
        } else {
            logger.debug("Remote session store still unavailable during {} for session {}", operation, sessionId);
        }
    }

    private String sessionKey(String sessionId) {
        return keyPrefix + sessionId;
    }

    private String claimKey(String sessionId) {
        return claimKeyPrefix + sessionId;
    }
}
