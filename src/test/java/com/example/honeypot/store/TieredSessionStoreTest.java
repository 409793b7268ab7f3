package com.example.honeypot.store;

import com.example.honeypot.TestFixtures;
import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Message;
import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.model.Sender;
import com.example.honeypot.model.Session;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TieredSessionStoreTest {

    private static final Duration TTL = Duration.ofHours(1);

    private HoneypotProperties properties;
    private InMemoryKvClient kvClient;
    private ExecutorService storeExecutor;
    private TieredSessionStore store;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getStore().setRemoteTimeout(Duration.ofMillis(200));
        kvClient = new InMemoryKvClient();
        storeExecutor = Executors.newCachedThreadPool();
        store = newStore();
    }

    /**
     * A store over the same Redis stand-in with its own empty fallback tier, as a second instance would see it.
     */
    private TieredSessionStore newStore() {
        return new TieredSessionStore(
                kvClient,
                new FallbackSessionCache(100, TTL, Ticker.systemTicker()),
                new SessionCodec(TestFixtures.objectMapper(), properties),
                storeExecutor,
                properties);
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdownNow();
    }

    private static Session sampleSession(String id) {
        Session session = Session.fresh(id);
        session.appendMessage(Message.builder()
                .sender(Sender.SCAMMER)
                .text("Your KYC is pending")
                .timestamp(Instant.parse("2026-01-01T10:00:00Z"))
                .build(), 4);
        session.advanceTurn();
        session.raiseLevel(ScamLevel.SUSPECTED, 0.6);
        return session;
    }

    @Test
    void testLoadUnknownSessionReturnsFreshDefault() {
        Session session = store.load("unknown");

        assertEquals("unknown", session.getSessionId());
        assertEquals(0, session.getTurnCount());
        assertEquals(ScamLevel.SAFE, session.getScamLevel());
        assertFalse(session.isCallbackSent());
        assertTrue(session.getMessages().isEmpty());
    }

    @Test
    void testSaveThenLoadRoundTripsThroughRemoteTier() {
        store.save("s1", sampleSession("s1"), TTL);

        assertTrue(kvClient.data().containsKey("honeypot:session:s1"));
        Session loaded = store.load("s1");
        assertEquals(1, loaded.getTurnCount());
        assertEquals(ScamLevel.SUSPECTED, loaded.getScamLevel());
        assertEquals("Your KYC is pending", loaded.getMessages().get(0).getText());
        assertFalse(store.isDegraded());
    }

    @Test
    void testUnreadableStoredStateStartsFresh() {
        kvClient.data().put("honeypot:session:s1", "{not json");

        Session loaded = store.load("s1");

        assertEquals("s1", loaded.getSessionId());
        assertEquals(0, loaded.getTurnCount());
    }

    @Test
    void testRemoteFailureSwitchesToFallbackTier() {
        kvClient.setFailing(true);

        store.save("s1", sampleSession("s1"), TTL);

        assertTrue(store.isDegraded());
        Session loaded = store.load("s1");
        assertEquals(1, loaded.getTurnCount());
        assertEquals(1, store.fallbackSize());
    }

    @Test
    void testRemoteTimeoutCountsAsFailure() {
        kvClient.setDelayMs(1_000);

        Session loaded = store.load("slow");

        assertTrue(store.isDegraded());
        assertEquals("slow", loaded.getSessionId());
    }

    @Test
    void testDegradedStoreStopsCallingRemote() {
        kvClient.setFailing(true);
        store.load("s1");
        int callsAfterFailure = kvClient.calls();

        store.save("s1", sampleSession("s1"), TTL);
        store.load("s1");

        assertEquals(callsAfterFailure, kvClient.calls());
    }

    @Test
    void testProbeRestoresRemoteTier() {
        kvClient.setFailing(true);
        store.save("s1", sampleSession("s1"), TTL);
        assertTrue(store.isDegraded());

        assertFalse(store.probeRemote());
        assertTrue(store.isDegraded());

        kvClient.setFailing(false);
        assertTrue(store.probeRemote());
        assertFalse(store.isDegraded());

        // written while degraded, still found after recovery on this instance
        assertEquals(1, store.load("s1").getTurnCount());

        store.save("s2", sampleSession("s2"), TTL);
        assertTrue(kvClient.data().containsKey("honeypot:session:s2"));
    }

    private static Session sessionAt(String id, int turns, ScamLevel level) {
        Session session = sampleSession(id);
        for (int i = 1; i < turns; i++) {
            session.advanceTurn();
        }
        session.raiseLevel(level, level == ScamLevel.CONFIRMED ? 0.9 : 0.6);
        return session;
    }

    @Test
    void testRecoveryKeepsTurnsWrittenWhileDegraded() {
        store.save("s1", sessionAt("s1", 1, ScamLevel.SUSPECTED), TTL);
        kvClient.setFailing(true);
        store.save("s1", sessionAt("s1", 2, ScamLevel.CONFIRMED), TTL);
        assertTrue(store.isDegraded());

        kvClient.setFailing(false);
        assertTrue(store.probeRemote());

        Session loaded = store.load("s1");
        assertEquals(2, loaded.getTurnCount());
        assertEquals(ScamLevel.CONFIRMED, loaded.getScamLevel());
        assertEquals(0, store.pendingCount());

        Session remote = newStore().load("s1");
        assertEquals(2, remote.getTurnCount());
        assertEquals(ScamLevel.CONFIRMED, remote.getScamLevel());
    }

    @Test
    void testFailedReplayStaysDegraded() {
        kvClient.setFailing(true);
        store.save("s1", sessionAt("s1", 2, ScamLevel.SUSPECTED), TTL);

        assertFalse(store.probeRemote());
        assertTrue(store.isDegraded());
        assertEquals(1, store.pendingCount());
    }

    @Test
    void testReplayDoesNotOverwriteNewerRemoteCopy() {
        kvClient.setFailing(true);
        store.save("s1", sessionAt("s1", 2, ScamLevel.SUSPECTED), TTL);

        kvClient.setFailing(false);
        newStore().save("s1", sessionAt("s1", 5, ScamLevel.CONFIRMED), TTL);
        assertTrue(store.probeRemote());

        assertEquals(5, newStore().load("s1").getTurnCount());
        assertEquals(5, store.load("s1").getTurnCount());
    }

    @Test
    void testClaimWhileDegradedReachesRemoteOnRecovery() {
        kvClient.setFailing(true);
        assertTrue(store.tryClaimCallback("s1"));

        kvClient.setFailing(false);
        assertTrue(store.probeRemote());

        assertTrue(kvClient.data().containsKey("honeypot:callback:s1"));
        assertFalse(newStore().tryClaimCallback("s1"));
    }

    @Test
    void testDeleteWhileDegradedReachesRemoteOnRecovery() {
        store.save("s1", sessionAt("s1", 3, ScamLevel.SUSPECTED), TTL);
        kvClient.setFailing(true);
        store.delete("s1");

        kvClient.setFailing(false);
        assertTrue(store.probeRemote());

        assertFalse(kvClient.data().containsKey("honeypot:session:s1"));
        assertEquals(0, store.load("s1").getTurnCount());
    }

    @Test
    void testNewerCopyPrefersMoreTurns() {
        Session remote = sessionAt("s1", 3, ScamLevel.SUSPECTED);
        Session local = sessionAt("s1", 2, ScamLevel.CONFIRMED);

        assertSame(remote, TieredSessionStore.newer(Optional.of(remote), Optional.of(local)).orElseThrow());
        assertSame(local, TieredSessionStore.newer(Optional.empty(), Optional.of(local)).orElseThrow());

        Session later = sessionAt("s1", 3, ScamLevel.SUSPECTED);
        remote.setUpdatedAt(Instant.parse("2026-01-01T10:00:00Z"));
        later.setUpdatedAt(Instant.parse("2026-01-01T10:05:00Z"));
        assertSame(later, TieredSessionStore.newer(Optional.of(remote), Optional.of(later)).orElseThrow());
    }

    @Test
    void testConcurrentClaimsGrantExactlyOne() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<Boolean> claim = () -> {
                    start.await();
                    return store.tryClaimCallback("s1");
                };
                results.add(pool.submit(claim));
            }
            start.countDown();

            int won = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) won++;
            }
            assertEquals(1, won);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testClaimWhileDegradedIsGrantedOnce() {
        kvClient.setFailing(true);

        assertTrue(store.tryClaimCallback("s1"));
        assertFalse(store.tryClaimCallback("s1"));
        assertTrue(store.isDegraded());
    }

    @Test
    void testClaimSurvivesStaleSave() {
        store.save("s1", sampleSession("s1"), TTL);
        assertTrue(store.tryClaimCallback("s1"));

        // a copy loaded before the claim must not revert it
        Session stale = sampleSession("s1");
        store.save("s1", stale, TTL);

        assertTrue(store.load("s1").isCallbackSent());
        assertFalse(store.tryClaimCallback("s1"));
    }

    @Test
    void testLoadSeesClaimMadeByAnotherInstance() {
        kvClient.data().put("honeypot:callback:s1", "1");

        assertTrue(store.load("s1").isCallbackSent());
    }

    @Test
    void testDeleteRemovesSessionAndClaim() {
        store.save("s1", sampleSession("s1"), TTL);
        store.tryClaimCallback("s1");

        store.delete("s1");

        assertFalse(kvClient.data().containsKey("honeypot:session:s1"));
        assertFalse(kvClient.data().containsKey("honeypot:callback:s1"));
        Session reloaded = store.load("s1");
        assertEquals(0, reloaded.getTurnCount());
        assertFalse(reloaded.isCallbackSent());
    }
}
