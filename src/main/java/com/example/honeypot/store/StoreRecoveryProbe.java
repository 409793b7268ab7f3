package com.example.honeypot.store;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StoreRecoveryProbe {

    private final TieredSessionStore sessionStore;

    public StoreRecoveryProbe(TieredSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${honeypot.store.recovery-probe-ms:10000}",
            initialDelayString = "${honeypot.store.recovery-probe-ms:10000}")
    public void run() {
        if (sessionStore.isDegraded()) {
            sessionStore.probeRemote();
        }
    }
}
