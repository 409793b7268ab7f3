package com.example.honeypot.config;

import com.example.honeypot.store.FallbackSessionCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService storeExecutor(HoneypotProperties properties) {
        return daemonPool("session-store", properties.getStore().getExecutorThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService turnExecutor(HoneypotProperties properties) {
        return daemonPool("turn-responder", properties.getTurn().getExecutorThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService modelExecutor(HoneypotProperties properties) {
        return daemonPool("language-model", properties.getLlm().getExecutorThreads());
    }

    @Bean
    public FallbackSessionCache fallbackSessionCache(HoneypotProperties properties) {
        return new FallbackSessionCache(
                properties.getStore().getFallbackCapacity(),
                properties.getSession().getTtl(),
                Ticker.systemTicker());
    }

    @Bean
    public WebClient callbackWebClient(WebClient.Builder builder) {
        return builder.build();
    }

    static ExecutorService daemonPool(String name, int threads) {
        int threadCount = threads > 0 ? threads : 4;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
