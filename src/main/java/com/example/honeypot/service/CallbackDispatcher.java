package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.CallbackDeliveryRecord;
import com.example.honeypot.model.CallbackStatus;
import com.example.honeypot.model.FinalReport;
import com.example.honeypot.model.Session;
import com.example.honeypot.repo.CallbackDeliveryRepo;
import com.example.honeypot.store.SessionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends the final report of a confirmed, terminated session at most once.
 * <p>
 * The only gate is {@link SessionStore#tryClaimCallback(String)}: whoever wins the claim sends, everyone else
 * backs off. A claim is never released, so a delivery that fails permanently or exhausts its retries is
 * recorded and not attempted again.
 */
@Service
public class CallbackDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CallbackDispatcher.class);

    private final SessionStore sessionStore;
    private final WebClient webClient;
    private final CallbackDeliveryRepo deliveryRepo;
    private final ObjectMapper objectMapper;
    private final Executor ledgerExecutor;
    private final HoneypotProperties.CallbackSettings settings;

    public CallbackDispatcher(SessionStore sessionStore,
                              WebClient callbackWebClient,
                              CallbackDeliveryRepo deliveryRepo,
                              ObjectMapper objectMapper,
                              @Qualifier("storeExecutor") Executor ledgerExecutor,
                              HoneypotProperties properties) {
        this.sessionStore = sessionStore;
        this.webClient = callbackWebClient;
        this.deliveryRepo = deliveryRepo;
        this.objectMapper = objectMapper;
        this.ledgerExecutor = ledgerExecutor;
        this.settings = properties.getCallback();
    }

    public DispatchResult maybeDispatch(Session session) {
        return maybeDispatch(session, settings.getDeliveryBudget());
    }

    /**
     * Claims and delivers the report if the session qualifies, within {@code budget}. Updates
     * {@code callbackSent} and {@code callbackStatus} on the given session; the caller persists it.
     * An empty budget defers the report without claiming it.
     */
    public DispatchResult maybeDispatch(Session session, Duration budget) {
        String sessionId = session.getSessionId();
        if (!session.isConfirmed() || session.getTerminationReason() == null
                || !session.getTerminationReason().isTerminal()) {
            logger.debug("Session {} not eligible for final report (level={}, reason={})",
                    sessionId, session.getScamLevel(), session.getTerminationReason());
            return DispatchResult.SKIPPED;
        }
        if (session.isCallbackSent()) {
            logger.debug("Final report for session {} already claimed", sessionId);
            return DispatchResult.SKIPPED;
        }
        if (budget != null && (budget.isZero() || budget.isNegative())) {
            logger.warn("No time left to deliver final report for session {}, deferring to a later turn", sessionId);
            return DispatchResult.DEFERRED;
        }
        if (!sessionStore.tryClaimCallback(sessionId)) {
            logger.info("Final report for session {} claimed by another request", sessionId);
            session.markCallbackSent();
            return DispatchResult.ALREADY_CLAIMED;
        }
        session.markCallbackSent();

        FinalReport report = FinalReport.from(session);
        logger.info("Claimed final report for session {} (reason={}, messages={})",
                sessionId, session.getTerminationReason().getWireName(), report.totalMessagesExchanged());

        DeliveryAttempt attempt = deliver(report, budget);
        session.setCallbackStatus(attempt.delivered() ? CallbackStatus.DELIVERED : CallbackStatus.FAILED);
        record(report, attempt);
        return attempt.delivered() ? DispatchResult.DELIVERED : DispatchResult.FAILED;
    }

    DeliveryAttempt deliver(FinalReport report, Duration budget) {
        AtomicInteger attempts = new AtomicInteger();
        Duration blockFor = budget == null || budget.isZero() || budget.isNegative()
                ? settings.getDeliveryBudget() : budget;
        Duration attemptTimeout = settings.getAttemptTimeout().compareTo(blockFor) <= 0
                ? settings.getAttemptTimeout() : blockFor;
        try {
            ResponseEntity<Void> response = Mono.defer(() -> {
                        attempts.incrementAndGet();
                        return webClient.post()
                                .uri(settings.getUrl())
                                .contentType(MediaType.APPLICATION_JSON)
                                .bodyValue(report)
                                .retrieve()
                                .toBodilessEntity()
                                .timeout(attemptTimeout);
                    })
                    .retryWhen(Retry.backoff(Math.max(0, settings.getMaxAttempts() - 1), settings.getInitialBackoff())
                            .maxBackoff(settings.getMaxBackoff())
                            .filter(CallbackDispatcher::isTransient)
                            .doBeforeRetry(signal -> logger.warn(
                                    "Final report for session {} failed on attempt {}, retrying: {}",
                                    report.sessionId(), signal.totalRetries() + 1, describe(signal.failure())))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block(blockFor);
            Integer status = response != null ? response.getStatusCode().value() : null;
            logger.info("Final report for session {} delivered after {} attempt(s), status {}",
                    report.sessionId(), attempts.get(), status);
            return DeliveryAttempt.delivered(attempts.get(), status);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (isTransient(e)) {
                logger.error("Final report for session {} not delivered after {} attempt(s), last status {}",
                        report.sessionId(), attempts.get(), status);
            } else {
                logger.error("Final report for session {} rejected with status {}, not retrying",
                        report.sessionId(), status);
            }
            return DeliveryAttempt.failed(attempts.get(), status, describe(e));
        } catch (RuntimeException e) {
            logger.error("Final report for session {} not delivered after {} attempt(s): {}",
                    report.sessionId(), attempts.get(), describe(e));
            return DeliveryAttempt.failed(attempts.get(), null, describe(e));
        }
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) t).getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return t instanceof WebClientRequestException
                || t instanceof TimeoutException
                || t instanceof IOException;
    }

    private void record(FinalReport report, DeliveryAttempt attempt) {
        CallbackDeliveryRecord record = CallbackDeliveryRecord.builder()
                .sessionId(report.sessionId())
                .status(attempt.delivered() ? CallbackStatus.DELIVERED : CallbackStatus.FAILED)
                .attempts(attempt.attempts())
                .httpStatus(attempt.httpStatus())
                .error(attempt.error())
                .ts(Instant.now())
                .payload(objectMapper.convertValue(report, new TypeReference<Map<String, Object>>() {}))
                .build();
        CompletableFuture.runAsync(() -> deliveryRepo.save(record), ledgerExecutor)
                .exceptionally(e -> {
                    logger.warn("Could not record delivery outcome for session {}: {}",
                            report.sessionId(), describe(e));
                    return null;
                });
    }

    private static String describe(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    record DeliveryAttempt(boolean delivered, int attempts, Integer httpStatus, String error) {

        static DeliveryAttempt delivered(int attempts, Integer httpStatus) {
            return new DeliveryAttempt(true, attempts, httpStatus, null);
        }

        static DeliveryAttempt failed(int attempts, Integer httpStatus, String error) {
            return new DeliveryAttempt(false, attempts, httpStatus, error);
        }
    }
}
