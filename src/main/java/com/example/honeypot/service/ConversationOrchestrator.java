package com.example.honeypot.service;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Classification;
import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.model.Message;
import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.model.Sender;
import com.example.honeypot.model.Session;
import com.example.honeypot.model.TerminationReason;
import com.example.honeypot.model.WebhookRequest;
import com.example.honeypot.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one inbound message through detection, extraction, reply and termination for its session.
 * <p>
 * All work for a session happens while holding that session's lock, so turns of one session never interleave.
 * A turn that cannot finish inside {@code honeypot.turn.budget} answers with the fallback reply and leaves
 * the stored session untouched.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final SessionStore sessionStore;
    private final ScamClassifier classifier;
    private final SecondaryScamSignal scamSignal;
    private final IntelligenceExtractor extractor;
    private final Responder responder;
    private final TerminationPolicy terminationPolicy;
    private final CallbackDispatcher dispatcher;
    private final SessionLockRegistry lockRegistry;
    private final ExecutorService turnExecutor;
    private final Clock clock;
    private final HoneypotProperties.TurnSettings turn;
    private final HoneypotProperties.SessionSettings sessionSettings;
    private final Duration remoteTimeout;
    private final Duration deliveryBudget;

    public ConversationOrchestrator(SessionStore sessionStore,
                                    ScamClassifier classifier,
                                    SecondaryScamSignal scamSignal,
                                    IntelligenceExtractor extractor,
                                    Responder responder,
                                    TerminationPolicy terminationPolicy,
                                    CallbackDispatcher dispatcher,
                                    SessionLockRegistry lockRegistry,
                                    @Qualifier("turnExecutor") ExecutorService turnExecutor,
                                    Clock clock,
                                    HoneypotProperties properties) {
        this.sessionStore = sessionStore;
        this.classifier = classifier;
        this.scamSignal = scamSignal;
        this.extractor = extractor;
        this.responder = responder;
        this.terminationPolicy = terminationPolicy;
        this.dispatcher = dispatcher;
        this.lockRegistry = lockRegistry;
        this.turnExecutor = turnExecutor;
        this.clock = clock;
        this.turn = properties.getTurn();
        this.sessionSettings = properties.getSession();
        this.remoteTimeout = properties.getStore().getRemoteTimeout();
        this.deliveryBudget = properties.getCallback().getDeliveryBudget();
    }

    public TurnOutcome handle(WebhookRequest request) {
        String sessionId = request.getSessionId();
        Instant deadline = clock.instant().plus(turn.getBudget());
        try {
            Optional<SessionLockRegistry.Lease> lease = lockRegistry.tryAcquire(sessionId, remaining(deadline));
            if (lease.isEmpty()) {
                logger.warn("Session {} busy for the whole turn budget, answering with fallback reply", sessionId);
                return TurnOutcome.abandoned(sessionId, turn.getFallbackReply());
            }
            try (SessionLockRegistry.Lease held = lease.get()) {
                return runTurn(request, deadline);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Turn for session {} interrupted", sessionId);
            return TurnOutcome.abandoned(sessionId, turn.getFallbackReply());
        } catch (RuntimeException e) {
            logger.error("Turn for session {} failed, answering with fallback reply", sessionId, e);
            return TurnOutcome.abandoned(sessionId, turn.getFallbackReply());
        }
    }

    private TurnOutcome runTurn(WebhookRequest request, Instant deadline) {
        String sessionId = request.getSessionId();
        Session session = sessionStore.load(sessionId);
        applyMetadata(session, request.getMetadata());

        String inboundText = request.getMessage().getText();
        List<String> history = historyTexts(request, session);
        String reply = turn.getFallbackReply();
        DispatchResult dispatch = DispatchResult.SKIPPED;

        TurnStage stage = TurnStage.DETECT;
        while (stage != TurnStage.DONE) {
            logger.debug("Session {} entering {}", sessionId, stage);
            switch (stage) {
                case DETECT -> detect(session, request, history);
                case EXTRACT -> session.setExtractedIntelligence(
                        extractor.extract(inboundText, history, session.getExtractedIntelligence()));
                case RESPOND -> {
                    reply = respond(session, inboundText, deadline);
                    if (!clock.instant().isBefore(deadline)) {
                        logger.warn("Session {} ran past its turn budget, discarding turn", sessionId);
                        return TurnOutcome.abandoned(sessionId, turn.getFallbackReply());
                    }
                    session.appendMessage(Message.builder()
                            .sender(Sender.AGENT)
                            .text(reply)
                            .timestamp(clock.instant())
                            .build()
                            .truncated(sessionSettings.getMaxStoredTextLength()),
                            sessionSettings.getMaxStoredMessages());
                }
                case EVALUATE_TERMINATION -> {
                    TerminationReason reason = terminationPolicy.evaluate(session, inboundText);
                    if (reason != session.getTerminationReason()) {
                        logger.info("Session {} terminated: {}", sessionId, reason.getWireName());
                    }
                    session.setTerminationReason(reason);
                    session.setAgentNotes(summarize(session));
                    dispatch = dispatcher.maybeDispatch(session, dispatchBudget(deadline));
                }
                default -> {
                }
            }
            stage = stage.next(session.getScamLevel());
        }

        sessionStore.save(sessionId, session, sessionSettings.getTtl());
        return new TurnOutcome(sessionId, reply, session.getScamLevel(), session.getTerminationReason(),
                dispatch, true);
    }

    private void detect(Session session, WebhookRequest request, List<String> history) {
        Message inbound = request.getMessage().toMessage();
        session.appendMessage(inbound.truncated(sessionSettings.getMaxStoredTextLength()),
                sessionSettings.getMaxStoredMessages());
        session.advanceTurn();

        Classification result = classifier.classify(inbound.getText(), request.getMessage().getSender(),
                history, session.getScamLevel());
        if (!result.ruleFired() && !session.isConfirmed()) {
            Optional<ScamLevel> signal = scamSignal.score(inbound.getText(), history);
            if (signal.isPresent()) {
                result = classifier.combine(result, signal.get());
            }
        }
        ScamLevel before = session.getScamLevel();
        session.raiseLevel(result.level(), result.confidence());
        if (session.getScamLevel() != before) {
            logger.info("Session {} raised from {} to {} ({})", session.getSessionId(),
                    before.getWireName(), session.getScamLevel().getWireName(), result.matchedRules());
        }
    }

    private String respond(Session session, String inboundText, Instant deadline) {
        Duration timeout = min(turn.getResponderTimeout(), remaining(deadline));
        if (timeout.isZero()) {
            return turn.getFallbackReply();
        }
        ResponderRequest responderRequest = new ResponderRequest(
                session.getSessionId(),
                inboundText,
                session.getMessages(),
                session.getScamLevel(),
                session.getTurnCount(),
                session.getLanguage());
        Future<String> future = turnExecutor.submit(() -> responder.reply(responderRequest));
        try {
            String reply = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (reply == null || reply.isBlank()) {
                logger.warn("Responder returned nothing for session {}, using fallback reply", session.getSessionId());
                return turn.getFallbackReply();
            }
            return reply.trim();
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Responder timed out after {}ms for session {}, using fallback reply",
                    timeout.toMillis(), session.getSessionId());
            return turn.getFallbackReply();
        } catch (ExecutionException e) {
            logger.warn("Responder failed for session {}, using fallback reply: {}",
                    session.getSessionId(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return turn.getFallbackReply();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return turn.getFallbackReply();
        }
    }

    /**
     * Leaves room for the final save; never longer than the configured delivery budget.
     */
    private Duration dispatchBudget(Instant deadline) {
        return min(deliveryBudget, remaining(deadline).minus(remoteTimeout));
    }

    private List<String> historyTexts(WebhookRequest request, Session session) {
        List<String> texts = new ArrayList<>();
        List<WebhookRequest.MessageInput> provided = request.getConversationHistory();
        if (provided != null && !provided.isEmpty()) {
            for (WebhookRequest.MessageInput input : provided) {
                if (input != null && input.getText() != null) {
                    texts.add(input.getText());
                }
            }
            return texts;
        }
        for (Message message : session.getMessages()) {
            if (message.getSender() == Sender.SCAMMER && message.getText() != null) {
                texts.add(message.getText());
            }
        }
        return texts;
    }

    private void applyMetadata(Session session, WebhookRequest.Metadata metadata) {
        if (metadata == null) {
            return;
        }
        if (metadata.getChannel() != null) {
            session.setChannel(metadata.getChannel());
        }
        if (metadata.getLanguage() != null) {
            session.setLanguage(metadata.getLanguage());
        }
    }

    static String summarize(Session session) {
        ExtractedIntelligence intel = session.getExtractedIntelligence() != null
                ? session.getExtractedIntelligence() : ExtractedIntelligence.empty();
        StringBuilder notes = new StringBuilder()
                .append("Level ").append(session.getScamLevel().getWireName())
                .append(" after ").append(session.getTurnCount()).append(" turn(s).");
        if (intel.highValueCount() > 0) {
            notes.append(" Extracted ")
                    .append(intel.getUpiIds().size()).append(" UPI id(s), ")
                    .append(intel.getBankAccounts().size()).append(" account(s), ")
                    .append(intel.getPhoneNumbers().size()).append(" phone(s), ")
                    .append(intel.getPhishingLinks().size()).append(" link(s).");
        }
        if (!intel.getSuspiciousKeywords().isEmpty()) {
            notes.append(" Keywords: ").append(String.join(", ", intel.getSuspiciousKeywords())).append('.');
        }
        if (session.getTerminationReason() != null && session.getTerminationReason().isTerminal()) {
            notes.append(" Ended: ").append(session.getTerminationReason().getWireName()).append('.');
        }
        return notes.toString();
    }

    private Duration remaining(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Duration min(Duration a, Duration b) {
        Duration smaller = a.compareTo(b) <= 0 ? a : b;
        return smaller.isNegative() ? Duration.ZERO : smaller;
    }
}
