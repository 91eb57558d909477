package com.tableadvisor.advisor.service;

import com.tableadvisor.advisor.dto.EngineDiagnostics;
import com.tableadvisor.advisor.dto.ReconcileOutcome;
import com.tableadvisor.advisor.dto.SessionStarted;
import com.tableadvisor.advisor.logger.DecisionFlowLogger;
import com.tableadvisor.advisor.session.AdvisorSession;
import com.tableadvisor.advisor.session.SessionMetrics;
import com.tableadvisor.advisor.session.SessionRegistry;
import com.tableadvisor.common.engine.EngineState;
import com.tableadvisor.common.engine.ReconciliationEngine;
import com.tableadvisor.common.engine.Transition;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.Frame;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.model.UiState;
import com.tableadvisor.common.parser.ResponseParser;
import com.tableadvisor.common.pixel.ControlTransition;
import com.tableadvisor.common.pixel.PixelSignalDetector;
import com.tableadvisor.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

/**
 * Session-scoped front door to the parser, the pixel detector and the reconciliation engine.
 *
 * <p>Every operation that touches a session runs on that session's single-thread scheduler,
 * so events for one session are applied strictly one at a time in arrival order. Operations
 * on an unknown session complete empty; the controller turns that into 404.
 *
 * <p>A failure inside an event is logged and counted, the event is dropped and the error is
 * propagated to the caller; the session state is left as it was before the event.
 */
@Service
public class AdvisorService {

    private static final Logger log = LoggerFactory.getLogger(AdvisorService.class);

    private final SessionRegistry registry;
    private final ReconciliationEngine engine;
    private final PixelSignalDetector detector;
    private final DecisionFlowLogger flowLogger;
    private final Clock clock;

    public AdvisorService(SessionRegistry registry,
                          ReconciliationEngine engine,
                          PixelSignalDetector detector,
                          DecisionFlowLogger flowLogger,
                          Clock clock) {
        this.registry = registry;
        this.engine = engine;
        this.detector = detector;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    public Mono<SessionStarted> startSession() {
        return Mono.fromCallable(() -> {
            AdvisorSession session = registry.start();
            return new SessionStarted(session.getId(), session.getEngineState().currentState());
        });
    }

    /** Emits {@code true} once the session is closed; empty when it was unknown. */
    public Mono<Boolean> stopSession(String sessionId) {
        return Mono.justOrEmpty(registry.remove(sessionId))
            .flatMap(session -> session.close().thenReturn(Boolean.TRUE))
            .doOnNext(stopped -> log.info("[Session] stopped. sessionId={}", sessionId));
    }

    public Mono<UiState> resetSession(String sessionId) {
        return onSession(sessionId, session -> {
            Transition transition = engine.reset();
            session.getMetrics().setResets(session.getMetrics().getResets() + 1);
            apply(session, transition);
            flowLogger.logWithSessionId(DecisionFlowLogger.SESSION_RESET, sessionId);
            return transition.state();
        });
    }

    // ── pixel path ───────────────────────────────────────────────────────────

    /** Runs detection on the caller's thread, then applies the signal in order with other events. */
    public Mono<UiState> submitFrame(String sessionId, Frame frame) {
        return Mono.fromCallable(() -> detector.detect(frame))
            .doOnNext(signal -> flowLogger.logFrame(sessionId, signal))
            .flatMap(signal -> onSession(sessionId, session -> {
                session.getMetrics().setFramesProcessed(session.getMetrics().getFramesProcessed() + 1);
                return applyPixel(session, signal);
            }));
    }

    /** Signal computed by an external detector; treated exactly like one from a frame. */
    public Mono<UiState> submitPixelSignal(String sessionId, PixelSignal signal) {
        PixelSignal pixel = signal == null ? PixelSignal.absent() : signal;
        return onSession(sessionId, session -> {
            session.getMetrics().setFramesProcessed(session.getMetrics().getFramesProcessed() + 1);
            return applyPixel(session, pixel);
        });
    }

    public Mono<UiState> controlAppeared(String sessionId) {
        return TraceContextUtil.withSessionId(
            onSession(sessionId, session -> {
                session.setControlPresent(true);
                return controlEvent(session, engine.onControlAppeared(session.getEngineState()));
            }).doOnEach(flowLogger.stage(DecisionFlowLogger.CONTROL_EVENT)),
            sessionId);
    }

    public Mono<UiState> controlDisappeared(String sessionId) {
        return TraceContextUtil.withSessionId(
            onSession(sessionId, session -> {
                session.setControlPresent(false);
                return controlEvent(session, engine.onControlDisappeared(session.getEngineState()));
            }).doOnEach(flowLogger.stage(DecisionFlowLogger.CONTROL_EVENT)),
            sessionId);
    }

    // ── text path ────────────────────────────────────────────────────────────

    public Mono<ReconcileOutcome> submitResponse(String sessionId, String text) {
        return onSession(sessionId, session -> {
            ClassifiedResponse response = ResponseParser.parse(text);
            flowLogger.logResponse(sessionId, DecisionFlowLogger.RESPONSE_CLASSIFIED, response);

            Transition transition = engine.onResponse(
                session.getEngineState(), response, session.getLastPixel(), Instant.now(clock));
            session.getMetrics().setResponsesProcessed(session.getMetrics().getResponsesProcessed() + 1);
            apply(session, transition);
            return ReconcileOutcome.of(transition);
        });
    }

    /**
     * {@code accumulatedText} is everything received so far for the response in flight.
     * The outcome carries no classification while the prefix still lacks an action keyword.
     */
    public Mono<ReconcileOutcome> submitPartial(String sessionId, String accumulatedText) {
        return onSession(sessionId, session -> {
            Transition transition = engine.onPartial(
                session.getEngineState(), accumulatedText, session.getLastPixel(), Instant.now(clock));
            ClassifiedResponse early = transition.classified();
            if (early != null) {
                flowLogger.logResponse(sessionId, DecisionFlowLogger.PARTIAL_EVALUATED, early);
            } else {
                flowLogger.logWithSessionId(DecisionFlowLogger.PARTIAL_EVALUATED, sessionId);
            }

            session.getMetrics().setPartialsProcessed(session.getMetrics().getPartialsProcessed() + 1);
            apply(session, transition);
            return ReconcileOutcome.of(transition);
        });
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public Mono<UiState> currentState(String sessionId) {
        return onSession(sessionId, session -> session.getEngineState().currentState());
    }

    public Mono<EngineDiagnostics> diagnostics(String sessionId) {
        return onSession(sessionId, session -> {
            EngineState state = session.getEngineState();
            PixelSignal pixel = session.getLastPixel();
            return new EngineDiagnostics(
                sessionId,
                state.currentState(),
                state.waitingStreak(),
                state.actingStreak(),
                state.pixelOverrideStreak(),
                state.lastActingTransitionAt(),
                session.isControlPresent(),
                pixel.confidence(),
                pixel.density(),
                session.getMetrics().copy());
        });
    }

    /** Latest state first, then every emission until the session stops. Empty when unknown. */
    public Mono<Flux<UiState>> stream(String sessionId) {
        return Mono.justOrEmpty(registry.find(sessionId)).map(AdvisorSession::states);
    }

    // ── internals ────────────────────────────────────────────────────────────

    private <T> Mono<T> onSession(String sessionId, Function<AdvisorSession, T> event) {
        return Mono.justOrEmpty(registry.find(sessionId))
            .doOnNext(session -> session.touch(Instant.now(clock)))
            .flatMap(session -> session.submit(() -> runEvent(session, event)));
    }

    private <T> T runEvent(AdvisorSession session, Function<AdvisorSession, T> event) {
        EngineState before = session.getEngineState();
        try {
            T result = event.apply(session);
            session.getMetrics().setLastEventAt(Instant.now(clock));
            return result;
        } catch (RuntimeException e) {
            session.setEngineState(before);
            session.getMetrics().setFailedEvents(session.getMetrics().getFailedEvents() + 1);
            log.error("[Session] event dropped. sessionId={}", session.getId(), e);
            throw e;
        }
    }

    private UiState applyPixel(AdvisorSession session, PixelSignal signal) {
        ControlTransition change = ControlTransition.between(session.isControlPresent(), signal);
        session.setLastPixel(signal);
        session.setControlPresent(change.present());

        if (change.appeared()) {
            return controlEvent(session, engine.onControlAppeared(session.getEngineState()));
        }
        if (change.disappeared()) {
            return controlEvent(session, engine.onControlDisappeared(session.getEngineState()));
        }
        return session.getEngineState().currentState();
    }

    private UiState controlEvent(AdvisorSession session, Transition transition) {
        session.getMetrics().setControlEvents(session.getMetrics().getControlEvents() + 1);
        apply(session, transition);
        return transition.state();
    }

    /** Stores the next engine state, updates counters and publishes when the engine emitted. */
    private void apply(AdvisorSession session, Transition transition) {
        session.setEngineState(transition.next());

        SessionMetrics metrics = session.getMetrics();
        metrics.setLastVerdict(transition.verdict().name());
        metrics.setLastReason(transition.reason());
        switch (transition.verdict()) {
            case SUPPRESSED_EXIT, SUPPRESSED_PIXEL, SUPPRESSED_ENTRY, WITHHELD ->
                metrics.setSuppressions(metrics.getSuppressions() + 1);
            case DUPLICATE -> metrics.setDuplicates(metrics.getDuplicates() + 1);
            case SKIPPED -> metrics.setSkipped(metrics.getSkipped() + 1);
            case UNRECOGNIZED -> metrics.setUnrecognized(metrics.getUnrecognized() + 1);
            default -> { }
        }

        if (transition.emitted()) {
            metrics.setEmissions(metrics.getEmissions() + 1);
            session.publish(transition.state());
        }
        flowLogger.logTransition(session.getId(), transition);
    }
}
