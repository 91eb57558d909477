package com.tableadvisor.advisor.logger;

import com.tableadvisor.common.engine.Transition;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage an event passes through on its way to (or short of) the overlay.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #FRAME_CLASSIFIED}    pixel detector produced a signal</li>
 *   <li>{@link #RESPONSE_CLASSIFIED} a complete response was parsed</li>
 *   <li>{@link #PARTIAL_EVALUATED}   a streamed prefix was considered for an early decision</li>
 *   <li>{@link #STATE_EMITTED}       the engine committed a new UI state</li>
 *   <li>{@link #STATE_SUPPRESSED}    a guard held the current state</li>
 *   <li>{@link #CONTROL_EVENT}       control buttons appeared or disappeared</li>
 *   <li>{@link #SESSION_RESET}       engine state returned to initial</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the session id from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.CONTROL_EVENT))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String FRAME_CLASSIFIED    = "FRAME_CLASSIFIED";
    public static final String RESPONSE_CLASSIFIED = "RESPONSE_CLASSIFIED";
    public static final String PARTIAL_EVALUATED   = "PARTIAL_EVALUATED";
    public static final String STATE_EMITTED       = "STATE_EMITTED";
    public static final String STATE_SUPPRESSED    = "STATE_SUPPRESSED";
    public static final String CONTROL_EVENT       = "CONTROL_EVENT";
    public static final String SESSION_RESET       = "SESSION_RESET";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext}.
     * The session id comes from the signal's Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(sessionId, () ->
                log.info("[DecisionFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }

    public void logWithSessionId(String stageName, String sessionId) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DecisionFlow] stage={} sessionId={}", stageName, sessionId)
        );
    }

    public void logFrame(String sessionId, PixelSignal signal) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.debug("[Pixel] stage={} primary={} secondary={} confidence={} density={} sessionId={}",
                      FRAME_CLASSIFIED,
                      signal.primaryControlPresent(), signal.secondaryControlPresent(),
                      signal.confidence(), signal.density(), sessionId)
        );
    }

    public void logResponse(String sessionId, String stageName, ClassifiedResponse response) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DecisionFlow] stage={} action={} display=\"{}\" consistency={} sessionId={}",
                     stageName, response.actionKind(), response.displayText(),
                     response.consistency().confidence(), sessionId)
        );
    }

    /** Emitted transitions log at INFO, held ones at DEBUG. */
    public void logTransition(String sessionId, Transition transition) {
        TraceContextUtil.withMdc(sessionId, () -> {
            if (transition.emitted()) {
                log.info("[Reconcile] stage={} phase={} display=\"{}\" verdict={} sessionId={}",
                         STATE_EMITTED, transition.state().phase(), transition.state().display(),
                         transition.verdict(), sessionId);
            } else {
                log.debug("[Reconcile] stage={} verdict={} reason=\"{}\" sessionId={}",
                          STATE_SUPPRESSED, transition.verdict(), transition.reason(), sessionId);
            }
        });
    }
}
