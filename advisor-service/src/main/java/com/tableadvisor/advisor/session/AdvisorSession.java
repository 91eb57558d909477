package com.tableadvisor.advisor.session;

import com.tableadvisor.common.engine.EngineState;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.model.UiState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * One advisor session: engine state, last pixel verdict and the emission stream.
 *
 * <p>All events run on a dedicated single-thread scheduler, so the mutable fields below are
 * only ever touched by one thread at a time. Engine state is replaced wholesale after each
 * event, never edited in place.
 */
public class AdvisorSession {

    private static final Logger log = LoggerFactory.getLogger(AdvisorSession.class);

    private final String id;
    private final Scheduler scheduler;

    /** Replays the latest state to late subscribers so a new overlay never starts blank. */
    private final Sinks.Many<UiState> sink = Sinks.many().replay().latest();

    private final SessionMetrics metrics = new SessionMetrics();

    private EngineState engineState = EngineState.initial();
    private PixelSignal lastPixel = PixelSignal.absent();
    private boolean controlPresent;

    /** Written from request threads, read by the idle sweep. */
    private volatile Instant lastActivityAt;

    public AdvisorSession(String id, Instant startedAt) {
        this.id = id;
        this.scheduler = Schedulers.newSingle("advisor-session-" + id, true);
        this.metrics.setStartedAt(startedAt);
        this.lastActivityAt = startedAt;
        this.sink.tryEmitNext(engineState.currentState());
    }

    public String getId() {
        return id;
    }

    /** Runs {@code event} on the session's scheduler. A {@code null} result completes empty. */
    public <T> Mono<T> submit(Callable<T> event) {
        return Mono.fromCallable(event).subscribeOn(scheduler);
    }

    public Flux<UiState> states() {
        return sink.asFlux();
    }

    /** Must be called on the session scheduler. */
    public void publish(UiState state) {
        Sinks.EmitResult result = sink.tryEmitNext(state);
        if (result.isFailure()) {
            log.warn("[Session] emission dropped. sessionId={} result={}", id, result);
        }
    }

    /** Completes the stream on the session scheduler, then releases the scheduler. */
    public Mono<Void> close() {
        return submit(() -> {
                sink.tryEmitComplete();
                return Boolean.TRUE;
            })
            .then()
            .doFinally(signal -> scheduler.dispose());
    }

    public EngineState getEngineState() {
        return engineState;
    }

    public void setEngineState(EngineState engineState) {
        this.engineState = engineState;
    }

    public PixelSignal getLastPixel() {
        return lastPixel;
    }

    public void setLastPixel(PixelSignal lastPixel) {
        this.lastPixel = lastPixel;
    }

    public boolean isControlPresent() {
        return controlPresent;
    }

    public void setControlPresent(boolean controlPresent) {
        this.controlPresent = controlPresent;
    }

    public void touch(Instant at) {
        this.lastActivityAt = at;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public SessionMetrics getMetrics() {
        return metrics;
    }
}
