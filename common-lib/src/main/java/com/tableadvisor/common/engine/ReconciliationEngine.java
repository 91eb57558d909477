package com.tableadvisor.common.engine;

import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.model.UiPhase;
import com.tableadvisor.common.model.UiState;
import com.tableadvisor.common.parser.ActionDetector;
import com.tableadvisor.common.parser.ResponseParser;

import java.time.Duration;
import java.time.Instant;

/**
 * Fuses the text classification and the pixel signal into one flicker-free {@link UiState}.
 *
 * <p>Stateless: every operation takes the caller's {@link EngineState} and returns a
 * {@link Transition} carrying the next one. Callers must serialise events per session.
 *
 * <p>Guard order for one response:
 * <ol>
 *   <li>skip: nothing changes</li>
 *   <li>streak update; unrecognized responses stop here and clear the pixel contradiction streak</li>
 *   <li>exit from ACTING: needs absent controls, an elapsed window, or repeated waiting</li>
 *   <li>pixel contradiction: waiting text against visible controls, until the escape threshold</li>
 *   <li>entry into ACTING: confirmations scaled by pixel confidence</li>
 *   <li>de-duplication against the last emission</li>
 *   <li>commit</li>
 * </ol>
 * No operation throws.
 */
public class ReconciliationEngine {

    private final EngineThresholds thresholds;

    public ReconciliationEngine(EngineThresholds thresholds) {
        this.thresholds = thresholds == null ? EngineThresholds.defaults() : thresholds;
    }

    public EngineThresholds thresholds() {
        return thresholds;
    }

    /**
     * Applies one complete response. Clears the early-decision flag so the next response
     * may be streamed again.
     *
     * <p>When a prefix of this same response was already counted in the same direction,
     * the streaks are not counted a second time.
     */
    public Transition onResponse(EngineState state, ClassifiedResponse response, PixelSignal pixel, Instant now) {
        EngineState current = state == null ? EngineState.initial() : state;
        boolean alreadyCounted = response != null && current.partialDecided() && countedSameDirection(current, response);
        return reconcile(current.withPartialDecided(false), response, pixel, now, !alreadyCounted)
            .withClassified(response);
    }

    /**
     * Evaluates a growing prefix of a response still being streamed.
     *
     * <p>Nothing happens until an {@code ACTION} keyword has arrived, and only the first
     * prefix that reaches the guards counts. Waiting-like prefixes go straight through;
     * acting-like ones are withheld until the rationale starts, because the rationale may
     * still overrule the declared action.
     */
    public Transition onPartial(EngineState state, String accumulatedText, PixelSignal pixel, Instant now) {
        EngineState current = state == null ? EngineState.initial() : state;
        if (current.partialDecided()) {
            return Transition.hold(current, ReconcileVerdict.IGNORED, "response already decided early");
        }
        if (!ResponseParser.declaresAction(accumulatedText)) {
            return Transition.hold(current, ReconcileVerdict.IGNORED, "no action keyword yet");
        }

        ClassifiedResponse early = ResponseParser.parse(accumulatedText);
        ActionKind kind = early.actionKind();
        if (kind == ActionKind.SKIP || kind == ActionKind.UNRECOGNIZED) {
            return Transition.hold(current, ReconcileVerdict.IGNORED, "early classification " + kind)
                .withClassified(early);
        }
        if (!kind.isWaitingLike() && !ResponseParser.rationaleStarted(accumulatedText)) {
            return Transition.hold(current, ReconcileVerdict.WITHHELD, "acting prefix waits for rationale")
                .withClassified(early);
        }

        Transition t = reconcile(current, early, pixel, now, true);
        EngineState decided = t.next().withPartialDecided(true);
        return new Transition(decided, decided.currentState(), t.emitted(), t.verdict(),
            "early: " + t.reason(), early);
    }

    /** Controls just appeared: the next acting response needs one confirmation at most. */
    public Transition onControlAppeared(EngineState state) {
        EngineState current = state == null ? EngineState.initial() : state;
        EngineState seeded = current.seedActing(1);

        UiState shown = seeded.currentState();
        if (thresholds.readyOnControlAppeared()
                && shown.phase() == UiPhase.WAITING
                && !shown.pinnedFields().isEmpty()) {
            UiState ready = UiState.ready(ActionDetector.READY_LABEL, shown.pinnedFields());
            EngineState next = seeded.committed(ready,
                new EmittedKey(ActionKind.READY, ActionDetector.READY_LABEL), seeded.lastActingTransitionAt());
            return Transition.emit(next, ReconcileVerdict.COMMITTED, "control appeared with pinned advice");
        }
        return Transition.hold(seeded, ReconcileVerdict.SEEDED, "actingStreak=" + seeded.actingStreak());
    }

    /** Controls just vanished: the user acted, so any advice on screen is void. */
    public Transition onControlDisappeared(EngineState state) {
        EngineState current = state == null ? EngineState.initial() : state;
        UiState before = current.currentState();
        UiState waiting = UiState.waiting(thresholds.waitingDisplay(), before.pinnedFields());

        EngineState next = new EngineState(waiting, 0, 0, current.lastActingTransitionAt(), 0,
            new EmittedKey(ActionKind.WAITING, thresholds.waitingDisplay()), current.partialDecided());

        if (waiting.sameHeadline(before)) {
            return Transition.hold(next, ReconcileVerdict.DUPLICATE, "already waiting");
        }
        return Transition.emit(next, ReconcileVerdict.COMMITTED, "control disappeared");
    }

    public Transition reset() {
        return Transition.emit(EngineState.initial(), ReconcileVerdict.RESET, "session reset");
    }

    // ── guards ───────────────────────────────────────────────────────────────

    private Transition reconcile(EngineState state,
                                 ClassifiedResponse response,
                                 PixelSignal pixelOrNull,
                                 Instant now,
                                 boolean countStreak) {
        PixelSignal pixel = pixelOrNull == null ? PixelSignal.absent() : pixelOrNull;
        Instant at = now == null ? Instant.now() : now;
        if (response == null) {
            return Transition.hold(state, ReconcileVerdict.IGNORED, "no response");
        }
        ActionKind kind = response.actionKind();

        if (kind == ActionKind.SKIP) {
            return Transition.hold(state, ReconcileVerdict.SKIPPED, "not a game scene");
        }

        int step = countStreak ? 1 : 0;
        boolean waitingLike = kind.isWaitingLike();
        EngineState s = waitingLike ? state.countWaiting(step) : state.countActing(step);

        if (kind == ActionKind.UNRECOGNIZED) {
            return Transition.hold(refreshPinned(s.withPixelOverrideStreak(0), response), ReconcileVerdict.UNRECOGNIZED,
                "unrecognized action '" + response.displayText() + "'");
        }

        UiPhase phase = s.currentState().phase();
        boolean exitArbitrated = false;

        if (phase == UiPhase.ACTING && waitingLike) {
            boolean controlsGone = !pixel.primaryControlPresent();
            boolean windowElapsed = s.lastActingTransitionAt() == null
                || Duration.between(s.lastActingTransitionAt(), at).compareTo(thresholds.exitWindow()) >= 0;
            boolean confirmed = s.waitingStreak() >= thresholds.exitConfirmations();
            if (!controlsGone && !windowElapsed && !confirmed) {
                return Transition.hold(refreshPinned(s, response), ReconcileVerdict.SUPPRESSED_EXIT,
                    "waitingStreak=" + s.waitingStreak() + " inside exit window");
            }
            exitArbitrated = true;
        }

        if (waitingLike && pixel.primaryControlPresent() && !exitArbitrated) {
            int streak = s.pixelOverrideStreak() + step;
            if (streak < thresholds.pixelEscapeThreshold()) {
                return Transition.hold(refreshPinned(s.withPixelOverrideStreak(streak), response),
                    ReconcileVerdict.SUPPRESSED_PIXEL, "pixelOverrideStreak=" + streak);
            }
        }
        s = s.withPixelOverrideStreak(0);

        if (phase != UiPhase.ACTING && !waitingLike) {
            int required = thresholds.requiredEntryConfirmations(pixel.confidence());
            if (s.actingStreak() < required) {
                return Transition.hold(s, ReconcileVerdict.SUPPRESSED_ENTRY,
                    "actingStreak=" + s.actingStreak() + " required=" + required
                        + " confidence=" + pixel.confidence());
            }
        }

        s = refreshPinned(s, response);
        EmittedKey key = new EmittedKey(kind, displayFor(response));
        if (key.equals(s.lastEmitted())) {
            return Transition.hold(s, ReconcileVerdict.DUPLICATE, "same as last emission");
        }

        return commit(s, kind, key, at);
    }

    private Transition commit(EngineState s, ActionKind kind, EmittedKey key, Instant now) {
        UiState pinnedFrom = s.currentState();
        UiState next = switch (kind) {
            case WAITING -> UiState.waiting(key.display(), pinnedFrom.pinnedFields());
            case READY   -> UiState.ready(key.display(), pinnedFrom.pinnedFields());
            default      -> UiState.acting(kind.toActingKind(), key.display(), pinnedFrom.pinnedFields());
        };
        Instant actingAt = next.phase() == UiPhase.ACTING ? now : s.lastActingTransitionAt();
        return Transition.emit(s.committed(next, key, actingAt), ReconcileVerdict.COMMITTED,
            next.phase() + " " + key.display());
    }

    private String displayFor(ClassifiedResponse response) {
        return response.actionKind() == ActionKind.WAITING ? thresholds.waitingDisplay() : response.displayText();
    }

    /** Replaces the pinned fields with the response's fields when it carries any. */
    private static EngineState refreshPinned(EngineState s, ClassifiedResponse response) {
        if (response.fields().isEmpty()) return s;
        return s.withCurrentState(s.currentState().withPinnedFields(response.fields()));
    }

    private static boolean countedSameDirection(EngineState s, ClassifiedResponse response) {
        if (response.actionKind() == ActionKind.SKIP) return false;
        return response.isWaitingLike() ? s.waitingStreak() > 0 : s.actingStreak() > 0;
    }
}
