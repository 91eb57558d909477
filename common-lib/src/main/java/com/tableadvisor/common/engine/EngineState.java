package com.tableadvisor.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableadvisor.common.model.UiState;

import java.time.Instant;

/**
 * Everything the engine remembers between events for one session.
 *
 * <p>Immutable: every engine operation returns a new value and the session swaps it in
 * with a single assignment. {@code waitingStreak} and {@code actingStreak} are mutually
 * exclusive; at most one is non-zero.
 *
 * @param lastActingTransitionAt when ACTING was last committed; {@code null} before the first
 * @param lastEmitted            {@code null} until the first commit
 * @param partialDecided         a streamed prefix of the current response already went through the guards
 */
public record EngineState(
    @JsonProperty("currentState")           UiState    currentState,
    @JsonProperty("waitingStreak")          int        waitingStreak,
    @JsonProperty("actingStreak")           int        actingStreak,
    @JsonProperty("lastActingTransitionAt") Instant    lastActingTransitionAt,
    @JsonProperty("pixelOverrideStreak")    int        pixelOverrideStreak,
    @JsonProperty("lastEmitted")            EmittedKey lastEmitted,
    @JsonProperty("partialDecided")         boolean    partialDecided
) {

    private static final EngineState INITIAL =
        new EngineState(UiState.waiting("", null), 0, 0, null, 0, null, false);

    public EngineState {
        if (currentState == null) currentState = UiState.waiting("", null);
    }

    public static EngineState initial() {
        return INITIAL;
    }

    EngineState countWaiting(int increment) {
        return new EngineState(currentState, waitingStreak + increment, 0,
            lastActingTransitionAt, pixelOverrideStreak, lastEmitted, partialDecided);
    }

    EngineState countActing(int increment) {
        return new EngineState(currentState, 0, actingStreak + increment,
            lastActingTransitionAt, pixelOverrideStreak, lastEmitted, partialDecided);
    }

    /** Raises {@code actingStreak} to at least {@code minimum}; clears the waiting streak. */
    EngineState seedActing(int minimum) {
        return new EngineState(currentState, 0, Math.max(actingStreak, minimum),
            lastActingTransitionAt, pixelOverrideStreak, lastEmitted, partialDecided);
    }

    EngineState withPixelOverrideStreak(int streak) {
        return new EngineState(currentState, waitingStreak, actingStreak,
            lastActingTransitionAt, streak, lastEmitted, partialDecided);
    }

    EngineState withCurrentState(UiState state) {
        return new EngineState(state, waitingStreak, actingStreak,
            lastActingTransitionAt, pixelOverrideStreak, lastEmitted, partialDecided);
    }

    EngineState withPartialDecided(boolean decided) {
        return new EngineState(currentState, waitingStreak, actingStreak,
            lastActingTransitionAt, pixelOverrideStreak, lastEmitted, decided);
    }

    EngineState committed(UiState state, EmittedKey emitted, Instant actingAt) {
        return new EngineState(state, waitingStreak, actingStreak,
            actingAt, pixelOverrideStreak, emitted, partialDecided);
    }
}
