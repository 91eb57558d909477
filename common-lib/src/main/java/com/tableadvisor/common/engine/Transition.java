package com.tableadvisor.common.engine;

import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.UiState;

/**
 * Result of one engine operation.
 *
 * @param next       the state the caller must keep for the next event
 * @param state      the UI state after this event, equal to {@code next.currentState()}
 * @param emitted    true when {@code state} must be pushed to the presentation layer
 * @param classified the classification the engine acted on; {@code null} for control events,
 *                   resets and prefixes that carried no action yet
 */
public record Transition(
    EngineState        next,
    UiState            state,
    boolean            emitted,
    ReconcileVerdict   verdict,
    String             reason,
    ClassifiedResponse classified
) {

    static Transition emit(EngineState next, ReconcileVerdict verdict, String reason) {
        return new Transition(next, next.currentState(), true, verdict, reason, null);
    }

    static Transition hold(EngineState next, ReconcileVerdict verdict, String reason) {
        return new Transition(next, next.currentState(), false, verdict, reason, null);
    }

    Transition withClassified(ClassifiedResponse response) {
        return new Transition(next, state, emitted, verdict, reason, response);
    }
}
