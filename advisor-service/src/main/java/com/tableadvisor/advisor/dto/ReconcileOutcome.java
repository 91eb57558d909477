package com.tableadvisor.advisor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableadvisor.common.engine.ReconcileVerdict;
import com.tableadvisor.common.engine.Transition;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.UiState;

/**
 * What one submitted response (or partial) did: how it was classified and what the engine
 * made of it. {@code classified} is null for a partial that carried no action yet.
 */
public record ReconcileOutcome(
    @JsonProperty("classified") ClassifiedResponse classified,
    @JsonProperty("state")      UiState            state,
    @JsonProperty("emitted")    boolean            emitted,
    @JsonProperty("verdict")    ReconcileVerdict   verdict,
    @JsonProperty("reason")     String             reason
) {

    public static ReconcileOutcome of(Transition transition) {
        return new ReconcileOutcome(transition.classified(), transition.state(), transition.emitted(),
                                    transition.verdict(), transition.reason());
    }
}
