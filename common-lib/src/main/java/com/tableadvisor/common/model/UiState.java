package com.tableadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The single externally visible decision, an immutable value snapshot.
 *
 * <p>{@code actingKind} is non-null only when {@code phase == ACTING}.
 * {@code pinnedFields} hold the last known-good attributes; they survive transitions
 * into {@link UiPhase#WAITING} so the overlay does not blank out between turns.
 */
public record UiState(
    @JsonProperty("phase")        UiPhase        phase,
    @JsonProperty("actingKind")   ActingKind     actingKind,
    @JsonProperty("display")      String         display,
    @JsonProperty("pinnedFields") ResponseFields pinnedFields
) {

    public UiState {
        if (phase == null) phase = UiPhase.WAITING;
        if (phase != UiPhase.ACTING) actingKind = null;
        if (display == null) display = "";
        if (pinnedFields == null) pinnedFields = ResponseFields.empty();
    }

    public static UiState waiting(String display, ResponseFields pinned) {
        return new UiState(UiPhase.WAITING, null, display, pinned);
    }

    public static UiState ready(String display, ResponseFields pinned) {
        return new UiState(UiPhase.READY, null, display, pinned);
    }

    public static UiState acting(ActingKind kind, String display, ResponseFields pinned) {
        return new UiState(UiPhase.ACTING, kind, display, pinned);
    }

    public UiState withPinnedFields(ResponseFields pinned) {
        return new UiState(phase, actingKind, display, pinned);
    }

    /** Same phase, sub-kind and label; ignores pinned fields. */
    public boolean sameHeadline(UiState other) {
        return other != null
            && phase == other.phase
            && actingKind == other.actingKind
            && display.equals(other.display);
    }
}
