package com.tableadvisor.common.model;

/**
 * Closed taxonomy of what a single model response recommends.
 *
 * <h3>Grouping</h3>
 * <ul>
 *   <li>Waiting-like ({@link #WAITING}, {@link #READY}): it is not the user's turn yet.</li>
 *   <li>Acting-like (everything else): the user must act now.</li>
 *   <li>{@link #SKIP}: not a game scene at all; never touches engine state.</li>
 * </ul>
 */
public enum ActionKind {
    FOLD,
    RAISE,
    CALL,
    CHECK,
    ALL_IN,
    READY,
    WAITING,
    SKIP,
    UNRECOGNIZED;

    public boolean isWaitingLike() {
        return this == WAITING || this == READY;
    }

    /** True for the five kinds that can be shown as an {@link ActingKind}. */
    public boolean isConcreteAction() {
        return this == FOLD || this == RAISE || this == CALL || this == CHECK || this == ALL_IN;
    }

    /**
     * Maps a concrete action onto the {@link UiState} sub-kind.
     *
     * @return the acting sub-kind, or {@code null} when this kind is not a concrete action
     */
    public ActingKind toActingKind() {
        return switch (this) {
            case FOLD   -> ActingKind.FOLD;
            case RAISE  -> ActingKind.RAISE;
            case CALL   -> ActingKind.CALL;
            case CHECK  -> ActingKind.CHECK;
            case ALL_IN -> ActingKind.ALL_IN;
            default     -> null;
        };
    }
}
