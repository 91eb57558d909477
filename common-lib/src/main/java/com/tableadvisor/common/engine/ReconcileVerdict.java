package com.tableadvisor.common.engine;

/** Why an engine operation did or did not change what the user sees. */
public enum ReconcileVerdict {
    /** A new state was shown. */
    COMMITTED,
    /** Same (kind, display) as the last emission; pinned fields refreshed only. */
    DUPLICATE,
    /** Not a game scene. Nothing changed. */
    SKIPPED,
    /** Streaks counted and fields refreshed, but there was nothing to show. */
    UNRECOGNIZED,
    /** Leaving ACTING too soon while the controls are still up. */
    SUPPRESSED_EXIT,
    /** Text says waiting while the pixels say it is the user's turn. */
    SUPPRESSED_PIXEL,
    /** Not enough consecutive acting responses yet. */
    SUPPRESSED_ENTRY,
    /** Acting-like prefix held back until the rationale arrives. */
    WITHHELD,
    /** Control appeared; the next acting response needs fewer confirmations. */
    SEEDED,
    IGNORED,
    RESET
}
