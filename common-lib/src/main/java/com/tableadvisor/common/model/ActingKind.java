package com.tableadvisor.common.model;

/** Sub-kind carried by {@link UiPhase#ACTING}. */
public enum ActingKind {
    RAISE,
    CALL,
    CHECK,
    FOLD,
    ALL_IN
}
