package com.tableadvisor.common.model;

/** Named attributes a model response may carry besides its action. */
public enum FieldKey {
    HAND,
    BOARD,
    STAGE,
    POSITION,
    POT,
    AMOUNT_TO_CALL,
    POT_ODDS,
    STACK_TO_POT_RATIO,
    RATIONALE,
    RAISE_SIZE,
    PREDICTED_ACTION,
    PREDICTED_RAISE_SIZE
}
