package com.tableadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the field parser for one model response, complete or a growing prefix.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@link ActionKind#SKIP} means "not a game scene" and must never update engine state.</li>
 *   <li>{@link ActionKind#FOLD} is terminal for the response that produced it: later
 *       reconciliation of the same text never moves it away from FOLD.</li>
 * </ul>
 */
public record ClassifiedResponse(
    @JsonProperty("actionKind")  ActionKind         actionKind,
    @JsonProperty("displayText") String             displayText,
    @JsonProperty("fields")      ResponseFields     fields,
    @JsonProperty("consistency") ConsistencyVerdict consistency
) {

    public ClassifiedResponse {
        if (actionKind == null) actionKind = ActionKind.UNRECOGNIZED;
        if (displayText == null) displayText = "";
        if (fields == null) fields = ResponseFields.empty();
        if (consistency == null) consistency = ConsistencyVerdict.medium();
    }

    public static ClassifiedResponse of(ActionKind kind, String display, ResponseFields fields) {
        return new ClassifiedResponse(kind, display, fields, ConsistencyVerdict.medium());
    }

    public ClassifiedResponse withAction(ActionKind kind, String display) {
        return new ClassifiedResponse(kind, display, fields, consistency);
    }

    public boolean isWaitingLike() {
        return actionKind.isWaitingLike();
    }
}
