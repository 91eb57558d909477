package com.tableadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory outcome of cross-checking a response's hand-strength claims against the
 * cards it reports. Informational only, never alters the classified action.
 */
public record ConsistencyVerdict(
    @JsonProperty("confidence") Level  confidence,
    @JsonProperty("issue")      String issue
) {

    public enum Level { HIGH, MEDIUM, LOW }

    public ConsistencyVerdict {
        if (confidence == null) confidence = Level.MEDIUM;
        if (issue == null) issue = "";
    }

    public static ConsistencyVerdict high() {
        return new ConsistencyVerdict(Level.HIGH, "");
    }

    public static ConsistencyVerdict medium() {
        return new ConsistencyVerdict(Level.MEDIUM, "");
    }

    public static ConsistencyVerdict low(String issue) {
        return new ConsistencyVerdict(Level.LOW, issue);
    }
}
