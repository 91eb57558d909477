package com.tableadvisor.advisor.session;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-session counters.
 *
 * Mutated only on the session's event scheduler; read through {@link #copy()} so callers
 * always see a consistent snapshot.
 */
@Data
@NoArgsConstructor
public class SessionMetrics {

    private Instant startedAt;

    private Instant lastEventAt;

    private long framesProcessed;

    private long responsesProcessed;

    private long partialsProcessed;

    private long controlEvents;

    private long emissions;

    /** SUPPRESSED_EXIT, SUPPRESSED_PIXEL, SUPPRESSED_ENTRY and WITHHELD outcomes. */
    private long suppressions;

    private long duplicates;

    private long skipped;

    private long unrecognized;

    private long resets;

    private long failedEvents;

    private String lastVerdict;

    private String lastReason;

    public SessionMetrics copy() {
        SessionMetrics copy = new SessionMetrics();
        copy.setStartedAt(startedAt);
        copy.setLastEventAt(lastEventAt);
        copy.setFramesProcessed(framesProcessed);
        copy.setResponsesProcessed(responsesProcessed);
        copy.setPartialsProcessed(partialsProcessed);
        copy.setControlEvents(controlEvents);
        copy.setEmissions(emissions);
        copy.setSuppressions(suppressions);
        copy.setDuplicates(duplicates);
        copy.setSkipped(skipped);
        copy.setUnrecognized(unrecognized);
        copy.setResets(resets);
        copy.setFailedEvents(failedEvents);
        copy.setLastVerdict(lastVerdict);
        copy.setLastReason(lastReason);
        return copy;
    }
}
