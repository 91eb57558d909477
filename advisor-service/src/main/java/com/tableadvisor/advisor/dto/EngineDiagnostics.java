package com.tableadvisor.advisor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableadvisor.advisor.session.SessionMetrics;
import com.tableadvisor.common.model.PixelConfidence;
import com.tableadvisor.common.model.UiState;

import java.time.Instant;

/**
 * Read-only snapshot of a session's engine internals, for tuning and troubleshooting.
 */
public record EngineDiagnostics(
    @JsonProperty("sessionId")              String          sessionId,
    @JsonProperty("state")                  UiState         state,
    @JsonProperty("waitingStreak")          int             waitingStreak,
    @JsonProperty("actingStreak")           int             actingStreak,
    @JsonProperty("pixelOverrideStreak")    int             pixelOverrideStreak,
    @JsonProperty("lastActingTransitionAt") Instant         lastActingTransitionAt,
    @JsonProperty("controlPresent")         boolean         controlPresent,
    @JsonProperty("lastPixelConfidence")    PixelConfidence lastPixelConfidence,
    @JsonProperty("lastPixelDensity")       double          lastPixelDensity,
    @JsonProperty("metrics")                SessionMetrics  metrics
) {}
