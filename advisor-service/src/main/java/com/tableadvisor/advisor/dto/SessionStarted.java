package com.tableadvisor.advisor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableadvisor.common.model.UiState;

public record SessionStarted(
    @JsonProperty("sessionId") String  sessionId,
    @JsonProperty("state")     UiState state
) {}
