package com.tableadvisor.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableadvisor.common.model.ActionKind;

/** The (kind, display) pair last shown to the user; equal pairs are not re-emitted. */
public record EmittedKey(
    @JsonProperty("kind")    ActionKind kind,
    @JsonProperty("display") String     display
) {}
