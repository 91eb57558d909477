package com.tableadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-frame verdict of the pixel detector.
 *
 * <p>{@code confidence} is always derived from the two presence flags; the value passed
 * to the canonical constructor is ignored so the record can never be self-inconsistent.
 * {@code density} is diagnostic only.
 */
public record PixelSignal(
    @JsonProperty("primaryControlPresent")   boolean         primaryControlPresent,
    @JsonProperty("secondaryControlPresent") boolean         secondaryControlPresent,
    @JsonProperty("density")                 double          density,
    @JsonProperty("confidence")              PixelConfidence confidence
) {

    private static final PixelSignal ABSENT = of(false, false, 0.0);

    public PixelSignal {
        confidence = PixelConfidence.from(primaryControlPresent, secondaryControlPresent);
    }

    public static PixelSignal of(boolean primary, boolean secondary, double density) {
        return new PixelSignal(primary, secondary, density, null);
    }

    /** Default signal for degenerate frames and for sessions that have seen no frame yet. */
    public static PixelSignal absent() {
        return ABSENT;
    }
}
