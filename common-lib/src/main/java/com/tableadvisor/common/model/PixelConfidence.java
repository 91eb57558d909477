package com.tableadvisor.common.model;

/**
 * How strongly the pixel heuristic believes it is the user's turn.
 *
 * <ul>
 *   <li>{@link #HIGH}: primary and secondary controls both visible.</li>
 *   <li>{@link #MEDIUM}: primary control only.</li>
 *   <li>{@link #LOW}: no primary control.</li>
 * </ul>
 */
public enum PixelConfidence {
    HIGH,
    MEDIUM,
    LOW;

    public static PixelConfidence from(boolean primaryPresent, boolean secondaryPresent) {
        if (primaryPresent && secondaryPresent) return HIGH;
        if (primaryPresent) return MEDIUM;
        return LOW;
    }
}
