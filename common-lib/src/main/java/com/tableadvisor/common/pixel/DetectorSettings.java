package com.tableadvisor.common.pixel;

/**
 * Tunable geometry and thresholds of the control detector.
 *
 * <p>Band and sub-band bounds are fractions of the frame: the band is the bottom
 * {@code bandHeightRatio} of the height; sub-bands are {@code [start, end)} of the width.
 */
public record DetectorSettings(
    double bandHeightRatio,
    double primaryBandStart,
    double primaryBandEnd,
    double secondaryBandStart,
    double secondaryBandEnd,
    int    sampleStride,
    double primaryDensityThreshold,
    double secondaryDensityThreshold,
    int    gridColumns,
    int    gridRows,
    double cellDensityThreshold
) {

    /** Fraction of the frame height, measured from the bottom, where the controls live. */
    public static final double DEFAULT_BAND_HEIGHT_RATIO = 0.15;

    public static final int DEFAULT_SAMPLE_STRIDE = 4;

    /** Overall red density needed in the primary sub-band. */
    public static final double DEFAULT_PRIMARY_DENSITY = 0.008;

    public static final double DEFAULT_SECONDARY_DENSITY = 0.008;

    /** Per-cell density for the 2x2 clustering gate; lower than the overall gate. */
    public static final double DEFAULT_CELL_DENSITY = 0.005;

    public DetectorSettings {
        if (sampleStride < 1) sampleStride = 1;
        if (gridColumns < 2) gridColumns = 2;
        if (gridRows < 2) gridRows = 2;
    }

    public static DetectorSettings defaults() {
        return new DetectorSettings(
            DEFAULT_BAND_HEIGHT_RATIO,
            0.0, 0.40,
            0.40, 0.70,
            DEFAULT_SAMPLE_STRIDE,
            DEFAULT_PRIMARY_DENSITY,
            DEFAULT_SECONDARY_DENSITY,
            8, 4,
            DEFAULT_CELL_DENSITY);
    }
}
