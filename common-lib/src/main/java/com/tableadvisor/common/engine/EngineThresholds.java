package com.tableadvisor.common.engine;

import com.tableadvisor.common.model.PixelConfidence;
import com.tableadvisor.common.parser.ActionDetector;

import java.time.Duration;

/**
 * Tunable constants of the reconciliation engine.
 *
 * <p>The defaults are the values observed to hold up best against real sessions; treat
 * them as knobs, not physical limits.
 */
public record EngineThresholds(
    Duration exitWindow,
    int      exitConfirmations,
    int      pixelEscapeThreshold,
    int      strongEntryConfirmations,
    int      weakEntryConfirmations,
    String   waitingDisplay,
    boolean  readyOnControlAppeared
) {

    /** Minimum time an acting decision stays on screen while the controls are still visible. */
    public static final Duration DEFAULT_EXIT_WINDOW = Duration.ofSeconds(3);

    /** Consecutive waiting responses that end an acting decision inside the exit window. */
    public static final int DEFAULT_EXIT_CONFIRMATIONS = 2;

    /** Consecutive waiting responses against visible controls before the pixel sensor is distrusted. */
    public static final int DEFAULT_PIXEL_ESCAPE_THRESHOLD = 5;

    public static final int DEFAULT_STRONG_ENTRY_CONFIRMATIONS = 1;
    public static final int DEFAULT_WEAK_ENTRY_CONFIRMATIONS = 2;

    public static final String DEFAULT_WAITING_DISPLAY = ActionDetector.WAITING_LABEL;

    public EngineThresholds {
        if (exitWindow == null || exitWindow.isNegative()) exitWindow = DEFAULT_EXIT_WINDOW;
        if (exitConfirmations < 1) exitConfirmations = 1;
        if (pixelEscapeThreshold < 1) pixelEscapeThreshold = 1;
        if (strongEntryConfirmations < 1) strongEntryConfirmations = 1;
        if (weakEntryConfirmations < 1) weakEntryConfirmations = 1;
        if (waitingDisplay == null) waitingDisplay = DEFAULT_WAITING_DISPLAY;
    }

    public static EngineThresholds defaults() {
        return new EngineThresholds(
            DEFAULT_EXIT_WINDOW,
            DEFAULT_EXIT_CONFIRMATIONS,
            DEFAULT_PIXEL_ESCAPE_THRESHOLD,
            DEFAULT_STRONG_ENTRY_CONFIRMATIONS,
            DEFAULT_WEAK_ENTRY_CONFIRMATIONS,
            DEFAULT_WAITING_DISPLAY,
            true);
    }

    /** Acting-like responses needed to leave WAITING/READY at the given pixel confidence. */
    public int requiredEntryConfirmations(PixelConfidence confidence) {
        return confidence == PixelConfidence.LOW ? weakEntryConfirmations : strongEntryConfirmations;
    }
}
