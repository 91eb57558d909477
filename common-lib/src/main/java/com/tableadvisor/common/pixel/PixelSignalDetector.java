package com.tableadvisor.common.pixel;

import com.tableadvisor.common.model.Frame;
import com.tableadvisor.common.model.PixelSignal;

/**
 * Decides from raw pixels whether the "your turn" controls are on screen.
 *
 * <p>Only the bottom band of the frame is sampled. The primary control (the red fold
 * button) is searched in the left sub-band and must pass two gates:
 * <ol>
 *   <li>density: the share of red samples exceeds {@code primaryDensityThreshold};</li>
 *   <li>clustering: some 2x2 block of adjacent grid cells is red above
 *       {@code cellDensityThreshold} in every cell.</li>
 * </ol>
 * The clustering gate rejects scattered red glyphs such as card suits. The secondary
 * control (blue call/raise button) only needs the density gate in its own sub-band.
 *
 * <p>Pure and reentrant; one instance may serve every session.
 */
public class PixelSignalDetector {

    private final DetectorSettings settings;

    public PixelSignalDetector(DetectorSettings settings) {
        this.settings = settings == null ? DetectorSettings.defaults() : settings;
    }

    public DetectorSettings settings() {
        return settings;
    }

    /** Never throws; degenerate frames yield {@link PixelSignal#absent()}. */
    public PixelSignal detect(Frame frame) {
        if (frame == null || frame.isDegenerate()) return PixelSignal.absent();

        int width = frame.width();
        int height = frame.height();
        int bandTop = (int) Math.floor(height * (1.0 - settings.bandHeightRatio()));
        bandTop = Math.max(0, Math.min(bandTop, height));
        if (bandTop >= height) return PixelSignal.absent();

        int primaryStart = column(width, settings.primaryBandStart());
        int primaryEnd = column(width, settings.primaryBandEnd());
        if (primaryEnd <= primaryStart) return PixelSignal.absent();

        RegionSample primary = sample(frame, primaryStart, primaryEnd, bandTop, true);
        if (primary.total == 0) return PixelSignal.absent();

        double density = primary.density();
        boolean primaryPresent = density > settings.primaryDensityThreshold() && primary.hasCluster();

        boolean secondaryPresent = false;
        int secondaryStart = column(width, settings.secondaryBandStart());
        int secondaryEnd = column(width, settings.secondaryBandEnd());
        if (secondaryEnd > secondaryStart) {
            RegionSample secondary = sample(frame, secondaryStart, secondaryEnd, bandTop, false);
            secondaryPresent = secondary.total > 0
                && secondary.density() > settings.secondaryDensityThreshold();
        }

        return PixelSignal.of(primaryPresent, secondaryPresent, density);
    }

    /** Fold-button red. */
    static boolean isPrimaryColor(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        return r > 170 && g < 100 && b < 100;
    }

    /** Call/raise-button blue. */
    static boolean isSecondaryColor(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        return b > 160 && r < 100 && g < 160;
    }

    // ── sampling ─────────────────────────────────────────────────────────────

    private RegionSample sample(Frame frame, int x0, int x1, int y0, boolean primary) {
        int y1 = frame.height();
        int stride = settings.sampleStride();
        int cols = settings.gridColumns();
        int rows = settings.gridRows();
        RegionSample region = new RegionSample(rows, cols, settings.cellDensityThreshold());

        for (int y = y0; y < y1; y += stride) {
            int row = Math.min(rows - 1, (int) ((long) (y - y0) * rows / (y1 - y0)));
            for (int x = x0; x < x1; x += stride) {
                int col = Math.min(cols - 1, (int) ((long) (x - x0) * cols / (x1 - x0)));
                int pixel = frame.pixel(x, y);
                boolean hit = primary ? isPrimaryColor(pixel) : isSecondaryColor(pixel);
                region.add(row, col, hit);
            }
        }
        return region;
    }

    private static int column(int width, double fraction) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return (int) Math.floor(width * clamped);
    }

    /** Hit counts for one sub-band, overall and per grid cell. */
    private static final class RegionSample {
        private final int[][] cellHits;
        private final int[][] cellTotals;
        private final double cellThreshold;
        private int hits;
        private int total;

        RegionSample(int rows, int cols, double cellThreshold) {
            this.cellHits = new int[rows][cols];
            this.cellTotals = new int[rows][cols];
            this.cellThreshold = cellThreshold;
        }

        void add(int row, int col, boolean hit) {
            total++;
            cellTotals[row][col]++;
            if (hit) {
                hits++;
                cellHits[row][col]++;
            }
        }

        double density() {
            return total == 0 ? 0.0 : (double) hits / total;
        }

        boolean hot(int row, int col) {
            int n = cellTotals[row][col];
            return n > 0 && (double) cellHits[row][col] / n > cellThreshold;
        }

        boolean hasCluster() {
            for (int r = 0; r + 1 < cellHits.length; r++) {
                for (int c = 0; c + 1 < cellHits[r].length; c++) {
                    if (hot(r, c) && hot(r, c + 1) && hot(r + 1, c) && hot(r + 1, c + 1)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
