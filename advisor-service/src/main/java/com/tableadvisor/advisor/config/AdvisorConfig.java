package com.tableadvisor.advisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tableadvisor.common.engine.EngineThresholds;
import com.tableadvisor.common.engine.ReconciliationEngine;
import com.tableadvisor.common.pixel.DetectorSettings;
import com.tableadvisor.common.pixel.PixelSignalDetector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AdvisorConfig {

    // ── engine ───────────────────────────────────────────────────────────

    @Value("${advisor.engine.exit-window-ms:3000}")
    private long exitWindowMs;

    @Value("${advisor.engine.exit-confirmations:2}")
    private int exitConfirmations;

    @Value("${advisor.engine.pixel-escape-threshold:5}")
    private int pixelEscapeThreshold;

    @Value("${advisor.engine.strong-entry-confirmations:1}")
    private int strongEntryConfirmations;

    @Value("${advisor.engine.weak-entry-confirmations:2}")
    private int weakEntryConfirmations;

    @Value("${advisor.engine.waiting-display:Not your turn}")
    private String waitingDisplay;

    @Value("${advisor.engine.ready-on-control-appeared:true}")
    private boolean readyOnControlAppeared;

    // ── detector ─────────────────────────────────────────────────────────

    @Value("${advisor.detector.band-height-ratio:0.15}")
    private double bandHeightRatio;

    @Value("${advisor.detector.primary-band-start:0.0}")
    private double primaryBandStart;

    @Value("${advisor.detector.primary-band-end:0.40}")
    private double primaryBandEnd;

    @Value("${advisor.detector.secondary-band-start:0.40}")
    private double secondaryBandStart;

    @Value("${advisor.detector.secondary-band-end:0.70}")
    private double secondaryBandEnd;

    @Value("${advisor.detector.sample-stride:4}")
    private int sampleStride;

    @Value("${advisor.detector.primary-density-threshold:0.008}")
    private double primaryDensityThreshold;

    @Value("${advisor.detector.secondary-density-threshold:0.008}")
    private double secondaryDensityThreshold;

    @Value("${advisor.detector.grid-columns:8}")
    private int gridColumns;

    @Value("${advisor.detector.grid-rows:4}")
    private int gridRows;

    @Value("${advisor.detector.cell-density-threshold:0.005}")
    private double cellDensityThreshold;

    @Bean
    public EngineThresholds engineThresholds() {
        return new EngineThresholds(
            Duration.ofMillis(exitWindowMs),
            exitConfirmations,
            pixelEscapeThreshold,
            strongEntryConfirmations,
            weakEntryConfirmations,
            waitingDisplay,
            readyOnControlAppeared);
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(EngineThresholds engineThresholds) {
        return new ReconciliationEngine(engineThresholds);
    }

    @Bean
    public DetectorSettings detectorSettings() {
        return new DetectorSettings(
            bandHeightRatio,
            primaryBandStart, primaryBandEnd,
            secondaryBandStart, secondaryBandEnd,
            sampleStride,
            primaryDensityThreshold,
            secondaryDensityThreshold,
            gridColumns, gridRows,
            cellDensityThreshold);
    }

    @Bean
    public PixelSignalDetector pixelSignalDetector(DetectorSettings detectorSettings) {
        return new PixelSignalDetector(detectorSettings);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
