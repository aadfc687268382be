/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.lines.EmissionLine;
import ai.evacortex.xrfcal.core.lines.ReferenceLineDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Expected lines read off the measured spectrum itself: the background-subtracted maximum within
 * two predicted FWHMs of each major K and L line of every non-trace element. The background
 * method and its options are fixed at construction.
 */
public final class MeasuredLineSource implements ExpectedLineSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeasuredLineSource.class);

    public static final Set<String> MAJOR_LINES = Set.of("Kα1", "Kα2", "Kβ1", "Lα1", "Lα2", "Lβ1");
    public static final double DEFAULT_MIN_PPM = 100.0;
    public static final double DEFAULT_MIN_COUNTS = 20.0;

    private final ReferenceLineDatabase database;
    private final BackgroundEstimator backgrounds;
    private final String backgroundMethod;
    private final BackgroundOptions backgroundOptions;
    private final ResolutionModel resolution;
    private final double minPpm;
    private final double minCounts;

    public MeasuredLineSource(ReferenceLineDatabase database) {
        this(database, new BackgroundEstimator(), BackgroundEstimator.DEFAULT_METHOD, BackgroundOptions.defaultOptions(),
                ResolutionModel.defaultModel(), DEFAULT_MIN_PPM, DEFAULT_MIN_COUNTS);
    }

    public MeasuredLineSource(ReferenceLineDatabase database, String backgroundMethod,
                              BackgroundOptions backgroundOptions) {
        this(database, new BackgroundEstimator(), backgroundMethod, backgroundOptions,
                ResolutionModel.defaultModel(), DEFAULT_MIN_PPM, DEFAULT_MIN_COUNTS);
    }

    public MeasuredLineSource(ReferenceLineDatabase database, BackgroundEstimator backgrounds,
                              String backgroundMethod, BackgroundOptions backgroundOptions,
                              ResolutionModel resolution, double minPpm, double minCounts) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.backgrounds = Objects.requireNonNull(backgrounds, "backgrounds must not be null");
        this.backgroundMethod = Objects.requireNonNull(backgroundMethod, "background method must not be null");
        this.backgroundOptions = Objects.requireNonNull(backgroundOptions, "background options must not be null");
        backgrounds.method(backgroundMethod);
        this.resolution = Objects.requireNonNull(resolution, "resolution must not be null");
        this.minPpm = minPpm;
        this.minCounts = minCounts;
    }

    @Override
    public List<ElementLine> expectedLines(CalibrationStandard standard, Spectrum measured) {
        double[] energy = measured.energy();
        double[] net = BackgroundEstimator.subtract(measured.counts(),
                backgrounds.estimate(measured, backgroundMethod, backgroundOptions));

        List<ElementLine> out = new ArrayList<>();
        for (Map.Entry<String, Double> c : standard.concentrations().entrySet()) {
            if (c.getValue() < minPpm) continue;
            Map<String, List<EmissionLine>> series = database.lines(c.getKey());
            for (String s : List.of("K", "L")) {
                for (EmissionLine line : series.getOrDefault(s, List.of())) {
                    double e = line.energyKeV();
                    if (e >= standard.excitationKeV() || !MAJOR_LINES.contains(line.name())) continue;
                    double window = 2.0 * resolution.predict(e);
                    double height = Double.NEGATIVE_INFINITY;
                    for (int i = 0; i < energy.length; i++) {
                        if (Math.abs(energy[i] - e) < window) height = Math.max(height, net[i]);
                    }
                    if (height > minCounts) {
                        out.add(new ElementLine(c.getKey(), line.name(), e, height));
                    }
                }
            }
        }
        LOGGER.debug("Measured {} expected lines for '{}'", out.size(), standard.name());
        return out;
    }
}
