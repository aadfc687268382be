/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

import java.util.Objects;

/**
 * Configuration of {@link SpectrumFitter}.
 *
 * <p>{@code shapeSelector} picks the profile per known line; {@code null} fits every peak with
 * {@code peakOptions.shape()}. Known lines of the same kind closer than {@code multipletFwhms}
 * predicted FWHMs are fitted as one peak; 0 disables the merge.</p>
 */
public record SpectrumFitOptions(
        String backgroundMethod,
        BackgroundOptions backgroundOptions,
        PeakFitOptions peakOptions,
        boolean autoFindPeaks,
        Double prominence,           // null = 5 % of the net maximum
        int distance,                // channels
        double knownLineTolerance,   // keV; detected peaks closer than this to a known line are dropped
        PeakShapeSelector shapeSelector,
        double multipletFwhms
) {

    public SpectrumFitOptions {
        Objects.requireNonNull(backgroundMethod, "background method must not be null");
        Objects.requireNonNull(backgroundOptions, "background options must not be null");
        Objects.requireNonNull(peakOptions, "peak options must not be null");
        if (distance < 1) {
            throw new ConfigurationException("peak distance must be >= 1: " + distance);
        }
        if (!(knownLineTolerance >= 0)) {
            throw new ConfigurationException("known-line tolerance must be >= 0: " + knownLineTolerance);
        }
        if (!(multipletFwhms >= 0)) {
            throw new ConfigurationException("multiplet merge width must be >= 0: " + multipletFwhms);
        }
    }

    public static SpectrumFitOptions defaultOptions() {
        return new SpectrumFitOptions(BackgroundEstimator.DEFAULT_METHOD, BackgroundOptions.defaultOptions(),
                PeakFitOptions.defaultOptions(), true, null, PeakFinder.DEFAULT_DISTANCE, 0.1, null, 0.5);
    }

    public SpectrumFitOptions withBackground(String method, BackgroundOptions options) {
        return new SpectrumFitOptions(method, options, peakOptions, autoFindPeaks, prominence, distance,
                knownLineTolerance, shapeSelector, multipletFwhms);
    }

    public SpectrumFitOptions withPeakOptions(PeakFitOptions options) {
        return new SpectrumFitOptions(backgroundMethod, backgroundOptions, options, autoFindPeaks, prominence,
                distance, knownLineTolerance, shapeSelector, multipletFwhms);
    }

    public SpectrumFitOptions withAutoFindPeaks(boolean enabled) {
        return new SpectrumFitOptions(backgroundMethod, backgroundOptions, peakOptions, enabled, prominence,
                distance, knownLineTolerance, shapeSelector, multipletFwhms);
    }

    public SpectrumFitOptions withShapeSelector(PeakShapeSelector selector) {
        return new SpectrumFitOptions(backgroundMethod, backgroundOptions, peakOptions, autoFindPeaks, prominence,
                distance, knownLineTolerance, selector, multipletFwhms);
    }

    public SpectrumFitOptions withMultipletMerge(double fwhms) {
        return new SpectrumFitOptions(backgroundMethod, backgroundOptions, peakOptions, autoFindPeaks, prominence,
                distance, knownLineTolerance, shapeSelector, fwhms);
    }
}
