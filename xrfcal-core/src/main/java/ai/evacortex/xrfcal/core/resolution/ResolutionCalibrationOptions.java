/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.resolution;

import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.engine.CurveFitBackend;
import ai.evacortex.xrfcal.core.engine.FitBackends;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;

import java.util.Objects;

/**
 * Thresholds and switches of {@link ResolutionCalibrator}. Energies and widths in keV.
 */
public record ResolutionCalibrationOptions(
        String backgroundMethod,
        BackgroundOptions backgroundOptions,
        CurveFitBackend backend,
        double windowHalfWidth,
        int minWindowPoints,
        double minCounts,
        double highEnergyMinCounts,
        double highEnergyLimit,
        double initialFwhm,
        double minFwhm,
        double maxFwhm,
        double centerTolerance,
        double minRSquared,
        boolean removeOutliers,
        double outlierThreshold,     // in robust standard deviations
        double residualScaleFloor,
        int minPeaks,
        ResolutionModelKind modelKind
) {

    public ResolutionCalibrationOptions {
        Objects.requireNonNull(backgroundMethod, "background method must not be null");
        Objects.requireNonNull(backgroundOptions, "background options must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(modelKind, "model kind must not be null");
        if (!(windowHalfWidth > 0)) {
            throw new ConfigurationException("window half-width must be positive: " + windowHalfWidth);
        }
        if (!(minFwhm > 0 && minFwhm < maxFwhm)) {
            throw new ConfigurationException("malformed FWHM band [" + minFwhm + ", " + maxFwhm + "]");
        }
        if (!(outlierThreshold > 0)) {
            throw new ConfigurationException("outlier threshold must be positive: " + outlierThreshold);
        }
        if (minPeaks < 1) {
            throw new ConfigurationException("minPeaks must be >= 1: " + minPeaks);
        }
    }

    public static ResolutionCalibrationOptions defaultOptions() {
        return new ResolutionCalibrationOptions(BackgroundEstimator.DEFAULT_METHOD, BackgroundOptions.defaultOptions(),
                FitBackends.defaultBackend(), 0.3, 10, 80.0, 150.0, 10.0, 0.150, 0.080, 0.300, 0.1, 0.85,
                true, 3.0, 0.002, 3, ResolutionModelKind.DETECTOR);
    }

    public ResolutionCalibrationOptions withModelKind(ResolutionModelKind kind) {
        return new ResolutionCalibrationOptions(backgroundMethod, backgroundOptions, backend, windowHalfWidth,
                minWindowPoints, minCounts, highEnergyMinCounts, highEnergyLimit, initialFwhm, minFwhm, maxFwhm,
                centerTolerance, minRSquared, removeOutliers, outlierThreshold, residualScaleFloor, minPeaks, kind);
    }

    public ResolutionCalibrationOptions withOutlierRemoval(boolean enabled) {
        return new ResolutionCalibrationOptions(backgroundMethod, backgroundOptions, backend, windowHalfWidth,
                minWindowPoints, minCounts, highEnergyMinCounts, highEnergyLimit, initialFwhm, minFwhm, maxFwhm,
                centerTolerance, minRSquared, enabled, outlierThreshold, residualScaleFloor, minPeaks, modelKind);
    }

    public ResolutionCalibrationOptions withThresholds(double counts, double highEnergyCounts, double rSquared) {
        return new ResolutionCalibrationOptions(backgroundMethod, backgroundOptions, backend, windowHalfWidth,
                minWindowPoints, counts, highEnergyCounts, highEnergyLimit, initialFwhm, minFwhm, maxFwhm,
                centerTolerance, rSquared, removeOutliers, outlierThreshold, residualScaleFloor, minPeaks, modelKind);
    }

    public ResolutionCalibrationOptions withBackground(String method, BackgroundOptions options) {
        return new ResolutionCalibrationOptions(method, options, backend, windowHalfWidth,
                minWindowPoints, minCounts, highEnergyMinCounts, highEnergyLimit, initialFwhm, minFwhm, maxFwhm,
                centerTolerance, minRSquared, removeOutliers, outlierThreshold, residualScaleFloor, minPeaks, modelKind);
    }

    public ResolutionCalibrationOptions withBackend(String name) {
        return new ResolutionCalibrationOptions(backgroundMethod, backgroundOptions, FitBackends.forName(name),
                windowHalfWidth, minWindowPoints, minCounts, highEnergyMinCounts, highEnergyLimit, initialFwhm,
                minFwhm, maxFwhm, centerTolerance, minRSquared, removeOutliers, outlierThreshold, residualScaleFloor,
                minPeaks, modelKind);
    }

    /** Minimum local maximum for a line at {@code energy}; stricter above {@link #highEnergyLimit()}. */
    public double minCountsAt(double energy) {
        return energy > highEnergyLimit ? highEnergyMinCounts : minCounts;
    }
}
