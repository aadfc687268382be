/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.engine.CurveFitBackend;
import ai.evacortex.xrfcal.core.engine.FitBackends;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.shape.PeakShape;
import ai.evacortex.xrfcal.core.shape.PeakShapeRegistry;

import java.util.Objects;

/**
 * Configuration for {@link PeakFitter}. Carries the active resolution model explicitly.
 *
 * <p>Nullable overrides: {@code fixedHalfWindow} replaces the resolution-based window,
 * {@code initialFwhm} replaces the resolution-model width guess, and {@code minFwhm}/{@code maxFwhm}
 * replace the relative width bounds.</p>
 */
public record PeakFitOptions(
        ResolutionModel resolution,
        PeakShape shape,
        CurveFitBackend backend,
        double windowFwhms,          // window half-width in predicted FWHMs
        double lowEnergyWindowFwhms, // same, below lowEnergyLimit
        double lowEnergyLimit,       // keV
        Double fixedHalfWindow,      // keV
        double centerTolerance,      // keV either side of the candidate
        double minWidthFactor,
        double maxWidthFactor,
        Double minFwhm,
        Double maxFwhm,
        Double initialFwhm,
        double minAmplitudeFactor,
        double maxAmplitudeFactor,
        boolean startAtLocalMaximum,
        boolean fixedShape,          // freeze width and shape parameters at their guess
        int minPoints,
        int maxEvaluations,
        double minHeight             // local maxima below this are TOO_WEAK
) {

    public PeakFitOptions {
        Objects.requireNonNull(resolution, "resolution model must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        if (!(windowFwhms > 0) || !(lowEnergyWindowFwhms > 0)) {
            throw new ConfigurationException("window widths must be positive");
        }
        if (fixedHalfWindow != null && !(fixedHalfWindow > 0)) {
            throw new ConfigurationException("fixed half window must be positive: " + fixedHalfWindow);
        }
        if (!(centerTolerance >= 0)) {
            throw new ConfigurationException("center tolerance must be >= 0: " + centerTolerance);
        }
        if (!(minWidthFactor > 0 && minWidthFactor <= 1 && maxWidthFactor >= 1)) {
            throw new ConfigurationException("width factors must satisfy 0 < min <= 1 <= max");
        }
        if ((minFwhm == null) != (maxFwhm == null)) {
            throw new ConfigurationException("absolute FWHM bounds must be given together");
        }
        if (minFwhm != null && !(minFwhm > 0 && minFwhm < maxFwhm)) {
            throw new ConfigurationException("malformed FWHM bounds [" + minFwhm + ", " + maxFwhm + "]");
        }
        if (initialFwhm != null && !(initialFwhm > 0)) {
            throw new ConfigurationException("initial FWHM must be positive: " + initialFwhm);
        }
        if (!(minAmplitudeFactor >= 0 && minAmplitudeFactor <= 1 && maxAmplitudeFactor >= 1)) {
            throw new ConfigurationException("amplitude factors must satisfy 0 <= min <= 1 <= max");
        }
        if (minPoints < 1) {
            throw new ConfigurationException("minPoints must be >= 1: " + minPoints);
        }
        if (maxEvaluations < 1) {
            throw new ConfigurationException("maxEvaluations must be >= 1: " + maxEvaluations);
        }
        if (!(minHeight >= 0)) {
            throw new ConfigurationException("minHeight must be >= 0: " + minHeight);
        }
    }

    public static PeakFitOptions defaultOptions() {
        return new PeakFitOptions(ResolutionModel.defaultModel(), PeakShapeRegistry.shape("gaussian"),
                FitBackends.defaultBackend(), 3.0, 5.0, 3.0, null, 0.2, 0.3, 3.0, null, null, null,
                0.3, 2.0, false, false, 5, 5000, 0.0);
    }

    public PeakFitOptions withResolution(ResolutionModel model) {
        return new PeakFitOptions(model, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withShape(String shapeId) {
        return withShape(PeakShapeRegistry.shape(shapeId));
    }

    public PeakFitOptions withShape(PeakShape peakShape) {
        return new PeakFitOptions(resolution, peakShape, backend, windowFwhms,
                lowEnergyWindowFwhms, lowEnergyLimit, fixedHalfWindow, centerTolerance, minWidthFactor,
                maxWidthFactor, minFwhm, maxFwhm, initialFwhm, minAmplitudeFactor, maxAmplitudeFactor,
                startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withBackend(String backendName) {
        return new PeakFitOptions(resolution, shape, FitBackends.forName(backendName), windowFwhms,
                lowEnergyWindowFwhms, lowEnergyLimit, fixedHalfWindow, centerTolerance, minWidthFactor,
                maxWidthFactor, minFwhm, maxFwhm, initialFwhm, minAmplitudeFactor, maxAmplitudeFactor,
                startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withFixedWindow(double halfWidth, int minimumPoints) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                halfWidth, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, fixedShape, minimumPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withCenterTolerance(double tolerance) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, tolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withFwhm(double initial, double min, double max) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, min, max, initial,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withAmplitudeFactors(double min, double max) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                min, max, startAtLocalMaximum, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions startingAtLocalMaximum(boolean enabled) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, enabled, fixedShape, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withFixedShape(boolean enabled) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, enabled, minPoints, maxEvaluations, minHeight);
    }

    public PeakFitOptions withMinHeight(double height) {
        return new PeakFitOptions(resolution, shape, backend, windowFwhms, lowEnergyWindowFwhms, lowEnergyLimit,
                fixedHalfWindow, centerTolerance, minWidthFactor, maxWidthFactor, minFwhm, maxFwhm, initialFwhm,
                minAmplitudeFactor, maxAmplitudeFactor, startAtLocalMaximum, fixedShape, minPoints, maxEvaluations,
                height);
    }

    /** Half-width of the fit window around {@code center}, keV. */
    public double halfWindow(double center) {
        if (fixedHalfWindow != null) return fixedHalfWindow;
        double k = center < lowEnergyLimit ? lowEnergyWindowFwhms : windowFwhms;
        return k * resolution.predict(center);
    }
}
