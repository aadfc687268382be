/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

import java.util.Objects;

/**
 * Configuration of {@link IntensityCalibrator}.
 *
 * @param resolutionPrior   detector resolution to start from; {@code null} for wide default bounds
 * @param priorTolerance    relative half-width of the width bounds around the prior
 * @param noiseFloor        channels at or below this many counts are left out of the objective
 * @param stride            every {@code stride}-th channel enters the objective during optimization
 * @param maxEvaluations    objective evaluation budget
 * @param refineShape       also fit a hypermet low-energy tail and one intensity scale per element
 */
public record IntensityCalibrationOptions(ResolutionModel resolutionPrior,
                                          double priorTolerance,
                                          String backgroundMethod,
                                          BackgroundOptions backgroundOptions,
                                          double noiseFloor,
                                          int stride,
                                          int maxEvaluations,
                                          double initialTrustRadius,
                                          double stoppingTrustRadius,
                                          boolean refineShape) {

    /** Width bounds without a prior: {@code fwhm_0} in [20, 200] eV, {@code ε} in [0.5, 10] eV. */
    public static final double[] DEFAULT_FWHM0_BOUNDS = {0.020, 0.200};
    public static final double[] DEFAULT_EPSILON_BOUNDS = {0.0005, 0.0100};
    public static final double[] EFFICIENCY_LOWER = {0.5, -0.2, -0.01};
    public static final double[] EFFICIENCY_UPPER = {1.5, 0.2, 0.01};
    public static final double[] TAIL_AMPLITUDE_BOUNDS = {0.0, 0.3};
    public static final double[] TAIL_SLOPE_BOUNDS = {0.5, 10.0};
    public static final double[] ELEMENT_SCALE_BOUNDS = {0.5, 2.0};
    public static final double DEFAULT_TAIL_AMPLITUDE = 0.05;
    public static final double DEFAULT_TAIL_SLOPE = 2.0;

    public IntensityCalibrationOptions {
        Objects.requireNonNull(backgroundMethod, "background method must not be null");
        Objects.requireNonNull(backgroundOptions, "background options must not be null");
        if (!(priorTolerance > 0 && priorTolerance < 1)) {
            throw new ConfigurationException("prior tolerance must lie in (0, 1): " + priorTolerance);
        }
        if (!(noiseFloor >= 0)) {
            throw new ConfigurationException("noise floor must be >= 0: " + noiseFloor);
        }
        if (stride < 1) {
            throw new ConfigurationException("stride must be >= 1: " + stride);
        }
        if (maxEvaluations < 1) {
            throw new ConfigurationException("maxEvaluations must be >= 1: " + maxEvaluations);
        }
        if (!(initialTrustRadius > stoppingTrustRadius && stoppingTrustRadius > 0 && initialTrustRadius <= 0.5)) {
            throw new ConfigurationException("trust radii must satisfy 0 < stop < initial <= 0.5");
        }
    }

    public static IntensityCalibrationOptions defaultOptions() {
        return new IntensityCalibrationOptions(null, 0.2, BackgroundEstimator.DEFAULT_METHOD,
                BackgroundOptions.defaultOptions(), 10.0, 1, 3000, 0.1, 1e-7, false);
    }

    public IntensityCalibrationOptions withResolutionPrior(ResolutionModel prior) {
        return new IntensityCalibrationOptions(prior, priorTolerance, backgroundMethod, backgroundOptions,
                noiseFloor, stride, maxEvaluations, initialTrustRadius, stoppingTrustRadius, refineShape);
    }

    public IntensityCalibrationOptions withBackground(String method, BackgroundOptions options) {
        return new IntensityCalibrationOptions(resolutionPrior, priorTolerance, method, options,
                noiseFloor, stride, maxEvaluations, initialTrustRadius, stoppingTrustRadius, refineShape);
    }

    public IntensityCalibrationOptions withStride(int s) {
        return new IntensityCalibrationOptions(resolutionPrior, priorTolerance, backgroundMethod, backgroundOptions,
                noiseFloor, s, maxEvaluations, initialTrustRadius, stoppingTrustRadius, refineShape);
    }

    public IntensityCalibrationOptions withNoiseFloor(double floor) {
        return new IntensityCalibrationOptions(resolutionPrior, priorTolerance, backgroundMethod, backgroundOptions,
                floor, stride, maxEvaluations, initialTrustRadius, stoppingTrustRadius, refineShape);
    }

    public IntensityCalibrationOptions withMaxEvaluations(int max) {
        return new IntensityCalibrationOptions(resolutionPrior, priorTolerance, backgroundMethod, backgroundOptions,
                noiseFloor, stride, max, initialTrustRadius, stoppingTrustRadius, refineShape);
    }

    public IntensityCalibrationOptions withShapeRefinement(boolean refine) {
        return new IntensityCalibrationOptions(resolutionPrior, priorTolerance, backgroundMethod, backgroundOptions,
                noiseFloor, stride, maxEvaluations, initialTrustRadius, stoppingTrustRadius, refine);
    }
}
