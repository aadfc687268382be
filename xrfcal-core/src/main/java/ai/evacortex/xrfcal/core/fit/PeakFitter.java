/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.engine.CurveFit;
import ai.evacortex.xrfcal.core.engine.CurveFitProblem;
import ai.evacortex.xrfcal.core.exceptions.FitDivergenceException;
import ai.evacortex.xrfcal.core.shape.PeakShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fits a single peak-shape instance around a candidate energy of a background-subtracted spectrum.
 *
 * <p>Each fit runs windowing, initial guess, bounded regression and quality assessment. Failures
 * come back as {@link PeakFitOutcome} values. Several candidates are fitted independently and in
 * sequence; overlapping windows are not fitted jointly.</p>
 */
public final class PeakFitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeakFitter.class);

    private final PeakFitOptions options;

    public PeakFitter() {
        this(PeakFitOptions.defaultOptions());
    }

    public PeakFitter(PeakFitOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public PeakFitOptions options() {
        return options;
    }

    public PeakFitOutcome fit(Spectrum spectrum, double center) {
        return fit(spectrum.energy(), spectrum.counts(), center);
    }

    public PeakFitOutcome fit(double[] energy, double[] counts, double center) {
        if (energy.length != counts.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + energy.length + " vs " + counts.length);
        }
        PeakShape shape = options.shape();

        double halfWindow = options.halfWindow(center);
        int from = -1;
        int to = -1;
        for (int i = 0; i < energy.length; i++) {
            if (Math.abs(energy[i] - center) < halfWindow) {
                if (from < 0) from = i;
                to = i + 1;
            }
        }
        int points = from < 0 ? 0 : to - from;
        if (points < options.minPoints()) {
            return failed(center, PeakFitFailure.INSUFFICIENT_POINTS,
                    String.format("insufficient points at %.3f keV: %d in window", center, points));
        }
        double[] x = Arrays.copyOfRange(energy, from, to);
        double[] y = Arrays.copyOfRange(counts, from, to);

        int maxIdx = 0;
        for (int i = 1; i < y.length; i++) {
            if (y[i] > y[maxIdx]) maxIdx = i;
        }
        double height = y[maxIdx];
        if (!(height > 0)) {
            return failed(center, PeakFitFailure.NO_SIGNAL, String.format("no signal at %.3f keV", center));
        }
        if (height < options.minHeight()) {
            return failed(center, PeakFitFailure.TOO_WEAK, String.format("peak too weak at %.3f keV (counts=%.0f, need>%.0f)",
                    center, height, options.minHeight()));
        }

        double startCenter = options.startAtLocalMaximum() ? x[maxIdx] : center;
        double fwhmGuess = options.initialFwhm() != null ? options.initialFwhm() : options.resolution().predict(center);
        double sigma = fwhmGuess / PeakShape.FWHM_PER_SIGMA;
        double[] start = shape.initialGuess(height, startCenter, sigma);

        int k = shape.parameterCount();
        double[] lower = new double[k];
        double[] upper = new double[k];
        lower[PeakShape.AMPLITUDE] = options.minAmplitudeFactor() * start[PeakShape.AMPLITUDE];
        upper[PeakShape.AMPLITUDE] = options.maxAmplitudeFactor() * start[PeakShape.AMPLITUDE];
        lower[PeakShape.CENTER] = center - options.centerTolerance();
        upper[PeakShape.CENTER] = center + options.centerTolerance();
        if (options.minFwhm() != null) {
            lower[PeakShape.WIDTH] = shape.widthForFwhm(options.minFwhm());
            upper[PeakShape.WIDTH] = shape.widthForFwhm(options.maxFwhm());
        } else {
            lower[PeakShape.WIDTH] = options.minWidthFactor() * start[PeakShape.WIDTH];
            upper[PeakShape.WIDTH] = options.maxWidthFactor() * start[PeakShape.WIDTH];
        }
        double[][] extra = shape.shapeBounds(sigma);
        for (int j = 0; j < extra[0].length; j++) {
            lower[PeakShape.WIDTH + 1 + j] = extra[0][j];
            upper[PeakShape.WIDTH + 1 + j] = extra[1][j];
        }
        if (options.fixedShape()) {
            for (int j = PeakShape.WIDTH; j < k; j++) {
                double v = Math.min(Math.max(start[j], lower[j]), upper[j]);
                lower[j] = v;
                upper[j] = v;
            }
        }

        CurveFitProblem problem = CurveFitProblem.of(x, y, shape::value, start, lower, upper)
                .withMaxEvaluations(options.maxEvaluations());
        CurveFit fit;
        try {
            fit = options.backend().fit(problem);
        } catch (FitDivergenceException e) {
            return failed(center, PeakFitFailure.FIT_DIVERGED,
                    String.format("fit failed at %.3f keV: %s", center, e.getMessage()));
        }

        Peak peak = Peak.of(shape, fit.parameters(), fit.rSquared());
        if (!Double.isFinite(peak.fwhm()) || !Double.isFinite(peak.area())) {
            return failed(center, PeakFitFailure.FIT_DIVERGED,
                    String.format("fit failed at %.3f keV: non-finite width or area", center));
        }
        LOGGER.debug("Fitted {} peak at {} keV: FWHM={} keV, R2={}", shape.id(), peak.energy(), peak.fwhm(), peak.rSquared());
        return PeakFitOutcome.success(center, peak);
    }

    /**
     * Fits every candidate independently. One failure never prevents the others.
     */
    public List<PeakFitOutcome> fitAll(Spectrum spectrum, List<Double> centers) {
        double[] energy = spectrum.energy();
        double[] counts = spectrum.counts();
        List<PeakFitOutcome> outcomes = new ArrayList<>(centers.size());
        for (double c : centers) {
            outcomes.add(fit(energy, counts, c));
        }
        return outcomes;
    }

    private static PeakFitOutcome failed(double center, PeakFitFailure failure, String message) {
        LOGGER.debug(message);
        return PeakFitOutcome.failure(center, failure, message);
    }
}
