/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * A bounded, optionally weighted least-squares problem: minimize {@code Σ (w_i·(y_i - f(x_i; p)))²}
 * subject to {@code lower ≤ p ≤ upper}.
 *
 * <p>A parameter whose lower and upper bound coincide is frozen at that value. The start point
 * is clamped into the box on construction.</p>
 */
public record CurveFitProblem(double[] x,
                              double[] y,
                              double[] weights,
                              ParametricModel model,
                              double[] start,
                              double[] lower,
                              double[] upper,
                              int maxEvaluations) {

    public static final int DEFAULT_MAX_EVALUATIONS = 5000;

    public CurveFitProblem {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(start, "start must not be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + x.length + " vs " + y.length);
        }
        if (weights != null && weights.length != x.length) {
            throw new IllegalArgumentException("weights length " + weights.length + " != " + x.length);
        }
        int k = start.length;
        lower = lower == null ? filled(k, Double.NEGATIVE_INFINITY) : lower.clone();
        upper = upper == null ? filled(k, Double.POSITIVE_INFINITY) : upper.clone();
        if (lower.length != k || upper.length != k) {
            throw new ConfigurationException("bounds must have " + k + " entries");
        }
        start = start.clone();
        for (int i = 0; i < k; i++) {
            if (Double.isNaN(lower[i]) || Double.isNaN(upper[i]) || lower[i] > upper[i]) {
                throw new ConfigurationException("malformed bounds for parameter " + i
                        + ": [" + lower[i] + ", " + upper[i] + "]");
            }
            if (!Double.isFinite(start[i])) {
                throw new ConfigurationException("non-finite start value for parameter " + i);
            }
            start[i] = Math.min(Math.max(start[i], lower[i]), upper[i]);
        }
        if (maxEvaluations < 1) {
            throw new ConfigurationException("maxEvaluations must be >= 1: " + maxEvaluations);
        }
    }

    public static CurveFitProblem of(double[] x, double[] y, ParametricModel model,
                                     double[] start, double[] lower, double[] upper) {
        return new CurveFitProblem(x, y, null, model, start, lower, upper, DEFAULT_MAX_EVALUATIONS);
    }

    public CurveFitProblem withWeights(double[] w) {
        return new CurveFitProblem(x, y, w, model, start, lower, upper, maxEvaluations);
    }

    public CurveFitProblem withMaxEvaluations(int max) {
        return new CurveFitProblem(x, y, weights, model, start, lower, upper, max);
    }

    public int size() {
        return x.length;
    }

    public int parameterCount() {
        return start.length;
    }

    public double weight(int i) {
        return weights == null ? 1.0 : weights[i];
    }

    public boolean isFrozen(int parameter) {
        return lower[parameter] == upper[parameter];
    }

    private static double[] filled(int k, double v) {
        double[] a = new double[k];
        Arrays.fill(a, v);
        return a;
    }
}
