/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

/**
 * Parameters for every background method. Each method reads only its own fields.
 */
public record BackgroundOptions(
        int snipIterations,          // largest clipping window, in channels
        boolean snipDecreasing,      // apply large windows first
        double aslsLambda,           // curvature penalty
        double aslsP,                // weight of samples above the baseline
        int aslsIterations,
        int polynomialDegree,
        boolean[] roiMask,           // true = peak region, excluded from the polynomial fit; may be null
        Integer linearStart,         // endpoint channel, null = mean of the first 5 %
        Integer linearEnd,           // endpoint channel, null = mean of the last 5 %
        int adaptiveWindow,
        double adaptivePercentile
) {

    public BackgroundOptions {
        if (snipIterations < 1) {
            throw new ConfigurationException("snipIterations must be >= 1: " + snipIterations);
        }
        if (!(aslsLambda > 0) || !Double.isFinite(aslsLambda)) {
            throw new ConfigurationException("AsLS lambda must be positive: " + aslsLambda);
        }
        if (!(aslsP > 0 && aslsP < 1)) {
            throw new ConfigurationException("AsLS p must be in (0, 1): " + aslsP);
        }
        if (aslsIterations < 1) {
            throw new ConfigurationException("AsLS iterations must be >= 1: " + aslsIterations);
        }
        if (polynomialDegree < 0) {
            throw new ConfigurationException("polynomial degree must be >= 0: " + polynomialDegree);
        }
        if (adaptiveWindow < 1) {
            throw new ConfigurationException("adaptive window must be >= 1: " + adaptiveWindow);
        }
        if (!(adaptivePercentile >= 0 && adaptivePercentile <= 100)) {
            throw new ConfigurationException("adaptive percentile must be in [0, 100]: " + adaptivePercentile);
        }
        roiMask = roiMask == null ? null : roiMask.clone();
    }

    public static BackgroundOptions defaultOptions() {
        return new BackgroundOptions(20, true, 1e5, 0.01, 10, 3, null, null, null, 50, 5.0);
    }

    public BackgroundOptions withSnip(int iterations, boolean decreasing) {
        return new BackgroundOptions(iterations, decreasing, aslsLambda, aslsP, aslsIterations,
                polynomialDegree, roiMask, linearStart, linearEnd, adaptiveWindow, adaptivePercentile);
    }

    public BackgroundOptions withAsls(double lambda, double p, int iterations) {
        return new BackgroundOptions(snipIterations, snipDecreasing, lambda, p, iterations,
                polynomialDegree, roiMask, linearStart, linearEnd, adaptiveWindow, adaptivePercentile);
    }

    public BackgroundOptions withPolynomial(int degree, boolean[] mask) {
        return new BackgroundOptions(snipIterations, snipDecreasing, aslsLambda, aslsP, aslsIterations,
                degree, mask, linearStart, linearEnd, adaptiveWindow, adaptivePercentile);
    }

    public BackgroundOptions withLinearEndpoints(Integer start, Integer end) {
        return new BackgroundOptions(snipIterations, snipDecreasing, aslsLambda, aslsP, aslsIterations,
                polynomialDegree, roiMask, start, end, adaptiveWindow, adaptivePercentile);
    }

    public BackgroundOptions withAdaptive(int window, double percentile) {
        return new BackgroundOptions(snipIterations, snipDecreasing, aslsLambda, aslsP, aslsIterations,
                polynomialDegree, roiMask, linearStart, linearEnd, window, percentile);
    }

    @Override
    public boolean[] roiMask() {
        return roiMask == null ? null : roiMask.clone();
    }
}
