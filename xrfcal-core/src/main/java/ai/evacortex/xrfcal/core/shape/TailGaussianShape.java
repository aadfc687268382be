/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import java.util.List;

/**
 * Gaussian core plus a wider Gaussian tail centered half a sigma below the core, weighted by
 * {@code tail_fraction}.
 */
public final class TailGaussianShape implements PeakShape {

    @Override
    public String id() {
        return "tail_gaussian";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "sigma", "tail_fraction", "tail_sigma");
    }

    @Override
    public double value(double x, double[] p) {
        double amp = p[AMPLITUDE];
        double center = p[CENTER];
        double sigma = p[WIDTH];
        double fraction = p[3];
        return (1.0 - fraction) * GaussianShape.gaussian(x, amp, center, sigma)
                + fraction * GaussianShape.gaussian(x, amp, center - 0.5 * sigma, p[4]);
    }

    @Override
    public double area(double[] p) {
        double fraction = p[3];
        return p[AMPLITUDE] * SQRT_2PI * ((1.0 - fraction) * p[WIDTH] + fraction * p[4]);
    }

    @Override
    public double fwhm(double[] p) {
        return FWHM_PER_SIGMA * p[WIDTH];
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height, center, sigma, 0.15, 3.0 * sigma};
    }

    @Override
    public double[][] shapeBounds(double sigma) {
        return new double[][]{{0.0, sigma}, {0.5, 10.0 * sigma}};
    }
}
