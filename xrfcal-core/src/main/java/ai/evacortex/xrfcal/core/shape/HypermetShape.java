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
 * Gaussian plus a one-sided exponential tail on the low-energy side, modelling incomplete charge
 * collection. The tail has relative height {@code tail_amplitude} and decay {@code tail_slope} in keV⁻¹.
 */
public final class HypermetShape implements PeakShape {

    @Override
    public String id() {
        return "hypermet";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "sigma", "tail_amplitude", "tail_slope");
    }

    @Override
    public double value(double x, double[] p) {
        double amp = p[AMPLITUDE];
        double center = p[CENTER];
        double y = GaussianShape.gaussian(x, amp, center, p[WIDTH]);
        if (x < center) {
            y += amp * p[3] * Math.exp(p[4] * (x - center));
        }
        return y;
    }

    @Override
    public double area(double[] p) {
        double amp = p[AMPLITUDE];
        return amp * p[WIDTH] * SQRT_2PI + amp * p[3] / p[4];
    }

    @Override
    public double fwhm(double[] p) {
        return FWHM_PER_SIGMA * p[WIDTH];
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height, center, sigma, 0.1, 2.0};
    }

    @Override
    public double[][] shapeBounds(double sigma) {
        return new double[][]{{0.0, 0.5}, {0.5, 10.0}};
    }
}
