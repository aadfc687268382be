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

public final class GaussianShape implements PeakShape {

    @Override
    public String id() {
        return "gaussian";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "sigma");
    }

    @Override
    public double value(double x, double[] p) {
        return gaussian(x, p[AMPLITUDE], p[CENTER], p[WIDTH]);
    }

    @Override
    public double area(double[] p) {
        return p[AMPLITUDE] * p[WIDTH] * SQRT_2PI;
    }

    @Override
    public double fwhm(double[] p) {
        return FWHM_PER_SIGMA * p[WIDTH];
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height, center, sigma};
    }

    static double gaussian(double x, double amplitude, double center, double sigma) {
        double d = x - center;
        return amplitude * Math.exp(-d * d / (2.0 * sigma * sigma));
    }
}
