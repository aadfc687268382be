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

public final class LorentzianShape implements PeakShape {

    @Override
    public String id() {
        return "lorentzian";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "gamma");
    }

    @Override
    public double value(double x, double[] p) {
        return lorentzian(x, p[AMPLITUDE], p[CENTER], p[WIDTH]);
    }

    @Override
    public double area(double[] p) {
        return p[AMPLITUDE] * Math.PI * p[WIDTH];
    }

    @Override
    public double fwhm(double[] p) {
        return 2.0 * p[WIDTH];
    }

    @Override
    public double widthForFwhm(double fwhm) {
        return fwhm / 2.0;
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height, center, widthForFwhm(FWHM_PER_SIGMA * sigma)};
    }

    static double lorentzian(double x, double amplitude, double center, double gamma) {
        double d = x - center;
        double g2 = gamma * gamma;
        return amplitude * g2 / (d * d + g2);
    }
}
