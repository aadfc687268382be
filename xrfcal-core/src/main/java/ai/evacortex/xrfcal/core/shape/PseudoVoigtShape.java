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
 * Linear mix {@code η·L + (1 - η)·G} of a Gaussian and a Lorentzian sharing the same height, with
 * the Lorentzian half width equal to {@code σ}.
 */
public final class PseudoVoigtShape implements PeakShape {

    @Override
    public String id() {
        return "pseudo_voigt";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "sigma", "eta");
    }

    @Override
    public double value(double x, double[] p) {
        double eta = p[3];
        double lorentz = LorentzianShape.lorentzian(x, 1.0, p[CENTER], p[WIDTH]);
        double gauss = GaussianShape.gaussian(x, 1.0, p[CENTER], p[WIDTH]);
        return p[AMPLITUDE] * (eta * lorentz + (1.0 - eta) * gauss);
    }

    @Override
    public double area(double[] p) {
        double sigma = p[WIDTH];
        double eta = p[3];
        return p[AMPLITUDE] * (eta * Math.PI * sigma + (1.0 - eta) * sigma * SQRT_2PI);
    }

    @Override
    public double fwhm(double[] p) {
        double sigma = p[WIDTH];
        double eta = p[3];
        // unit-height profile is monotone in |x|; the half-maximum lies in [σ, 1.18σ]
        double lo = 0.0;
        double hi = 2.0 * sigma;
        for (int i = 0; i < 60; i++) {
            double mid = 0.5 * (lo + hi);
            double v = eta * sigma * sigma / (mid * mid + sigma * sigma)
                    + (1.0 - eta) * Math.exp(-mid * mid / (2.0 * sigma * sigma));
            if (v > 0.5) lo = mid;
            else hi = mid;
        }
        return lo + hi;
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height, center, sigma, 0.3};
    }

    @Override
    public double[][] shapeBounds(double sigma) {
        return new double[][]{{0.0}, {1.0}};
    }
}
