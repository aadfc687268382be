/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import ai.evacortex.xrfcal.core.math.Faddeeva;

import java.util.List;

/**
 * Area-normalized Voigt profile {@code amp · Re w(z) / (σ√(2π))}, {@code z = ((x - c) + iγ) / (σ√2)}.
 *
 * <p>The amplitude is the integrated area, so the initial guess converts the local height with the
 * Gaussian peak factor. FWHM uses the Olivero–Longbothum approximation (0.02 % accuracy).</p>
 */
public final class VoigtShape implements PeakShape {

    static final double GAMMA_PER_SIGMA = 0.15;
    private static final double SQRT2 = Math.sqrt(2.0);

    @Override
    public String id() {
        return "voigt";
    }

    @Override
    public List<String> parameterNames() {
        return List.of("amplitude", "center", "sigma", "gamma");
    }

    @Override
    public double value(double x, double[] p) {
        double sigma = p[WIDTH];
        double gamma = p[3];
        double re = Faddeeva.re((x - p[CENTER]) / (sigma * SQRT2), gamma / (sigma * SQRT2));
        return p[AMPLITUDE] * re / (sigma * SQRT_2PI);
    }

    @Override
    public double area(double[] p) {
        return p[AMPLITUDE];
    }

    @Override
    public double fwhm(double[] p) {
        double fg = FWHM_PER_SIGMA * p[WIDTH];
        double fl = 2.0 * p[3];
        return 0.5346 * fl + Math.sqrt(0.2166 * fl * fl + fg * fg);
    }

    @Override
    public double[] initialGuess(double height, double center, double sigma) {
        return new double[]{height * sigma * SQRT_2PI, center, sigma, GAMMA_PER_SIGMA * sigma};
    }

    @Override
    public double[][] shapeBounds(double sigma) {
        return new double[][]{{0.001}, {2.0 * sigma}};
    }
}
