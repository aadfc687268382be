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
 * {@code PeakShape} is a parametric line profile used to decompose a spectral region.
 *
 * <p>Every parameter vector starts with {@code (amplitude, center, width, ...)}. The width is the
 * Gaussian {@code σ} for every shape except the Lorentzian, where it is the half width {@code γ}.
 * Any further entries are shape parameters such as a Lorentzian admixture or a tail.</p>
 *
 * <p>Implementations are pure and stateless. They do not clamp their output: non-negativity is
 * guaranteed by the amplitude bound {@code ≥ 0} applied upstream by the fitter.</p>
 *
 * @see PeakShapeRegistry
 */
public interface PeakShape {

    double FWHM_PER_SIGMA = 2.0 * Math.sqrt(2.0 * Math.log(2.0));
    double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    int AMPLITUDE = 0;
    int CENTER = 1;
    int WIDTH = 2;

    /**
     * @return registry identifier, e.g. {@code "gaussian"}
     */
    String id();

    /**
     * @return parameter names in vector order
     */
    List<String> parameterNames();

    default int parameterCount() {
        return parameterNames().size();
    }

    /**
     * Evaluates the profile at a single energy.
     *
     * @param x energy in keV
     * @param p parameter vector
     * @return profile value
     */
    double value(double x, double[] p);

    default double[] evaluate(double[] x, double[] p) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = value(x[i], p);
        }
        return y;
    }

    /**
     * Integrated intensity of the profile, computed analytically.
     */
    double area(double[] p);

    /**
     * Full width at half maximum. For tailed shapes this is the width of the Gaussian core.
     */
    double fwhm(double[] p);

    /**
     * Width parameter that gives approximately the requested FWHM.
     */
    default double widthForFwhm(double fwhm) {
        return fwhm / FWHM_PER_SIGMA;
    }

    /**
     * Starting point for a fit.
     *
     * @param height local maximum of the windowed data
     * @param center candidate center in keV
     * @param sigma  Gaussian width predicted by the resolution model
     * @return full parameter vector
     */
    double[] initialGuess(double height, double center, double sigma);

    /**
     * Bounds of the shape parameters, i.e. entries past {@link #WIDTH}.
     *
     * @param sigma Gaussian width the guess was built from
     * @return {@code {lower, upper}}, both of length {@code parameterCount() - 3}
     */
    default double[][] shapeBounds(double sigma) {
        return new double[][]{new double[0], new double[0]};
    }
}
