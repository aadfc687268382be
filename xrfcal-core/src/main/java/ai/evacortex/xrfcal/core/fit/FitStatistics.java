/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.math.GoodnessOfFit;

/**
 * Goodness of fit of a reconstructed spectrum against measured counts, using Poisson variance
 * {@code max(counts, 1)}.
 */
public record FitStatistics(double chiSquared, double reducedChiSquared, double rSquared, int dof) {

    public static FitStatistics of(double[] counts, double[] fitted, int parameters) {
        double chi2 = 0.0;
        for (int i = 0; i < counts.length; i++) {
            double r = counts[i] - fitted[i];
            chi2 += r * r / (counts[i] > 0 ? counts[i] : 1.0);
        }
        int dof = counts.length - parameters;
        double reduced = dof > 0 ? chi2 / dof : Double.POSITIVE_INFINITY;
        return new FitStatistics(chi2, reduced, GoodnessOfFit.rSquared(counts, fitted), dof);
    }
}
