/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.math.PentadiagonalSolver;

import java.util.Arrays;
import java.util.Set;

/**
 * Asymmetric least squares baseline (Eilers and Boelens).
 *
 * <p>Each iteration solves {@code (W + λ·DᵀD) z = W·y} with {@code D} the second-difference
 * operator, then sets {@code w_i = p} where {@code y_i > z_i} and {@code 1 - p} elsewhere. Since
 * every weight is positive the system is positive definite for any {@code λ > 0}.</p>
 */
public final class AslsBackground implements BackgroundMethod {

    @Override
    public String name() {
        return "asls";
    }

    @Override
    public Set<String> aliases() {
        return Set.of("als");
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        int n = counts.length;
        double lambda = options.aslsLambda();
        double p = options.aslsP();

        double[][] penalty = PentadiagonalSolver.secondDifferencePenalty(n);
        double[] a1 = scaled(penalty[1], lambda);
        double[] a2 = scaled(penalty[2], lambda);

        double[] w = new double[n];
        Arrays.fill(w, 1.0);
        double[] z = counts.clone();
        double[] a0 = new double[n];
        double[] rhs = new double[n];

        for (int iter = 0; iter < options.aslsIterations(); iter++) {
            for (int i = 0; i < n; i++) {
                a0[i] = w[i] + lambda * penalty[0][i];
                rhs[i] = w[i] * counts[i];
            }
            z = PentadiagonalSolver.solve(a0, a1, a2, rhs);
            for (int i = 0; i < n; i++) {
                w[i] = counts[i] > z[i] ? p : 1.0 - p;
            }
        }
        return z;
    }

    private static double[] scaled(double[] band, double factor) {
        double[] out = new double[band.length];
        for (int i = 0; i < band.length; i++) {
            out[i] = band[i] * factor;
        }
        return out;
    }
}
