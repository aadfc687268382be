/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

/**
 * Solves symmetric positive-definite pentadiagonal systems by banded LDLᵀ factorization in O(n).
 *
 * <p>The matrix is given by its main diagonal {@code a0}, first super-diagonal {@code a1}
 * (length n-1) and second super-diagonal {@code a2} (length n-2).</p>
 */
public final class PentadiagonalSolver {

    private PentadiagonalSolver() {
    }

    public static double[] solve(double[] a0, double[] a1, double[] a2, double[] rhs) {
        int n = a0.length;
        if (rhs.length != n || (n > 1 && a1.length < n - 1) || (n > 2 && a2.length < n - 2)) {
            throw new IllegalArgumentException("Band lengths do not match system size " + n);
        }
        double[] d = new double[n];
        double[] e = new double[n]; // L[i+1][i]
        double[] f = new double[n]; // L[i+2][i]

        for (int i = 0; i < n; i++) {
            double di = a0[i];
            if (i >= 1) di -= e[i - 1] * e[i - 1] * d[i - 1];
            if (i >= 2) di -= f[i - 2] * f[i - 2] * d[i - 2];
            if (!(di > 0) || !Double.isFinite(di)) {
                throw new ArithmeticException("Matrix is not positive definite at row " + i);
            }
            d[i] = di;
            if (i + 1 < n) {
                double ei = a1[i];
                if (i >= 1) ei -= f[i - 1] * e[i - 1] * d[i - 1];
                e[i] = ei / di;
            }
            if (i + 2 < n) {
                f[i] = a2[i] / di;
            }
        }

        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            double u = rhs[i];
            if (i >= 1) u -= e[i - 1] * z[i - 1];
            if (i >= 2) u -= f[i - 2] * z[i - 2];
            z[i] = u;
        }
        for (int i = 0; i < n; i++) {
            z[i] /= d[i];
        }
        for (int i = n - 1; i >= 0; i--) {
            if (i + 1 < n) z[i] -= e[i] * z[i + 1];
            if (i + 2 < n) z[i] -= f[i] * z[i + 2];
        }
        return z;
    }

    /**
     * Bands of {@code DᵀD} for the (n-2)×n second-difference operator {@code D}.
     *
     * @return {@code {main, first, second}} diagonals
     */
    public static double[][] secondDifferencePenalty(int n) {
        double[] m0 = new double[n];
        double[] m1 = new double[Math.max(n - 1, 0)];
        double[] m2 = new double[Math.max(n - 2, 0)];
        double[] c = {1.0, -2.0, 1.0};
        for (int r = 0; r + 2 < n; r++) {
            for (int a = 0; a < 3; a++) {
                m0[r + a] += c[a] * c[a];
            }
            m1[r] += c[0] * c[1];
            m1[r + 1] += c[1] * c[2];
            m2[r] += c[0] * c[2];
        }
        return new double[][]{m0, m1, m2};
    }
}
