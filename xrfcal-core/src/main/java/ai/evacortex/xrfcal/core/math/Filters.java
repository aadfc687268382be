/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

import java.util.Arrays;

/**
 * One-dimensional smoothing filters with half-sample symmetric ("reflect") boundaries.
 */
public final class Filters {

    private Filters() {
    }

    /**
     * Moving-window percentile filter. The window covers {@code i - size/2 .. i - size/2 + size - 1}
     * and picks rank {@code floor(size · percentile / 100)}.
     */
    public static double[] percentile(double[] data, int size, double percentile) {
        if (size < 1) throw new IllegalArgumentException("window size must be >= 1");
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in [0, 100]: " + percentile);
        }
        int n = data.length;
        int rank = Math.min((int) (size * percentile / 100.0), size - 1);
        int origin = size / 2;
        double[] out = new double[n];
        double[] window = new double[size];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < size; k++) {
                window[k] = data[reflect(i - origin + k, n)];
            }
            Arrays.sort(window);
            out[i] = window[rank];
        }
        return out;
    }

    /** Gaussian smoothing truncated at {@code 4σ}. */
    public static double[] gaussian(double[] data, double sigma) {
        int n = data.length;
        if (sigma <= 0 || n == 0) return data.clone();
        int radius = (int) (4.0 * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0.0;
        for (int k = -radius; k <= radius; k++) {
            double w = Math.exp(-0.5 * k * k / (sigma * sigma));
            kernel[k + radius] = w;
            sum += w;
        }
        for (int k = 0; k < kernel.length; k++) {
            kernel[k] /= sum;
        }
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = 0.0;
            for (int k = -radius; k <= radius; k++) {
                acc += kernel[k + radius] * data[reflect(i + k, n)];
            }
            out[i] = acc;
        }
        return out;
    }

    static int reflect(int index, int n) {
        if (n == 1) return 0;
        int period = 2 * n;
        int k = index % period;
        if (k < 0) k += period;
        return k < n ? k : period - 1 - k;
    }
}
