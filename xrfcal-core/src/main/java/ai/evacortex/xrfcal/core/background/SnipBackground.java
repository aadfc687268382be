/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

/**
 * Statistics-sensitive Non-linear Iterative Peak-clipping on the LLS-transformed counts.
 */
public final class SnipBackground implements BackgroundMethod {

    @Override
    public String name() {
        return "snip";
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        int n = counts.length;
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            double c = counts[i] <= 0 ? 1.0 : counts[i];
            v[i] = Math.log(Math.log(Math.sqrt(c + 1.0) + 1.0) + 1.0);
        }

        int iterations = options.snipIterations();
        for (int step = 0; step < iterations; step++) {
            int w = options.snipDecreasing() ? iterations - step : step + 1;
            // in place: a clipped sample already feeds its right-hand neighbours in the same pass
            for (int i = w; i < n - w; i++) {
                double avg = 0.5 * (v[i - w] + v[i + w]);
                if (avg < v[i]) v[i] = avg;
            }
        }

        double[] background = new double[n];
        for (int i = 0; i < n; i++) {
            double s = Math.exp(Math.exp(v[i]) - 1.0) - 1.0;
            background[i] = Math.max(0.0, s * s - 1.0);
        }
        return background;
    }
}
