/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

/**
 * Straight line between two anchors: the mean of the first and last 5 % of channels, or the
 * channels named in {@link BackgroundOptions#linearStart()} and {@link BackgroundOptions#linearEnd()}.
 */
public final class LinearBackground implements BackgroundMethod {

    private static final double EDGE_FRACTION = 0.05;

    @Override
    public String name() {
        return "linear";
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        int n = counts.length;
        int edge = Math.max(1, (int) (n * EDGE_FRACTION));

        double startE;
        double startC;
        if (options.linearStart() == null) {
            startE = mean(energy, 0, edge);
            startC = mean(counts, 0, edge);
        } else {
            int idx = checkIndex(options.linearStart(), n);
            startE = energy[idx];
            startC = counts[idx];
        }

        double endE;
        double endC;
        if (options.linearEnd() == null) {
            endE = mean(energy, n - edge, n);
            endC = mean(counts, n - edge, n);
        } else {
            int idx = checkIndex(options.linearEnd(), n);
            endE = energy[idx];
            endC = counts[idx];
        }

        double slope = endE == startE ? 0.0 : (endC - startC) / (endE - startE);
        double[] background = new double[n];
        for (int i = 0; i < n; i++) {
            background[i] = startC + slope * (energy[i] - startE);
        }
        return background;
    }

    private static int checkIndex(int idx, int n) {
        if (idx < 0 || idx >= n) {
            throw new ConfigurationException("linear endpoint " + idx + " outside [0, " + n + ")");
        }
        return idx;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }
}
