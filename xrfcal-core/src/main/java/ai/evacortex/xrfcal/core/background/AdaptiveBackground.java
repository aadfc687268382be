/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.math.Filters;

/**
 * Low-percentile rank filter followed by Gaussian smoothing with {@code σ = window / 4}.
 * Aggressive; meant for spectra with sparse, weak peaks.
 */
public final class AdaptiveBackground implements BackgroundMethod {

    @Override
    public String name() {
        return "adaptive";
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        int window = options.adaptiveWindow();
        double[] floor = Filters.percentile(counts, window, options.adaptivePercentile());
        return Filters.gaussian(floor, window / 4.0);
    }
}
