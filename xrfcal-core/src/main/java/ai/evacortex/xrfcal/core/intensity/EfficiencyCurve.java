/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

/**
 * Relative detection efficiency {@code a + bE + cE²}, clipped to {@code [0.1, 1.5]}.
 */
public record EfficiencyCurve(double a, double b, double c) {

    public static final double MIN = 0.1;
    public static final double MAX = 1.5;

    public static EfficiencyCurve flat() {
        return new EfficiencyCurve(1.0, 0.0, 0.0);
    }

    public double at(double energy) {
        double v = a + b * energy + c * energy * energy;
        return Math.min(Math.max(v, MIN), MAX);
    }
}
