/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

public final class NoBackground implements BackgroundMethod {

    @Override
    public String name() {
        return "none";
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        return new double[counts.length];
    }
}
