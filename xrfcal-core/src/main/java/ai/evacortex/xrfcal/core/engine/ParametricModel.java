/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

/**
 * A scalar model {@code y = f(x; p)} to be fitted by a {@link CurveFitBackend}.
 */
@FunctionalInterface
public interface ParametricModel {

    double value(double x, double[] parameters);
}
