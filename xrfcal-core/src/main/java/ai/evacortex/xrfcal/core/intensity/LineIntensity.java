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
 * Predicted emission of one line: energy in keV and rate relative to the other lines of the same prediction.
 */
public record LineIntensity(double energyKeV, double relativeRate) {
}
