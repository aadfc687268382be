/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

/**
 * An entry of a reference-line table: line name (e.g. "Kα1") and energy in keV.
 */
public record EmissionLine(String name, double energyKeV) {
}
