/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core;

import java.util.Objects;

/**
 * A characteristic emission line: element symbol, line name (e.g. "Kα1"), energy in keV and
 * expected relative intensity.
 */
public record ElementLine(String element, String line, double energyKeV, double relativeIntensity) {

    public ElementLine {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(line, "line must not be null");
        if (!(energyKeV > 0)) {
            throw new IllegalArgumentException("energy must be positive: " + energyKeV);
        }
    }

    public static ElementLine of(String element, String line, double energyKeV) {
        return new ElementLine(element, line, energyKeV, 1.0);
    }

    public String label() {
        return element + " " + line;
    }
}
