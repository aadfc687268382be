/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core;

import ai.evacortex.xrfcal.core.fit.Peak;

/**
 * A fitted characteristic line attributed to an element: the unit consumed by resolution calibration.
 */
public record PeakMeasurement(String element,
                              String line,
                              double energy,
                              double amplitude,
                              double fwhm,
                              double area,
                              double rSquared) {

    public static PeakMeasurement of(String element, String line, Peak peak) {
        return new PeakMeasurement(element, line, peak.energy(), peak.amplitude(),
                peak.fwhm(), peak.area(), peak.rSquared());
    }

    public String label() {
        return element + " " + line;
    }
}
