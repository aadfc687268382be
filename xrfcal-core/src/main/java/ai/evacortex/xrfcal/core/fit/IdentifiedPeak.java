/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.ElementLine;

import java.util.List;

/**
 * A fitted peak with the emission line it was placed at. {@code line} is {@code null} for peaks
 * found by {@link PeakFinder} away from every known line.
 *
 * @param blendedLines further known lines unresolved from {@code line} and fitted as part of this peak
 */
public record IdentifiedPeak(Peak peak, ElementLine line, boolean tubeLine, List<ElementLine> blendedLines) {

    public IdentifiedPeak {
        blendedLines = blendedLines == null ? List.of() : List.copyOf(blendedLines);
    }

    public IdentifiedPeak(Peak peak, ElementLine line, boolean tubeLine) {
        this(peak, line, tubeLine, List.of());
    }

    public boolean isIdentified() {
        return line != null;
    }

    public boolean isBlend() {
        return !blendedLines.isEmpty();
    }
}
