/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.resolution;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.lines.StandardReferenceLines;

import java.util.List;
import java.util.Objects;

/**
 * A pure-element reference measurement and the characteristic lines it is expected to show.
 */
public record ReferenceSpectrum(String name, Spectrum spectrum, List<ElementLine> lines) {

    public ReferenceSpectrum {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        lines = List.copyOf(lines);
    }

    /** Reference with the built-in expected lines for {@code name}. */
    public static ReferenceSpectrum standard(String name, Spectrum spectrum) {
        return new ReferenceSpectrum(name, spectrum, StandardReferenceLines.lines(name));
    }
}
