/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.Spectrum;

import java.util.List;

/**
 * Supplies the characteristic lines, with relative intensities, that the synthetic spectrum is built from.
 *
 * @see MeasuredLineSource
 * @see PredictedLineSource
 */
public interface ExpectedLineSource {

    /**
     * @param standard reference material under calibration
     * @param measured its measured spectrum; sources that do not read it may ignore it
     * @return lines with {@link ElementLine#relativeIntensity()} as the expected peak height up to a
     *         common scale; empty when nothing usable was found
     */
    List<ElementLine> expectedLines(CalibrationStandard standard, Spectrum measured);
}
