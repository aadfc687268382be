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
import ai.evacortex.xrfcal.core.shape.PeakShape;

/**
 * Chooses the profile a known emission line is fitted with.
 */
@FunctionalInterface
public interface PeakShapeSelector {

    PeakShape select(ElementLine line);
}
