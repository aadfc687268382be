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
import ai.evacortex.xrfcal.core.fit.PeakFitFailure;

/**
 * An expected line that did not yield an accepted width measurement. {@code line} is {@code null}
 * when the whole reference spectrum failed.
 */
public record RejectedLine(String reference, ElementLine line, PeakFitFailure reason, String message) {
}
