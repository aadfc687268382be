/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.resolution;

import ai.evacortex.xrfcal.core.PeakMeasurement;

import java.util.List;

/**
 * Split of a measurement set into kept points and discarded outliers, with the residuals of every
 * input point against the robust reference curve and the scale they were judged by.
 */
public record OutlierRejection(List<PeakMeasurement> kept,
                               List<PeakMeasurement> outliers,
                               double[] residuals,
                               double residualSigma) {

    public OutlierRejection {
        kept = List.copyOf(kept);
        outliers = List.copyOf(outliers);
    }
}
