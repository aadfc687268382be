/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import java.util.List;

/**
 * Full-spectrum decomposition: continuum, fitted peaks, reconstruction and residuals.
 */
public record SpectrumFitResult(double[] background,
                                double[] fitted,
                                double[] residuals,
                                List<IdentifiedPeak> peaks,
                                List<PeakFitOutcome> failures,
                                FitStatistics statistics) {

    public SpectrumFitResult {
        peaks = List.copyOf(peaks);
        failures = List.copyOf(failures);
    }
}
