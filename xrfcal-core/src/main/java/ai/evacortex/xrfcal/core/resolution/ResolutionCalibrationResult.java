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
import ai.evacortex.xrfcal.core.ResolutionModel;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a resolution calibration. {@code model} is {@code null} unless {@code success}.
 *
 * @param accepted measurements used for the final regression
 * @param outliers measurements discarded by outlier rejection
 * @param rejected lines without an accepted measurement, with reasons
 */
public record ResolutionCalibrationResult(boolean success,
                                          String message,
                                          ResolutionModel model,
                                          List<PeakMeasurement> accepted,
                                          List<PeakMeasurement> outliers,
                                          List<RejectedLine> rejected) {

    public ResolutionCalibrationResult {
        accepted = List.copyOf(accepted);
        outliers = List.copyOf(outliers);
        rejected = List.copyOf(rejected);
    }

    static ResolutionCalibrationResult failed(String message, List<PeakMeasurement> accepted,
                                              List<PeakMeasurement> outliers, List<RejectedLine> rejected) {
        return new ResolutionCalibrationResult(false, message, null, accepted, outliers, rejected);
    }

    public Optional<ResolutionModel> asOptional() {
        return Optional.ofNullable(model);
    }
}
