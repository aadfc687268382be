/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.batch;

import ai.evacortex.xrfcal.core.fit.SpectrumFitResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one spectrum of a batch. Failed items carry an infinite χ², an R² of 0 and no fit.
 *
 * @param chiSquared reduced χ² of the decomposition
 * @param fitTime    wall-clock seconds spent on this spectrum
 */
@JsonPropertyOrder({"name", "success", "chi_squared", "r_squared", "error_message", "fit_time"})
public record BatchItemResult(
        @JsonProperty("name") String name,
        @JsonProperty("success") boolean success,
        @JsonIgnore SpectrumFitResult fit,
        @JsonProperty("chi_squared") double chiSquared,
        @JsonProperty("r_squared") double rSquared,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("fit_time") double fitTime
) {

    static BatchItemResult succeeded(String name, SpectrumFitResult fit, double fitTime) {
        return new BatchItemResult(name, true, fit, fit.statistics().reducedChiSquared(),
                fit.statistics().rSquared(), null, fitTime);
    }

    static BatchItemResult failed(String name, String message, double fitTime) {
        return new BatchItemResult(name, false, null, Double.POSITIVE_INFINITY, 0.0, message, fitTime);
    }
}
