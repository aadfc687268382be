/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Aggregate figures of a batch. Quality averages run over the successful items only and are 0
 * when there are none.
 *
 * @param successRate     successful items in percent of all items
 * @param averageFitTime  mean seconds per item, failures included
 * @param totalProcessingTime seconds summed over all items
 */
@JsonPropertyOrder({"total_spectra", "successful_fits", "failed_fits", "success_rate", "average_chi_squared",
        "average_r_squared", "average_fit_time", "total_processing_time"})
public record BatchSummary(
        @JsonProperty("total_spectra") int totalSpectra,
        @JsonProperty("successful_fits") int successfulFits,
        @JsonProperty("failed_fits") int failedFits,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("average_chi_squared") double averageChiSquared,
        @JsonProperty("average_r_squared") double averageRSquared,
        @JsonProperty("average_fit_time") double averageFitTime,
        @JsonProperty("total_processing_time") double totalProcessingTime
) {

    public static BatchSummary of(List<BatchItemResult> items) {
        int total = items.size();
        int ok = 0;
        double chi = 0.0;
        double r2 = 0.0;
        double time = 0.0;
        for (BatchItemResult item : items) {
            time += item.fitTime();
            if (item.success()) {
                ok++;
                chi += item.chiSquared();
                r2 += item.rSquared();
            }
        }
        return new BatchSummary(total, ok, total - ok,
                total > 0 ? 100.0 * ok / total : 0.0,
                ok > 0 ? chi / ok : 0.0,
                ok > 0 ? r2 / ok : 0.0,
                total > 0 ? time / total : 0.0,
                time);
    }
}
