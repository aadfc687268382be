/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.batch;

/**
 * Progress of a {@link BatchProcessor} run.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = (completed, total, item) -> {
    };

    /**
     * Called after every spectrum, successful or not.
     *
     * @param completed 1-based count of finished spectra
     */
    void onItem(int completed, int total, BatchItemResult item);
}
