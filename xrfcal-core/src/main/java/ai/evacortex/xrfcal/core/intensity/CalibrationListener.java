/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

/**
 * Observes an intensity calibration while it runs.
 */
@FunctionalInterface
public interface CalibrationListener {

    CalibrationListener NONE = (evaluation, objective, parameters) -> true;

    /**
     * Called after every objective evaluation.
     *
     * @param evaluation 1-based evaluation count
     * @param objective  weighted residual sum at {@code parameters}
     * @param parameters physical parameter values, not normalized
     * @return {@code false} to stop the calibration after this evaluation
     */
    boolean onEvaluation(int evaluation, double objective, IntensityParameters parameters);
}
