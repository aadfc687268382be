/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.exceptions;

/**
 * The optimizer threw, or returned a non-finite parameter vector.
 */
public class FitDivergenceException extends RuntimeException {
    public FitDivergenceException(String message) {
        super("Fit diverged: " + message);
    }

    public FitDivergenceException(String message, Throwable cause) {
        super("Fit diverged: " + message, cause);
    }
}
