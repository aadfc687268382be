/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.exceptions;

public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super("Insufficient data: " + message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super("Insufficient data: " + message, cause);
    }
}
