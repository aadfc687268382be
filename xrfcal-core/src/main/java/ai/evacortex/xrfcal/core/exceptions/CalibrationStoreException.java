/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.exceptions;

public class CalibrationStoreException extends RuntimeException {
    public CalibrationStoreException(String message) {
        super(message);
    }

    public CalibrationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
