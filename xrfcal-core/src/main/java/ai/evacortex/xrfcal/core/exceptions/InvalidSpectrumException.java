/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.exceptions;

public class InvalidSpectrumException extends RuntimeException {
    public InvalidSpectrumException(String message) {
        super("Invalid Spectrum: " + message);
    }

    public InvalidSpectrumException(String message, Throwable cause) {
        super("Invalid Spectrum: " + message, cause);
    }
}
