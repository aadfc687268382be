/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

/**
 * Why a single-peak fit produced no {@link Peak}.
 */
public enum PeakFitFailure {
    /** Fewer samples in the window than the configured minimum. */
    INSUFFICIENT_POINTS,
    /** No positive counts in the window. */
    NO_SIGNAL,
    /** Optimizer failure or non-finite result. */
    FIT_DIVERGED,
    /** Local maximum below the acceptance threshold. */
    TOO_WEAK,
    /** A fit converged but failed a quality or plausibility check. */
    REJECTED
}
