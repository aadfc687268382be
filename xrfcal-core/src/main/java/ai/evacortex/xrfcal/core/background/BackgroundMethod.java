/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import java.util.Set;

/**
 * {@code BackgroundMethod} estimates the smooth continuum beneath characteristic peaks.
 *
 * <p>Implementations are stateless and deterministic. They receive the raw energy axis and counts
 * and return a curve of the same length; the caller ({@link BackgroundEstimator}) clamps it to
 * {@code [0, counts[i]]}, so implementations need not do so themselves.</p>
 *
 * <p>Implementations are registered in a {@link BackgroundEstimator} under {@link #name()} and any
 * {@link #aliases()}. Names are matched case-insensitively.</p>
 *
 * @see BackgroundEstimator
 * @see BackgroundOptions
 */
public interface BackgroundMethod {

    /**
     * @return lower-case registry name, e.g. {@code "snip"}
     */
    String name();

    /**
     * @return alternative registry names
     */
    default Set<String> aliases() {
        return Set.of();
    }

    /**
     * Estimates the background curve.
     *
     * @param energy  energy axis in keV, strictly increasing
     * @param counts  detector counts, same length as {@code energy}
     * @param options method parameters; each method reads only its own fields
     * @return background curve, same length as {@code counts}
     * @throws ai.evacortex.xrfcal.core.exceptions.ConfigurationException if the options are unusable
     * @throws ai.evacortex.xrfcal.core.exceptions.InsufficientDataException if the input is too short
     */
    double[] estimate(double[] energy, double[] counts, BackgroundOptions options);
}
