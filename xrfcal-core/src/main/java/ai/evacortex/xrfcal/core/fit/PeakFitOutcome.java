/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a fitted {@link Peak} or a typed failure, for one requested peak position. Batch loops
 * inspect outcomes rather than catching exceptions.
 */
public record PeakFitOutcome(double requestedEnergy, Peak peak, PeakFitFailure failure, String message) {

    public PeakFitOutcome {
        if ((peak == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of peak and failure must be set");
        }
    }

    public static PeakFitOutcome success(double requestedEnergy, Peak peak) {
        return new PeakFitOutcome(requestedEnergy, Objects.requireNonNull(peak), null, "ok");
    }

    public static PeakFitOutcome failure(double requestedEnergy, PeakFitFailure failure, String message) {
        return new PeakFitOutcome(requestedEnergy, null, Objects.requireNonNull(failure), message);
    }

    public boolean isSuccess() {
        return peak != null;
    }

    public Optional<Peak> asOptional() {
        return Optional.ofNullable(peak);
    }
}
