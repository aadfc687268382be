/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed energy interval in keV, persisted as a two-element array {@code [min, max]}.
 */
public record EnergyRange(double min, double max) {

    public static final EnergyRange DEFAULT = new EnergyRange(0.0, 20.0);

    public EnergyRange {
        if (!(min <= max)) {
            throw new IllegalArgumentException("Invalid energy range [" + min + ", " + max + "]");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EnergyRange fromArray(double[] bounds) {
        if (bounds == null || bounds.length != 2) {
            throw new IllegalArgumentException("energy_range must be [min, max]");
        }
        return new EnergyRange(bounds[0], bounds[1]);
    }

    @JsonValue
    public double[] toArray() {
        return new double[]{min, max};
    }

    public boolean contains(double energy) {
        return energy >= min && energy <= max;
    }

    public double width() {
        return max - min;
    }
}
