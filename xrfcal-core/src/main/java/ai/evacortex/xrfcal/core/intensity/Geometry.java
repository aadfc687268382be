/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

/**
 * Excitation geometry, angles in degrees against the sample surface.
 */
public record Geometry(double incidentAngle, double takeoffAngle) {

    public Geometry {
        if (!(incidentAngle > 0 && incidentAngle < 90) || !(takeoffAngle > 0 && takeoffAngle < 90)) {
            throw new ConfigurationException("angles must lie in (0, 90) degrees: "
                    + incidentAngle + ", " + takeoffAngle);
        }
    }

    public static Geometry defaultGeometry() {
        return new Geometry(45.0, 45.0);
    }

    /** Angle between incident and detected photon directions, degrees. */
    public double scatteringAngle() {
        return 180.0 - (incidentAngle + takeoffAngle);
    }
}
