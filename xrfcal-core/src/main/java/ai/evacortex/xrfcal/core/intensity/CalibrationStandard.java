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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reference material of certified composition and the conditions it was measured under.
 *
 * @param concentrations element symbol to concentration in ppm (mg/kg)
 * @param excitationKeV  tube voltage in kV
 * @param tubeLines      anode line energies in keV that scatter off the sample; may be empty
 */
public record CalibrationStandard(String name,
                                  Map<String, Double> concentrations,
                                  double excitationKeV,
                                  Geometry geometry,
                                  List<Double> tubeLines) {

    public CalibrationStandard {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(concentrations, "concentrations must not be null");
        if (!(excitationKeV > 0)) {
            throw new ConfigurationException("excitation energy must be positive: " + excitationKeV);
        }
        concentrations = Collections.unmodifiableMap(new LinkedHashMap<>(concentrations));
        geometry = geometry == null ? Geometry.defaultGeometry() : geometry;
        tubeLines = tubeLines == null ? List.of() : List.copyOf(tubeLines);
    }

    public static CalibrationStandard of(String name, Map<String, Double> concentrations, double excitationKeV) {
        return new CalibrationStandard(name, concentrations, excitationKeV, Geometry.defaultGeometry(), List.of());
    }

    /**
     * Weight fractions of the positive concentrations, normalized to sum to 1.
     */
    public Map<String, Double> composition() {
        double total = 0;
        for (double ppm : concentrations.values()) {
            if (ppm > 0) total += ppm;
        }
        Map<String, Double> out = new LinkedHashMap<>();
        if (total <= 0) return out;
        for (Map.Entry<String, Double> e : concentrations.entrySet()) {
            if (e.getValue() > 0) out.put(e.getKey(), e.getValue() / total);
        }
        return out;
    }
}
