/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import java.util.Map;

/**
 * External fundamental-parameters engine.
 *
 * <p>Implementations compute relative characteristic-line rates for a sample of known composition
 * under the given excitation. The calibrator only consumes the result.</p>
 */
@FunctionalInterface
public interface IntensityPredictor {

    /**
     * @param composition   element symbol to weight fraction, summing to 1
     * @param excitationKeV tube voltage in kV, i.e. the highest photon energy
     * @param geometry      excitation geometry
     * @return element symbol to line name to predicted intensity
     */
    Map<String, Map<String, LineIntensity>> predictIntensities(Map<String, Double> composition,
                                                              double excitationKeV,
                                                              Geometry geometry);
}
