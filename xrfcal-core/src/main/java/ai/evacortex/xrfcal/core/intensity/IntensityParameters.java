/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point in the intensity-calibration parameter space.
 *
 * <p>The array layout is {@code [fwhm0, epsilon, scale, a, b, c, scatter]}, followed in shape
 * refinement by {@code [tail_amplitude, tail_slope]} and one scale per element.</p>
 *
 * @param fwhm0         electronic-noise width, keV
 * @param epsilon       Fano term, keV
 * @param scale         common factor on all expected line heights
 * @param efficiency    relative detection efficiency
 * @param scatter       height of each scattered tube line
 * @param tailAmplitude height of the low-energy tail relative to the line height; 0 for pure Gaussians
 * @param tailSlope     decay of the low-energy tail, keV⁻¹
 * @param elementScales extra factor per element symbol; missing elements use 1
 */
public record IntensityParameters(double fwhm0,
                                  double epsilon,
                                  double scale,
                                  EfficiencyCurve efficiency,
                                  double scatter,
                                  double tailAmplitude,
                                  double tailSlope,
                                  Map<String, Double> elementScales) {

    public static final int SIZE = 7;
    public static final int TAIL_AMPLITUDE = 7;
    public static final int TAIL_SLOPE = 8;
    public static final int SHAPE_SIZE = 9;

    public IntensityParameters {
        elementScales = elementScales == null || elementScales.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(elementScales));
    }

    public IntensityParameters(double fwhm0, double epsilon, double scale, EfficiencyCurve efficiency, double scatter) {
        this(fwhm0, epsilon, scale, efficiency, scatter, 0.0, 0.0, Map.of());
    }

    public double elementScale(String element) {
        return elementScales.getOrDefault(element, 1.0);
    }

    static IntensityParameters fromArray(double[] p) {
        return fromArray(p, List.of());
    }

    static IntensityParameters fromArray(double[] p, List<String> elements) {
        EfficiencyCurve efficiency = new EfficiencyCurve(p[3], p[4], p[5]);
        if (p.length <= SIZE) {
            return new IntensityParameters(p[0], p[1], p[2], efficiency, p[6]);
        }
        Map<String, Double> scales = new LinkedHashMap<>();
        for (int k = 0; k < elements.size(); k++) {
            scales.put(elements.get(k), p[SHAPE_SIZE + k]);
        }
        return new IntensityParameters(p[0], p[1], p[2], efficiency, p[6], p[TAIL_AMPLITUDE], p[TAIL_SLOPE], scales);
    }

    double[] toArray() {
        return new double[]{fwhm0, epsilon, scale, efficiency.a(), efficiency.b(), efficiency.c(), scatter};
    }

    double[] toArray(List<String> elements) {
        double[] p = new double[SHAPE_SIZE + elements.size()];
        System.arraycopy(toArray(), 0, p, 0, SIZE);
        p[TAIL_AMPLITUDE] = tailAmplitude;
        p[TAIL_SLOPE] = tailSlope;
        for (int k = 0; k < elements.size(); k++) {
            p[SHAPE_SIZE + k] = elementScale(elements.get(k));
        }
        return p;
    }
}
