/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.shape.PeakShape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fitted peak.
 *
 * @param energy      fitted center, keV
 * @param amplitude   fitted amplitude (integrated area for area-normalized shapes)
 * @param fwhm        full width at half maximum, keV
 * @param area        analytic integral of the fitted profile
 * @param shape       shape id
 * @param shapeParams width and shape parameters, in the shape's parameter order
 * @param rSquared    coefficient of determination over the fit window
 */
public record Peak(double energy,
                   double amplitude,
                   double fwhm,
                   double area,
                   String shape,
                   Map<String, Double> shapeParams,
                   double rSquared) {

    public Peak {
        shapeParams = Collections.unmodifiableMap(new LinkedHashMap<>(shapeParams));
    }

    static Peak of(PeakShape shape, double[] p, double rSquared) {
        Map<String, Double> params = new LinkedHashMap<>();
        List<String> names = shape.parameterNames();
        for (int i = PeakShape.WIDTH; i < names.size(); i++) {
            params.put(names.get(i), p[i]);
        }
        return new Peak(p[PeakShape.CENTER], p[PeakShape.AMPLITUDE], shape.fwhm(p), shape.area(p),
                shape.id(), params, rSquared);
    }

    /**
     * Rebuilds the full parameter vector for {@code shape}.
     */
    public double[] parameterVector(PeakShape shape) {
        List<String> names = shape.parameterNames();
        double[] p = new double[names.size()];
        p[PeakShape.AMPLITUDE] = amplitude;
        p[PeakShape.CENTER] = energy;
        for (int i = PeakShape.WIDTH; i < names.size(); i++) {
            Double v = shapeParams.get(names.get(i));
            if (v == null) {
                throw new IllegalArgumentException("peak of shape '" + this.shape + "' lacks '" + names.get(i) + "'");
            }
            p[i] = v;
        }
        return p;
    }
}
