/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.exceptions.InsufficientDataException;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;

/**
 * Least-squares polynomial over the channels outside the ROI mask, evaluated on the full axis.
 */
public final class PolynomialBackground implements BackgroundMethod {

    @Override
    public String name() {
        return "polynomial";
    }

    @Override
    public double[] estimate(double[] energy, double[] counts, BackgroundOptions options) {
        boolean[] mask = options.roiMask();
        if (mask != null && mask.length != counts.length) {
            throw new ConfigurationException("ROI mask length " + mask.length + " != spectrum length " + counts.length);
        }
        int degree = options.polynomialDegree();

        WeightedObservedPoints points = new WeightedObservedPoints();
        int used = 0;
        for (int i = 0; i < counts.length; i++) {
            if (mask != null && mask[i]) continue;
            points.add(energy[i], counts[i]);
            used++;
        }
        if (used < degree + 1) {
            throw new InsufficientDataException(used + " unmasked channels for a degree " + degree + " polynomial");
        }

        double[] coefficients = PolynomialCurveFitter.create(degree).fit(points.toList());
        PolynomialFunction poly = new PolynomialFunction(coefficients);
        double[] background = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            background[i] = Math.max(0.0, poly.value(energy[i]));
        }
        return background;
    }
}
