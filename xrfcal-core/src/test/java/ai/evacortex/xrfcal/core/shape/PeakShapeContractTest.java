/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

abstract class PeakShapeContractTest {

    protected static final double CENTER = 6.4;

    protected abstract PeakShape shape();

    /** A representative parameter vector. */
    protected abstract double[] parameters();

    protected boolean symmetric() {
        return true;
    }

    /** Half-width of the numeric integration range, keV. */
    protected double integrationHalfWidth() {
        return 10.0;
    }

    @Test
    void areaMatchesNumericIntegral() {
        double[] p = parameters();
        double half = integrationHalfWidth();
        double step = 2e-4;
        int n = (int) Math.round(2 * half / step);
        double sum = 0.0;
        double prev = shape().value(CENTER - half, p);
        for (int i = 1; i <= n; i++) {
            double v = shape().value(CENTER - half + i * step, p);
            sum += 0.5 * (prev + v) * step;
            prev = v;
        }
        double area = shape().area(p);
        assertEquals(area, sum, 2e-3 * area, shape().id() + " area");
    }

    @Test
    void fwhmMatchesHalfMaximum() {
        if (!symmetric()) return;
        double[] p = parameters();
        double peak = shape().value(CENTER, p);
        double half = shape().fwhm(p) / 2;
        assertEquals(0.5, shape().value(CENTER + half, p) / peak, 5e-3, shape().id() + " right half maximum");
        assertEquals(0.5, shape().value(CENTER - half, p) / peak, 5e-3, shape().id() + " left half maximum");
    }

    @Test
    void guessAndBoundsMatchParameterCount() {
        double sigma = 0.05;
        double[] guess = shape().initialGuess(1000.0, CENTER, sigma);
        assertEquals(shape().parameterCount(), guess.length);
        assertEquals(CENTER, guess[PeakShape.CENTER], 0.0);
        double[][] bounds = shape().shapeBounds(sigma);
        assertEquals(shape().parameterCount() - 3, bounds[0].length);
        assertEquals(bounds[0].length, bounds[1].length);
        for (int j = 0; j < bounds[0].length; j++) {
            double g = guess[PeakShape.WIDTH + 1 + j];
            assertTrue(g >= bounds[0][j] && g <= bounds[1][j], "guess outside bounds for " + j);
        }
    }

    @Test
    void widthForFwhmInvertsFwhm() {
        double[] p = parameters().clone();
        p[PeakShape.WIDTH] = shape().widthForFwhm(0.15);
        if (symmetric() && shape().parameterCount() == 3) {
            assertEquals(0.15, shape().fwhm(p), 1e-12);
        }
        assertTrue(p[PeakShape.WIDTH] > 0);
    }

    @Test
    void peakIsMaximalAtCenterForSymmetricShapes() {
        if (!symmetric()) return;
        double[] p = parameters();
        double top = shape().value(CENTER, p);
        for (double d = 0.01; d < 1.0; d += 0.01) {
            assertTrue(shape().value(CENTER + d, p) < top);
            assertEquals(shape().value(CENTER + d, p), shape().value(CENTER - d, p), 1e-9 * top);
        }
    }
}
