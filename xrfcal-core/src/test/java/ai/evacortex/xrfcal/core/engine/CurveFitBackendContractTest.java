/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

abstract class CurveFitBackendContractTest {

    protected abstract CurveFitBackend backend();

    private static final ParametricModel LINE = (x, p) -> p[0] + p[1] * x;
    private static final ParametricModel GAUSS = (x, p) -> {
        double d = x - p[1];
        return p[0] * Math.exp(-d * d / (2 * p[2] * p[2]));
    };

    private static double[] xs(int n, double from, double step) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = from + i * step;
        return x;
    }

    private static double[] eval(ParametricModel m, double[] x, double... p) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) y[i] = m.value(x[i], p);
        return y;
    }

    @Test
    void recoversExactLine() {
        double[] x = xs(20, 0.0, 0.5);
        double[] y = eval(LINE, x, 1.0, 2.0);
        CurveFit fit = backend().fit(CurveFitProblem.of(x, y, LINE, new double[]{0.0, 0.0},
                new double[]{-10, -10}, new double[]{10, 10}));
        assertEquals(1.0, fit.parameters()[0], 1e-4);
        assertEquals(2.0, fit.parameters()[1], 1e-4);
        assertTrue(fit.rSquared() > 0.999999);
        assertEquals(x.length, fit.fitted().length);
    }

    @Test
    void recoversGaussian() {
        double[] x = xs(81, 6.0, 0.01);
        double[] y = eval(GAUSS, x, 500.0, 6.4, 0.05);
        CurveFit fit = backend().fit(CurveFitProblem.of(x, y, GAUSS, new double[]{400.0, 6.38, 0.06},
                new double[]{100, 6.3, 0.01}, new double[]{1000, 6.5, 0.2}));
        assertEquals(500.0, fit.parameters()[0], 1.0);
        assertEquals(6.4, fit.parameters()[1], 2e-4);
        assertEquals(0.05, fit.parameters()[2], 2e-4);
    }

    @Test
    void respectsBounds() {
        double[] x = xs(20, 0.0, 0.5);
        double[] y = eval(LINE, x, 1.0, 2.0);
        CurveFit fit = backend().fit(CurveFitProblem.of(x, y, LINE, new double[]{0.0, 0.5},
                new double[]{-10, 0.0}, new double[]{10, 1.5}));
        assertTrue(fit.parameters()[1] <= 1.5 + 1e-12, "slope must respect the upper bound");
        assertTrue(fit.parameters()[0] >= -10 && fit.parameters()[0] <= 10);
    }

    @Test
    void frozenParameterStaysPut() {
        double[] x = xs(20, 0.0, 0.5);
        double[] y = eval(LINE, x, 1.0, 2.0);
        CurveFit fit = backend().fit(CurveFitProblem.of(x, y, LINE, new double[]{3.0, 1.0},
                new double[]{3.0, -10}, new double[]{3.0, 10}));
        assertEquals(3.0, fit.parameters()[0], 0.0);
        assertEquals(0.0, fit.errors()[0], 0.0);
        assertTrue(Double.isFinite(fit.parameters()[1]));
    }

    @Test
    void weightsEmphasiseSelectedPoints() {
        double[] x = {0, 1, 2, 3};
        double[] y = {0, 1, 2, 30};
        double[] w = {1, 1, 1, 0};
        CurveFit fit = backend().fit(CurveFitProblem.of(x, y, LINE, new double[]{0.5, 0.5}, null, null)
                .withWeights(w));
        assertEquals(0.0, fit.parameters()[0], 1e-4);
        assertEquals(1.0, fit.parameters()[1], 1e-4);
    }

    @Test
    void malformedBoundsAreConfigurationErrors() {
        double[] x = {0, 1, 2};
        assertThrows(ConfigurationException.class, () -> CurveFitProblem.of(x, x, LINE,
                new double[]{0, 0}, new double[]{1, 1}, new double[]{0, 2}));
        assertThrows(ConfigurationException.class, () -> CurveFitProblem.of(x, x, LINE,
                new double[]{0, 0}, new double[]{0}, new double[]{1}));
    }
}
