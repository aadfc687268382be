/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GoodnessOfFitTest {

    @Test
    void rSquaredHandlesConstantObservations() {
        assertEquals(1.0, GoodnessOfFit.rSquared(new double[]{2, 2, 2}, new double[]{2, 2, 2}));
        assertEquals(0.0, GoodnessOfFit.rSquared(new double[]{2, 2, 2}, new double[]{2, 2, 3}));
        assertEquals(1.0, GoodnessOfFit.rSquared(new double[]{1, 2, 3}, new double[]{1, 2, 3}));
    }

    @Test
    void informationCriteriaPenaliseParameters() {
        double ss = 0.5;
        int n = 10;
        assertEquals(n * Math.log(ss / n) + 4, GoodnessOfFit.aic(ss, n, 2), 1e-12);
        assertEquals(n * Math.log(ss / n) + 2 * Math.log(n), GoodnessOfFit.bic(ss, n, 2), 1e-12);
        assertTrue(GoodnessOfFit.aic(ss, n, 3) > GoodnessOfFit.aic(ss, n, 2));
        assertTrue(Double.isFinite(GoodnessOfFit.aic(0.0, n, 2)));
    }

    @Test
    void robustSigmaIgnoresSingleOutlier() {
        double[] values = {1.0, 1.1, 0.9, 1.05, 0.95, 50.0};
        double sigma = GoodnessOfFit.robustSigma(values);
        assertTrue(sigma < 0.2, "robust sigma " + sigma);
        assertEquals(1.025, GoodnessOfFit.median(values), 1e-12);
    }
}
