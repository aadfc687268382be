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

class FaddeevaTest {

    @Test
    void matchesReferenceValues() {
        // w(i) = e·erfc(1)
        assertEquals(0.4275835762, Faddeeva.re(0.0, 1.0), 5e-4);
        Complex w = Faddeeva.w(1.0, 1.0);
        assertEquals(0.3047442053, w.real, 5e-4);
        assertEquals(0.2082189382, w.imag, 5e-4);
        assertEquals(1.0, Faddeeva.re(0.0, 0.0), 1e-4);
    }

    @Test
    void coversAllApproximationRegions() {
        // large |z|: w(z) ~ i / (sqrt(pi) z)
        Complex far = Faddeeva.w(30.0, 1.0);
        double denom = 30.0 * 30.0 + 1.0;
        assertEquals(1.0 / Math.sqrt(Math.PI) / denom, far.real, 1e-4);
        assertEquals(30.0 / Math.sqrt(Math.PI) / denom, far.imag, 1e-4);
        // small y, moderate x: real part tends to exp(-x^2)
        assertEquals(Math.exp(-4.0), Faddeeva.re(2.0, 1e-6), 5e-4);
        assertEquals(Math.exp(-0.25), Faddeeva.re(0.5, 1e-6), 5e-4);
    }

    @Test
    void realPartIsEvenInX() {
        for (double x = 0.1; x < 10; x += 0.7) {
            assertEquals(Faddeeva.re(x, 0.3), Faddeeva.re(-x, 0.3), 1e-12);
        }
    }

    @Test
    void negativeImaginaryPartIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Faddeeva.w(1.0, -0.1));
    }
}
