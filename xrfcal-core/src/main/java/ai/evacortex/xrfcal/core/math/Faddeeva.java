/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

/**
 * Faddeeva function {@code w(z) = exp(-z²)·erfc(-iz)} for {@code Im z ≥ 0}.
 *
 * <p>Humlíček's W4 rational approximation (JQSRT 27, 1982), four regions selected by
 * {@code s = |x| + y}. Relative accuracy is about 1e-4, which is well below the Poisson noise of
 * any fitted spectrum.</p>
 */
public final class Faddeeva {

    private Faddeeva() {
    }

    public static Complex w(double x, double y) {
        if (y < 0) {
            throw new IllegalArgumentException("Faddeeva approximation requires Im z >= 0, got " + y);
        }
        Complex t = new Complex(y, -x);
        double s = Math.abs(x) + y;

        if (s >= 15.0) {
            return t.scale(0.5641896).divide(t.multiply(t).add(0.5));
        }
        if (s >= 5.5) {
            Complex u = t.multiply(t);
            Complex num = t.multiply(u.scale(0.5641896).add(1.410474));
            Complex den = u.multiply(u.add(3.0)).add(0.75);
            return num.divide(den);
        }
        if (y >= 0.195 * Math.abs(x) - 0.176) {
            Complex num = horner(t, 16.4955, 20.20933, 11.96482, 3.778987, 0.5642236);
            Complex den = horner(t, 16.4955, 38.82363, 39.27121, 21.69274, 6.699398, 1.0);
            return num.divide(den);
        }
        Complex u = t.multiply(t);
        Complex num = horner(u.negate(), 36183.31, 3321.9905, 1540.787, 219.0313, 35.76683, 1.320522, 0.56419);
        Complex den = horner(u.negate(), 32066.6, 24322.84, 9022.228, 2186.181, 364.2191, 61.57037, 1.841439, 1.0);
        return u.exp().subtract(t.multiply(num).divide(den));
    }

    /** Real part of {@link #w(double, double)}: the Voigt function {@code K(x, y)}. */
    public static double re(double x, double y) {
        return w(x, y).real;
    }

    // c[0] + c[1]·z + c[2]·z² + ...
    private static Complex horner(Complex z, double... c) {
        Complex acc = new Complex(c[c.length - 1], 0.0);
        for (int i = c.length - 2; i >= 0; i--) {
            acc = acc.multiply(z).add(c[i]);
        }
        return acc;
    }
}
