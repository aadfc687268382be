/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Fit-quality and robust-scale helpers shared by the fitters and calibrators.
 */
public final class GoodnessOfFit {

    /** Floor applied to residual sums before taking logarithms. */
    public static final double MIN_SS_RES = 1e-300;

    private static final double MAD_TO_SIGMA = 1.4826;

    private GoodnessOfFit() {
    }

    public static double sumSquaredResiduals(double[] observed, double[] predicted) {
        double ss = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double r = observed[i] - predicted[i];
            ss += r * r;
        }
        return ss;
    }

    /**
     * Coefficient of determination. A constant observation vector yields 1 for a perfect fit and
     * 0 otherwise.
     */
    public static double rSquared(double[] observed, double[] predicted) {
        double mean = 0.0;
        for (double v : observed) mean += v;
        mean /= observed.length;
        double ssTot = 0.0;
        for (double v : observed) ssTot += (v - mean) * (v - mean);
        double ssRes = sumSquaredResiduals(observed, predicted);
        if (ssTot == 0.0) return ssRes == 0.0 ? 1.0 : 0.0;
        return 1.0 - ssRes / ssTot;
    }

    public static double rmse(double[] observed, double[] predicted) {
        return Math.sqrt(sumSquaredResiduals(observed, predicted) / observed.length);
    }

    /** {@code n·ln(SSres/n) + 2k} */
    public static double aic(double ssRes, int n, int k) {
        return n * Math.log(Math.max(ssRes, MIN_SS_RES) / n) + 2.0 * k;
    }

    /** {@code n·ln(SSres/n) + k·ln(n)} */
    public static double bic(double ssRes, int n, int k) {
        return n * Math.log(Math.max(ssRes, MIN_SS_RES) / n) + k * Math.log(n);
    }

    public static double median(double[] values) {
        return new Median().evaluate(values);
    }

    /** Median absolute deviation scaled to a normal-equivalent standard deviation. */
    public static double robustSigma(double[] values) {
        double med = median(values);
        double[] dev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            dev[i] = Math.abs(values[i] - med);
        }
        return MAD_TO_SIGMA * median(dev);
    }
}
