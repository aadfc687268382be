/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

/**
 * Outcome of a converged {@link CurveFitBackend#fit(CurveFitProblem)}.
 *
 * @param parameters        best-fit parameters, frozen ones included
 * @param errors            one-sigma standard errors; 0 for frozen parameters, NaN without degrees of freedom
 * @param fitted            model evaluated at the problem's {@code x}
 * @param weightedSsr       weighted residual sum of squares at the optimum
 * @param rSquared          unweighted coefficient of determination
 * @param evaluations       model vector evaluations used by the optimizer
 */
public record CurveFit(double[] parameters,
                       double[] errors,
                       double[] fitted,
                       double weightedSsr,
                       double rSquared,
                       int evaluations) {
}
