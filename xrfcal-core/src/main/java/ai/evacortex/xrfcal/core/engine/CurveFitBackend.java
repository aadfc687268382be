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
 * {@code CurveFitBackend} is the capability interface for bounded non-linear least squares.
 *
 * <p>Concrete adapters wrap a particular optimizer. They are selected by name through
 * {@link FitBackends#forName(String)} when a fitter or calibrator is configured, so a missing
 * backend surfaces as a configuration error up front rather than during a fit.</p>
 *
 * <p>Implementations must be stateless and thread-safe: one instance may serve concurrent fits
 * of independent spectra.</p>
 *
 * @see AbstractCurveFitBackend
 * @see LevenbergMarquardtBackend
 * @see NelderMeadBackend
 */
public interface CurveFitBackend {

    /**
     * @return registry name, e.g. {@code "levenberg-marquardt"}
     */
    String name();

    /**
     * Solves the problem.
     *
     * @param problem bounded least-squares problem
     * @return converged fit with parameter errors
     * @throws ai.evacortex.xrfcal.core.exceptions.FitDivergenceException if the optimizer fails,
     *         exhausts its evaluation budget or produces non-finite parameters
     * @throws NullPointerException if {@code problem} is {@code null}
     */
    CurveFit fit(CurveFitProblem problem);
}
