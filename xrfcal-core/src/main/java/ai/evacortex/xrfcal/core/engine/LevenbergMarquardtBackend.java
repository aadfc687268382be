/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Levenberg–Marquardt with box constraints enforced by projecting every trial point onto the
 * bounds.
 */
public final class LevenbergMarquardtBackend extends AbstractCurveFitBackend {

    public static final String NAME = "levenberg-marquardt";

    private static final double TOLERANCE = 1e-10;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Minimum minimize(FreeParameters free) {
        int max = free.problem().maxEvaluations();
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(free.start())
                .model(free::weightedModel, free::jacobian)
                .target(free.weightedTarget())
                .parameterValidator(new BoxValidator(free))
                .lazyEvaluation(false)
                .maxIterations(max)
                .maxEvaluations(max)
                .build();

        LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(TOLERANCE)
                .withParameterRelativeTolerance(TOLERANCE)
                .optimize(problem);
        return new Minimum(optimum.getPoint().toArray(), optimum.getEvaluations());
    }

    private static final class BoxValidator implements ParameterValidator {
        private final FreeParameters free;

        BoxValidator(FreeParameters free) {
            this.free = free;
        }

        @Override
        public RealVector validate(RealVector params) {
            return new ArrayRealVector(free.clamp(params.toArray()), false);
        }
    }
}
