/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * Derivative-free Nelder–Mead on the weighted residual sum of squares. Points outside the box are
 * evaluated at their projection plus a quadratic penalty on the distance, which keeps the simplex
 * from stalling against a bound.
 */
public final class NelderMeadBackend extends AbstractCurveFitBackend {

    public static final String NAME = "nelder-mead";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Minimum minimize(FreeParameters free) {
        double[] start = free.start();
        double[] lo = free.lower();
        double[] hi = free.upper();
        double[] steps = new double[start.length];
        double[] scale = new double[start.length];
        for (int a = 0; a < start.length; a++) {
            double span = hi[a] - lo[a];
            scale[a] = Double.isFinite(span) ? span : Math.max(Math.abs(start[a]), 1e-3);
            steps[a] = 0.1 * scale[a];
        }

        ObjectiveFunction objective = new ObjectiveFunction(point -> {
            double[] clamped = free.clamp(point);
            double penalty = 0.0;
            for (int a = 0; a < point.length; a++) {
                double d = (point[a] - clamped[a]) / scale[a];
                penalty += d * d;
            }
            double ssr = free.weightedSsr(clamped);
            return ssr * (1.0 + penalty) + penalty;
        });

        SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-10);
        PointValuePair optimum = optimizer.optimize(
                new MaxEval(free.problem().maxEvaluations()),
                objective,
                GoalType.MINIMIZE,
                new InitialGuess(start),
                new NelderMeadSimplex(steps));
        return new Minimum(free.clamp(optimum.getPoint()), optimizer.getEvaluations());
    }
}
