/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import ai.evacortex.xrfcal.core.exceptions.FitDivergenceException;
import ai.evacortex.xrfcal.core.math.GoodnessOfFit;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;
import java.util.Objects;

/**
 * Shared machinery for backends: removes frozen parameters, delegates the search over the free
 * ones to {@link #minimize(FreeParameters)}, then derives fitted values and the covariance
 * {@code (JᵀWJ)⁻¹·SSR/(n - k)} from a central-difference Jacobian.
 */
public abstract class AbstractCurveFitBackend implements CurveFitBackend {

    /** Result of the backend-specific search. */
    protected record Minimum(double[] point, int evaluations) {
    }

    @Override
    public final CurveFit fit(CurveFitProblem problem) {
        Objects.requireNonNull(problem, "problem must not be null");
        FreeParameters free = new FreeParameters(problem);

        Minimum minimum;
        if (free.count() == 0) {
            minimum = new Minimum(new double[0], 1);
        } else {
            try {
                minimum = minimize(free);
            } catch (IllegalStateException | IllegalArgumentException | ArithmeticException e) {
                throw new FitDivergenceException(name() + ": " + e.getMessage(), e);
            }
        }

        double[] params = free.expand(free.clamp(minimum.point()));
        for (double v : params) {
            if (!Double.isFinite(v)) {
                throw new FitDivergenceException(name() + " produced non-finite parameters " + Arrays.toString(params));
            }
        }

        double[] fitted = new double[problem.size()];
        double ssr = 0.0;
        for (int i = 0; i < fitted.length; i++) {
            fitted[i] = problem.model().value(problem.x()[i], params);
            double r = problem.weight(i) * (problem.y()[i] - fitted[i]);
            ssr += r * r;
        }
        if (!Double.isFinite(ssr)) {
            throw new FitDivergenceException(name() + " produced a non-finite model at " + Arrays.toString(params));
        }

        double[] errors = standardErrors(free, params, ssr);
        double r2 = GoodnessOfFit.rSquared(problem.y(), fitted);
        return new CurveFit(params, errors, fitted, ssr, r2, minimum.evaluations());
    }

    /**
     * Searches the free-parameter box.
     *
     * @param free reduced problem over the non-frozen parameters
     * @return best point found, in free-parameter coordinates
     */
    protected abstract Minimum minimize(FreeParameters free);

    private static double[] standardErrors(FreeParameters free, double[] params, double ssr) {
        CurveFitProblem problem = free.problem();
        double[] errors = new double[params.length];
        int n = problem.size();
        int k = free.count();
        if (k == 0) return errors;
        int dof = n - k;
        if (dof <= 0) {
            for (int j : free.indices()) errors[j] = Double.NaN;
            return errors;
        }
        double[][] jac = free.jacobian(free.reduce(params));
        RealMatrix j = new Array2DRowRealMatrix(jac, false);
        RealMatrix jtj = j.transpose().multiply(j);
        RealMatrix cov = new SingularValueDecomposition(jtj).getSolver().getInverse();
        double s2 = ssr / dof;
        int[] idx = free.indices();
        for (int a = 0; a < k; a++) {
            double var = cov.getEntry(a, a) * s2;
            errors[idx[a]] = var >= 0 ? Math.sqrt(var) : Double.NaN;
        }
        return errors;
    }

    /**
     * View of a {@link CurveFitProblem} restricted to its non-frozen parameters.
     */
    protected static final class FreeParameters {

        private final CurveFitProblem problem;
        private final int[] indices;

        FreeParameters(CurveFitProblem problem) {
            this.problem = problem;
            int k = problem.parameterCount();
            int count = 0;
            int[] tmp = new int[k];
            for (int i = 0; i < k; i++) {
                if (!problem.isFrozen(i)) tmp[count++] = i;
            }
            this.indices = Arrays.copyOf(tmp, count);
        }

        public CurveFitProblem problem() {
            return problem;
        }

        public int count() {
            return indices.length;
        }

        int[] indices() {
            return indices;
        }

        public double[] start() {
            return reduce(problem.start());
        }

        public double[] lower() {
            return reduce(problem.lower());
        }

        public double[] upper() {
            return reduce(problem.upper());
        }

        public double[] reduce(double[] full) {
            double[] out = new double[indices.length];
            for (int a = 0; a < indices.length; a++) out[a] = full[indices[a]];
            return out;
        }

        public double[] expand(double[] reduced) {
            double[] full = problem.start().clone();
            for (int a = 0; a < indices.length; a++) full[indices[a]] = reduced[a];
            return full;
        }

        public double[] clamp(double[] reduced) {
            double[] lo = lower();
            double[] hi = upper();
            double[] out = new double[reduced.length];
            for (int a = 0; a < reduced.length; a++) {
                out[a] = Math.min(Math.max(reduced[a], lo[a]), hi[a]);
            }
            return out;
        }

        /** Weighted model values {@code w_i·f(x_i; p)}. */
        public double[] weightedModel(double[] reduced) {
            double[] p = expand(reduced);
            double[] out = new double[problem.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = problem.weight(i) * problem.model().value(problem.x()[i], p);
            }
            return out;
        }

        /** Weighted observations {@code w_i·y_i}. */
        public double[] weightedTarget() {
            double[] out = new double[problem.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = problem.weight(i) * problem.y()[i];
            }
            return out;
        }

        public double weightedSsr(double[] reduced) {
            double[] model = weightedModel(reduced);
            double[] target = weightedTarget();
            double ss = 0.0;
            for (int i = 0; i < model.length; i++) {
                double r = target[i] - model[i];
                ss += r * r;
            }
            return ss;
        }

        /** Central-difference Jacobian of {@link #weightedModel(double[])}. */
        public double[][] jacobian(double[] reduced) {
            int n = problem.size();
            int k = reduced.length;
            double[][] jac = new double[n][k];
            for (int a = 0; a < k; a++) {
                double h = 1e-6 * Math.max(Math.abs(reduced[a]), 1e-4);
                double[] plus = reduced.clone();
                double[] minus = reduced.clone();
                plus[a] += h;
                minus[a] -= h;
                double[] fp = weightedModel(plus);
                double[] fm = weightedModel(minus);
                for (int i = 0; i < n; i++) {
                    jac[i][a] = (fp[i] - fm[i]) / (2.0 * h);
                }
            }
            return jac;
        }
    }
}
