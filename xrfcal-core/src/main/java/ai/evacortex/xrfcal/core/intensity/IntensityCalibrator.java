/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.exceptions.InsufficientDataException;
import ai.evacortex.xrfcal.core.exceptions.InvalidSpectrumException;
import ai.evacortex.xrfcal.core.math.GoodnessOfFit;
import ai.evacortex.xrfcal.core.storage.SpectrumFingerprint;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Calibrates resolution, intensity scale, detection efficiency and scatter against a standard.
 *
 * <p>A {@link SyntheticSpectrum} built from the expected lines is compared with the measurement
 * using Poisson weights on channels above the noise floor. The parameters are optimized with
 * BOBYQA on the box rescaled to the unit hypercube. Quality figures are reported on the full
 * channel grid after rescaling the synthesized net spectrum to the measured peak height.</p>
 *
 * <p>With {@link IntensityCalibrationOptions#refineShape()} the box also holds the hypermet tail
 * amplitude and slope and one intensity scale per element.</p>
 *
 * <p>Data-dependent failures of the background step or the optimizer are reported through an
 * unsuccessful {@link CalibrationResult}; configuration errors are thrown.</p>
 *
 * <p>Instances are immutable. A single call is single-threaded and can be stopped through its
 * {@link CalibrationListener}.</p>
 */
public final class IntensityCalibrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(IntensityCalibrator.class);

    /** Objective value substituted for non-finite evaluations. */
    public static final double PENALTY = 1e10;

    private static final double DEFAULT_FWHM0 = 0.080;
    private static final double DEFAULT_EPSILON = 0.002;

    private final ExpectedLineSource lineSource;
    private final BackgroundEstimator backgrounds;
    private final IntensityCalibrationOptions options;

    public IntensityCalibrator(ExpectedLineSource lineSource) {
        this(lineSource, new BackgroundEstimator(), IntensityCalibrationOptions.defaultOptions());
    }

    public IntensityCalibrator(ExpectedLineSource lineSource, IntensityCalibrationOptions options) {
        this(lineSource, new BackgroundEstimator(), options);
    }

    public IntensityCalibrator(ExpectedLineSource lineSource, BackgroundEstimator backgrounds,
                               IntensityCalibrationOptions options) {
        this.lineSource = Objects.requireNonNull(lineSource, "line source must not be null");
        this.backgrounds = Objects.requireNonNull(backgrounds, "backgrounds must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        backgrounds.method(options.backgroundMethod());
    }

    public IntensityCalibrationOptions options() {
        return options;
    }

    public CalibrationResult calibrate(Spectrum measured, CalibrationStandard standard) {
        return calibrate(measured, standard, CalibrationListener.NONE);
    }

    public CalibrationResult calibrate(Spectrum measured, CalibrationStandard standard, CalibrationListener listener) {
        Objects.requireNonNull(measured, "measured spectrum must not be null");
        Objects.requireNonNull(standard, "standard must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        String fingerprint = SpectrumFingerprint.of(measured);
        ResolutionModel prior = options.resolutionPrior();
        double[] width = prior != null ? prior.detectorEquivalent() : new double[]{DEFAULT_FWHM0, DEFAULT_EPSILON};

        List<ElementLine> lines = lineSource.expectedLines(standard, measured);
        if (lines == null || lines.isEmpty()) {
            return failed(width, "no expected lines for standard '" + standard.name() + "'", 0, fingerprint);
        }
        LOGGER.info("Calibrating intensities of '{}' from {} lines", standard.name(), lines.size());

        double[] energy = measured.energy();
        double[] counts = measured.counts();
        double[] background;
        try {
            background = backgrounds.estimate(measured, options.backgroundMethod(), options.backgroundOptions());
        } catch (InsufficientDataException | InvalidSpectrumException | MathIllegalStateException e) {
            return failed(width, "background estimation failed: " + e.getMessage(), 0, fingerprint);
        }
        double[] net = BackgroundEstimator.subtract(counts, background);
        SyntheticSpectrum model = new SyntheticSpectrum(energy, lines, standard.tubeLines(), standard.geometry());
        List<String> elements = model.elements();

        int size = options.refineShape() ? IntensityParameters.SHAPE_SIZE + elements.size() : IntensityParameters.SIZE;
        double[] lower = new double[size];
        double[] upper = new double[size];
        if (prior != null) {
            double tol = options.priorTolerance();
            lower[0] = width[0] * (1 - tol);
            upper[0] = width[0] * (1 + tol);
            lower[1] = width[1] * (1 - tol);
            upper[1] = width[1] * (1 + tol);
        } else {
            lower[0] = IntensityCalibrationOptions.DEFAULT_FWHM0_BOUNDS[0];
            upper[0] = IntensityCalibrationOptions.DEFAULT_FWHM0_BOUNDS[1];
            lower[1] = IntensityCalibrationOptions.DEFAULT_EPSILON_BOUNDS[0];
            upper[1] = IntensityCalibrationOptions.DEFAULT_EPSILON_BOUNDS[1];
        }
        // detectorEquivalent of a non-detector prior may have ε = 0
        if (!(upper[1] > lower[1])) {
            lower[1] = IntensityCalibrationOptions.DEFAULT_EPSILON_BOUNDS[0];
            upper[1] = IntensityCalibrationOptions.DEFAULT_EPSILON_BOUNDS[1];
        }

        double[] lineOnly = model.net(new IntensityParameters(width[0], width[1], 1.0, EfficiencyCurve.flat(), 0.0));
        double scale0 = projection(net, lineOnly);
        if (!(scale0 > 0)) {
            return failed(width, "no signal at the expected lines", 0, fingerprint);
        }
        lower[2] = scale0 / 10;
        upper[2] = scale0 * 10;
        System.arraycopy(IntensityCalibrationOptions.EFFICIENCY_LOWER, 0, lower, 3, 3);
        System.arraycopy(IntensityCalibrationOptions.EFFICIENCY_UPPER, 0, upper, 3, 3);

        double scatter0 = 0.0;
        if (model.hasScatter()) {
            double[] scatterOnly = model.net(new IntensityParameters(width[0], width[1], 0.0, EfficiencyCurve.flat(), 1.0));
            double[] rest = new double[net.length];
            for (int i = 0; i < rest.length; i++) {
                rest[i] = net[i] - scale0 * lineOnly[i];
            }
            upper[6] = Math.max(max(net), 1.0);
            scatter0 = Math.min(Math.max(projection(rest, scatterOnly), 0.0), upper[6]);
        }

        double[] start = new double[size];
        System.arraycopy(new double[]{width[0], width[1], scale0, 1.0, 0.0, 0.0, scatter0}, 0,
                start, 0, IntensityParameters.SIZE);
        if (options.refineShape()) {
            lower[IntensityParameters.TAIL_AMPLITUDE] = IntensityCalibrationOptions.TAIL_AMPLITUDE_BOUNDS[0];
            upper[IntensityParameters.TAIL_AMPLITUDE] = IntensityCalibrationOptions.TAIL_AMPLITUDE_BOUNDS[1];
            start[IntensityParameters.TAIL_AMPLITUDE] = IntensityCalibrationOptions.DEFAULT_TAIL_AMPLITUDE;
            lower[IntensityParameters.TAIL_SLOPE] = IntensityCalibrationOptions.TAIL_SLOPE_BOUNDS[0];
            upper[IntensityParameters.TAIL_SLOPE] = IntensityCalibrationOptions.TAIL_SLOPE_BOUNDS[1];
            start[IntensityParameters.TAIL_SLOPE] = IntensityCalibrationOptions.DEFAULT_TAIL_SLOPE;
            for (int k = IntensityParameters.SHAPE_SIZE; k < size; k++) {
                lower[k] = IntensityCalibrationOptions.ELEMENT_SCALE_BOUNDS[0];
                upper[k] = IntensityCalibrationOptions.ELEMENT_SCALE_BOUNDS[1];
                start[k] = 1.0;
            }
        }
        for (int i = 0; i < start.length; i++) {
            start[i] = Math.min(Math.max(start[i], lower[i]), upper[i]);
        }

        int[] channels = channels(counts);
        if (channels.length == 0) {
            return failed(width, "no channels above the noise floor of " + options.noiseFloor(), 0, fingerprint);
        }

        Objective objective = new Objective(model, background, counts, channels, start, lower, upper, listener);
        LOGGER.debug("Optimizing {} free parameters over {} channels", objective.free.length, channels.length);
        String message;
        boolean success;
        try {
            int n = objective.free.length;
            BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * n + 1,
                    options.initialTrustRadius(), options.stoppingTrustRadius());
            double[] unitLower = new double[n];
            double[] unitUpper = new double[n];
            Arrays.fill(unitUpper, 1.0);
            optimizer.optimize(
                    new MaxEval(options.maxEvaluations()),
                    new ObjectiveFunction(objective::value),
                    GoalType.MINIMIZE,
                    new InitialGuess(objective.toUnit(start)),
                    new SimpleBounds(unitLower, unitUpper));
            success = true;
            message = "converged after " + objective.evaluations + " evaluations";
        } catch (TooManyEvaluationsException e) {
            success = false;
            message = "evaluation budget of " + options.maxEvaluations() + " exhausted";
        } catch (CalibrationCancelledException e) {
            success = false;
            message = "cancelled after " + objective.evaluations + " evaluations";
        } catch (MathIllegalStateException e) {
            success = false;
            message = "optimizer stopped: " + e.getMessage();
        }
        if (objective.best == null) {
            return failed(width, message, objective.evaluations, fingerprint);
        }

        IntensityParameters best = IntensityParameters.fromArray(objective.best, elements);
        double[] synthNet = model.net(best);
        double peak = max(synthNet);
        double factor = peak > 0 ? max(net) / peak : 1.0;
        double[] fitted = new double[counts.length];
        double chi = 0.0;
        for (int i = 0; i < counts.length; i++) {
            fitted[i] = background[i] + factor * synthNet[i];
            double r = counts[i] - fitted[i];
            chi += r * r / Math.max(counts[i], 1.0);
        }
        int dof = counts.length - objective.free.length;
        double reducedChi = dof > 0 ? chi / dof : Double.POSITIVE_INFINITY;
        double r2 = GoodnessOfFit.rSquared(counts, fitted);

        if (success) {
            LOGGER.info("Intensity calibration of '{}': FWHM0 {} eV, eps {} eV, R2 {}", standard.name(),
                    best.fwhm0() * 1000, best.epsilon() * 1000, r2);
        } else {
            LOGGER.warn("Intensity calibration of '{}' stopped: {}", standard.name(), message);
        }
        return new CalibrationResult(best.fwhm0(), best.epsilon(), CalibrationResult.efficiencyMap(best.efficiency()),
                best.scale(), best.scatter(), best.tailAmplitude(), best.tailSlope(), best.elementScales(),
                reducedChi, r2, success, message,
                prior != null ? prior.kind().id() : null, prior, objective.evaluations, fingerprint,
                LocalDateTime.now().toString());
    }

    private int[] channels(double[] counts) {
        List<Integer> idx = new ArrayList<>();
        for (int i = 0; i < counts.length; i += options.stride()) {
            if (counts[i] > options.noiseFloor()) idx.add(i);
        }
        return idx.stream().mapToInt(Integer::intValue).toArray();
    }

    private CalibrationResult failed(double[] width, String message, int evaluations, String fingerprint) {
        LOGGER.warn("Intensity calibration failed: {}", message);
        ResolutionModel prior = options.resolutionPrior();
        return new CalibrationResult(width[0], width[1], CalibrationResult.efficiencyMap(EfficiencyCurve.flat()),
                1.0, 0.0, 0.0, 0.0, Map.of(), Double.POSITIVE_INFINITY, 0.0, false, message,
                prior != null ? prior.kind().id() : null, prior, evaluations, fingerprint,
                LocalDateTime.now().toString());
    }

    private static double projection(double[] target, double[] basis) {
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < target.length; i++) {
            num += target[i] * basis[i];
            den += basis[i] * basis[i];
        }
        return den > 0 ? num / den : 0.0;
    }

    private static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }

    /**
     * Weighted objective over the unit box of the free parameters.
     */
    static final class Objective {
        final SyntheticSpectrum model;
        final List<String> elements;
        final double[] background;
        final double[] counts;
        final int[] channels;
        final double[] fixed;
        final double[] lower;
        final double[] upper;
        final int[] free;
        final CalibrationListener listener;

        int evaluations;
        double[] best;
        double bestValue = Double.POSITIVE_INFINITY;

        Objective(SyntheticSpectrum model, double[] background, double[] counts, int[] channels,
                  double[] start, double[] lower, double[] upper, CalibrationListener listener) {
            this.model = model;
            this.elements = model.elements();
            this.background = background;
            this.counts = counts;
            this.channels = channels;
            this.fixed = start.clone();
            this.lower = lower;
            this.upper = upper;
            this.listener = listener;
            List<Integer> f = new ArrayList<>();
            for (int i = 0; i < start.length; i++) {
                if (upper[i] > lower[i]) f.add(i);
            }
            this.free = f.stream().mapToInt(Integer::intValue).toArray();
        }

        double[] toUnit(double[] physical) {
            double[] u = new double[free.length];
            for (int j = 0; j < free.length; j++) {
                int i = free[j];
                u[j] = (physical[i] - lower[i]) / (upper[i] - lower[i]);
            }
            return u;
        }

        double[] fromUnit(double[] unit) {
            double[] p = fixed.clone();
            for (int j = 0; j < free.length; j++) {
                int i = free[j];
                double u = Math.min(Math.max(unit[j], 0.0), 1.0);
                p[i] = lower[i] + u * (upper[i] - lower[i]);
            }
            return p;
        }

        double value(double[] unit) {
            double[] p = fromUnit(unit);
            IntensityParameters params = IntensityParameters.fromArray(p, elements);
            double[] synth = model.gross(background, params);
            double sum = 0.0;
            for (int i : channels) {
                double r = counts[i] - synth[i];
                sum += r * r / Math.max(counts[i], 1.0);
            }
            double v = Double.isFinite(sum) ? sum : PENALTY;
            evaluations++;
            if (v < bestValue) {
                bestValue = v;
                best = p;
            }
            if (!listener.onEvaluation(evaluations, v, params)) {
                throw new CalibrationCancelledException();
            }
            return v;
        }
    }

    private static final class CalibrationCancelledException extends RuntimeException {
        CalibrationCancelledException() {
            super("calibration cancelled", null, false, false);
        }
    }
}
