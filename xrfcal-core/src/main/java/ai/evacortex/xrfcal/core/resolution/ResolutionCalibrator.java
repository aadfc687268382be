/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.resolution;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.EnergyRange;
import ai.evacortex.xrfcal.core.PeakMeasurement;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.engine.CurveFit;
import ai.evacortex.xrfcal.core.engine.CurveFitProblem;
import ai.evacortex.xrfcal.core.exceptions.FitDivergenceException;
import ai.evacortex.xrfcal.core.exceptions.InsufficientDataException;
import ai.evacortex.xrfcal.core.exceptions.InvalidSpectrumException;
import ai.evacortex.xrfcal.core.fit.Peak;
import ai.evacortex.xrfcal.core.fit.PeakFitFailure;
import ai.evacortex.xrfcal.core.fit.PeakFitOptions;
import ai.evacortex.xrfcal.core.fit.PeakFitOutcome;
import ai.evacortex.xrfcal.core.fit.PeakFitter;
import ai.evacortex.xrfcal.core.math.GoodnessOfFit;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a {@link ResolutionModel} from pure-element reference spectra.
 *
 * <p>Each expected line is fitted with a Gaussian in a fixed window around its tabulated energy,
 * on background-subtracted counts. A fit is accepted when its R² exceeds the configured minimum
 * and its FWHM lies strictly inside the plausibility band. With more than five accepted points the
 * set is screened for outliers against a robust detector-form curve before the final regression.</p>
 *
 * <p>Failures of individual lines or whole reference spectra are recorded and never abort the batch.</p>
 */
public final class ResolutionCalibrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionCalibrator.class);

    /** Lower AIC first, ties broken by lower BIC. */
    public static final Comparator<ResolutionModel> MODEL_RANKING =
            Comparator.comparingDouble(ResolutionModel::aic).thenComparingDouble(ResolutionModel::bic);

    private static final int OUTLIER_SCREEN_MIN_POINTS = 6;
    private static final double TUKEY_C = 4.685;
    private static final int ROBUST_ITERATIONS = 20;

    private final BackgroundEstimator backgrounds;
    private final ResolutionCalibrationOptions options;

    public ResolutionCalibrator() {
        this(new BackgroundEstimator(), ResolutionCalibrationOptions.defaultOptions());
    }

    public ResolutionCalibrator(ResolutionCalibrationOptions options) {
        this(new BackgroundEstimator(), options);
    }

    public ResolutionCalibrator(BackgroundEstimator backgrounds, ResolutionCalibrationOptions options) {
        this.backgrounds = Objects.requireNonNull(backgrounds, "backgrounds must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        backgrounds.method(options.backgroundMethod());
    }

    public ResolutionCalibrationOptions options() {
        return options;
    }

    /**
     * Full pipeline: measure, screen, regress with the configured model kind.
     */
    public ResolutionCalibrationResult calibrate(List<ReferenceSpectrum> references) {
        List<RejectedLine> rejected = new ArrayList<>();
        List<PeakMeasurement> accepted = measure(references, rejected);
        LOGGER.info("Resolution calibration: {} peaks accepted, {} rejected", accepted.size(), rejected.size());

        if (accepted.size() < options.minPeaks()) {
            String msg = String.format("insufficient peaks: %d accepted, at least %d required",
                    accepted.size(), options.minPeaks());
            LOGGER.warn(msg);
            return ResolutionCalibrationResult.failed(msg, accepted, List.of(), rejected);
        }

        List<PeakMeasurement> kept = accepted;
        List<PeakMeasurement> outliers = List.of();
        if (options.removeOutliers() && accepted.size() >= OUTLIER_SCREEN_MIN_POINTS) {
            OutlierRejection screen = removeOutliers(accepted);
            kept = screen.kept();
            outliers = screen.outliers();
            if (kept.size() < options.minPeaks()) {
                String msg = String.format("insufficient peaks after outlier removal: %d kept", kept.size());
                LOGGER.warn(msg);
                return ResolutionCalibrationResult.failed(msg, kept, outliers, rejected);
            }
        }

        try {
            ResolutionModel model = fitModel(options.modelKind(), kept);
            LOGGER.info("Calibrated {}", model);
            return new ResolutionCalibrationResult(true,
                    String.format("calibrated from %d peaks", kept.size()), model, kept, outliers, rejected);
        } catch (FitDivergenceException | InsufficientDataException e) {
            LOGGER.warn("Resolution regression failed: {}", e.getMessage());
            return ResolutionCalibrationResult.failed(e.getMessage(), kept, outliers, rejected);
        }
    }

    /**
     * Measures every expected line of every reference.
     *
     * @param rejectedSink receives one entry per line that was not accepted
     * @return accepted measurements in input order
     */
    public List<PeakMeasurement> measure(List<ReferenceSpectrum> references, List<RejectedLine> rejectedSink) {
        List<PeakMeasurement> accepted = new ArrayList<>();
        for (ReferenceSpectrum ref : references) {
            Spectrum net;
            try {
                net = backgrounds.netSpectrum(ref.spectrum(), options.backgroundMethod(), options.backgroundOptions());
            } catch (InsufficientDataException | InvalidSpectrumException e) {
                LOGGER.warn("Skipping reference '{}': {}", ref.name(), e.getMessage());
                rejectedSink.add(new RejectedLine(ref.name(), null, PeakFitFailure.INSUFFICIENT_POINTS, e.getMessage()));
                continue;
            }
            for (ElementLine line : ref.lines()) {
                measureLine(ref.name(), net, line, accepted, rejectedSink);
            }
        }
        return accepted;
    }

    private void measureLine(String reference, Spectrum net, ElementLine line,
                             List<PeakMeasurement> accepted, List<RejectedLine> rejected) {
        double e = line.energyKeV();
        if (e <= net.minEnergy() || e >= net.maxEnergy()) {
            rejected.add(new RejectedLine(reference, line, PeakFitFailure.INSUFFICIENT_POINTS,
                    String.format("%.3f keV outside spectrum range", e)));
            return;
        }
        PeakFitter fitter = new PeakFitter(lineOptions(e));
        PeakFitOutcome outcome = fitter.fit(net, e);
        if (!outcome.isSuccess()) {
            LOGGER.debug("{} {}: {}", reference, line.label(), outcome.message());
            rejected.add(new RejectedLine(reference, line, outcome.failure(), outcome.message()));
            return;
        }
        Peak peak = outcome.peak();
        if (!(peak.rSquared() > options.minRSquared())) {
            rejected.add(new RejectedLine(reference, line, PeakFitFailure.REJECTED,
                    String.format("Poor fit (R2=%.3f)", peak.rSquared())));
        } else if (!(peak.fwhm() > options.minFwhm() && peak.fwhm() < options.maxFwhm())) {
            rejected.add(new RejectedLine(reference, line, PeakFitFailure.REJECTED,
                    String.format("Unrealistic FWHM (%.1f eV)", peak.fwhm() * 1000)));
        } else {
            LOGGER.debug("{} {}: FWHM {} eV, R2 {}", reference, line.label(), peak.fwhm() * 1000, peak.rSquared());
            accepted.add(PeakMeasurement.of(line.element(), line.line(), peak));
        }
    }

    PeakFitOptions lineOptions(double energy) {
        return PeakFitOptions.defaultOptions()
                .withBackend(options.backend().name())
                .withFixedWindow(options.windowHalfWidth(), options.minWindowPoints())
                .withCenterTolerance(options.centerTolerance())
                .withFwhm(options.initialFwhm(), options.minFwhm(), options.maxFwhm())
                .startingAtLocalMaximum(true)
                .withMinHeight(options.minCountsAt(energy));
    }

    /**
     * Screens measurements against a robust detector-form curve.
     *
     * <p>The reference curve is fitted by Tukey-biweight reweighting, started from whichever of the
     * full fit and the leave-one-out fits has the smallest median absolute residual. Points whose
     * residual departs from the median residual by more than {@code outlierThreshold} robust
     * standard deviations are removed. The scale is floored at {@code residualScaleFloor}.</p>
     */
    public OutlierRejection removeOutliers(List<PeakMeasurement> measurements) {
        int n = measurements.size();
        double[] e = energies(measurements);
        double[] f = widths(measurements);
        ResolutionModelKind kind = ResolutionModelKind.DETECTOR;
        if (n <= kind.parameterCount()) {
            return new OutlierRejection(measurements, List.of(), new double[n], Double.NaN);
        }

        double[] p = robustStart(kind, e, f);
        for (int iter = 0; iter < ROBUST_ITERATIONS; iter++) {
            double[] r = residuals(kind, p, e, f);
            double s = Math.max(GoodnessOfFit.robustSigma(r), options.residualScaleFloor());
            double[] w = new double[n];
            int active = 0;
            for (int i = 0; i < n; i++) {
                double u = r[i] / (TUKEY_C * s);
                w[i] = Math.abs(u) < 1 ? 1 - u * u : 0.0;   // sqrt of the biweight
                if (w[i] > 0) active++;
            }
            if (active <= kind.parameterCount()) break;
            double[] next;
            try {
                next = options.backend().fit(problem(kind, e, f, p).withWeights(w)).parameters();
            } catch (FitDivergenceException ex) {
                break;
            }
            boolean converged = true;
            for (int j = 0; j < p.length; j++) {
                if (Math.abs(next[j] - p[j]) > 1e-9 * Math.max(1.0, Math.abs(p[j]))) converged = false;
            }
            p = next;
            if (converged) break;
        }

        double[] r = residuals(kind, p, e, f);
        double med = GoodnessOfFit.median(r);
        double sigma = Math.max(GoodnessOfFit.robustSigma(r), options.residualScaleFloor());
        List<PeakMeasurement> kept = new ArrayList<>();
        List<PeakMeasurement> removed = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (Math.abs(r[i] - med) > options.outlierThreshold() * sigma) {
                removed.add(measurements.get(i));
                LOGGER.info("Outlier {} at {} keV: residual {} eV", measurements.get(i).label(),
                        e[i], r[i] * 1000);
            } else {
                kept.add(measurements.get(i));
            }
        }
        return new OutlierRejection(kept, removed, r, sigma);
    }

    private double[] robustStart(ResolutionModelKind kind, double[] e, double[] f) {
        double[] best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (int skip = -1; skip < e.length; skip++) {
            double[] x = skip < 0 ? e : without(e, skip);
            double[] y = skip < 0 ? f : without(f, skip);
            double[] p;
            try {
                p = options.backend().fit(problem(kind, x, y, kind.initialGuess())).parameters();
            } catch (FitDivergenceException ex) {
                continue;
            }
            double[] r = residuals(kind, p, e, f);
            for (int i = 0; i < r.length; i++) r[i] = Math.abs(r[i]);
            double score = GoodnessOfFit.median(r);
            if (score < bestScore) {
                bestScore = score;
                best = p;
            }
        }
        return best != null ? best : kind.initialGuess();
    }

    /**
     * Regresses the resolution curve of the given kind through the measurements.
     *
     * @throws InsufficientDataException with fewer than three measurements or fewer than the
     *         kind's parameter count
     * @throws FitDivergenceException    if the regression fails
     */
    public ResolutionModel fitModel(ResolutionModelKind kind, List<PeakMeasurement> measurements) {
        return fitModel(kind, energies(measurements), widths(measurements));
    }

    public ResolutionModel fitModel(ResolutionModelKind kind, double[] energies, double[] fwhms) {
        Objects.requireNonNull(kind, "kind must not be null");
        int n = energies.length;
        if (n != fwhms.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + n + " vs " + fwhms.length);
        }
        if (n < 3 || n < kind.parameterCount()) {
            throw new InsufficientDataException("need at least " + Math.max(3, kind.parameterCount())
                    + " peaks for a " + kind.id() + " model, got " + n);
        }
        CurveFit fit = options.backend().fit(problem(kind, energies, fwhms, kind.initialGuess()));
        double[] predicted = fit.fitted();
        double ss = GoodnessOfFit.sumSquaredResiduals(fwhms, predicted);
        int k = kind.parameterCount();

        Map<String, Double> params = new LinkedHashMap<>();
        Map<String, Double> errors = new LinkedHashMap<>();
        List<String> names = kind.parameterNames();
        for (int i = 0; i < k; i++) {
            params.put(names.get(i), fit.parameters()[i]);
            errors.put(names.get(i), fit.errors()[i]);
        }
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : energies) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        return new ResolutionModel(kind, params, errors,
                GoodnessOfFit.rSquared(fwhms, predicted),
                GoodnessOfFit.rmse(fwhms, predicted),
                GoodnessOfFit.aic(ss, n, k),
                GoodnessOfFit.bic(ss, n, k),
                n, new EnergyRange(lo, hi), LocalDateTime.now().toString());
    }

    /**
     * Fits every model kind to the same measurements and ranks them by {@link #MODEL_RANKING}.
     * Kinds that cannot be fitted are left out of the ranking.
     *
     * @throws InsufficientDataException if no kind could be fitted
     */
    public List<ResolutionModel> compareModels(List<PeakMeasurement> measurements) {
        List<ResolutionModel> models = new ArrayList<>();
        for (ResolutionModelKind kind : ResolutionModelKind.values()) {
            try {
                models.add(fitModel(kind, measurements));
            } catch (FitDivergenceException | InsufficientDataException e) {
                LOGGER.warn("Model '{}' skipped: {}", kind.id(), e.getMessage());
            }
        }
        if (models.isEmpty()) {
            throw new InsufficientDataException("no resolution model could be fitted to "
                    + measurements.size() + " peaks");
        }
        models.sort(MODEL_RANKING);
        return models;
    }

    private static CurveFitProblem problem(ResolutionModelKind kind, double[] e, double[] f, double[] start) {
        return CurveFitProblem.of(e, f, kind::evaluate, start, kind.lowerBounds(), kind.upperBounds());
    }

    private static double[] residuals(ResolutionModelKind kind, double[] p, double[] e, double[] f) {
        double[] r = new double[e.length];
        for (int i = 0; i < e.length; i++) {
            r[i] = f[i] - kind.evaluate(e[i], p);
        }
        return r;
    }

    private static double[] without(double[] a, int index) {
        double[] out = new double[a.length - 1];
        System.arraycopy(a, 0, out, 0, index);
        System.arraycopy(a, index + 1, out, index, a.length - index - 1);
        return out;
    }

    private static double[] energies(List<PeakMeasurement> ms) {
        return ms.stream().mapToDouble(PeakMeasurement::energy).toArray();
    }

    private static double[] widths(List<PeakMeasurement> ms) {
        return ms.stream().mapToDouble(PeakMeasurement::fwhm).toArray();
    }
}
