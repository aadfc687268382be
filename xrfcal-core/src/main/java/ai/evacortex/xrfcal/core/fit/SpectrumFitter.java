/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.background.BackgroundEstimator;
import ai.evacortex.xrfcal.core.shape.PeakShape;
import ai.evacortex.xrfcal.core.shape.PeakShapeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decomposes a whole spectrum: background, peaks at known sample and tube lines, optional
 * automatically detected extra peaks, reconstruction and statistics.
 *
 * <p>Known lines closer than the resolution can separate are fitted once, at their
 * intensity-weighted centroid, and every peak enters the reconstruction with the shape it was
 * fitted with.</p>
 */
public final class SpectrumFitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpectrumFitter.class);

    private final BackgroundEstimator backgrounds;
    private final SpectrumFitOptions options;

    public SpectrumFitter(BackgroundEstimator backgrounds, SpectrumFitOptions options) {
        this.backgrounds = Objects.requireNonNull(backgrounds, "background estimator must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public SpectrumFitter(SpectrumFitOptions options) {
        this(new BackgroundEstimator(), options);
    }

    /**
     * @param spectrum    measured spectrum
     * @param sampleLines expected lines of the sample elements
     * @param tubeLines   anode lines reaching the detector by scatter; flagged in the result
     */
    public SpectrumFitResult fit(Spectrum spectrum, List<ElementLine> sampleLines, List<ElementLine> tubeLines) {
        double[] energy = spectrum.energy();
        double[] counts = spectrum.counts();
        double[] background = backgrounds.estimate(energy, counts, options.backgroundMethod(), options.backgroundOptions());
        double[] net = BackgroundEstimator.subtract(counts, background);

        List<Candidate> known = new ArrayList<>();
        for (ElementLine line : sampleLines) {
            if (inRange(spectrum, line.energyKeV())) known.add(new Candidate(line.energyKeV(), line, false, List.of()));
        }
        for (ElementLine line : tubeLines) {
            if (inRange(spectrum, line.energyKeV())) known.add(new Candidate(line.energyKeV(), line, true, List.of()));
        }
        List<Candidate> candidates = mergeMultiplets(known);

        if (options.autoFindPeaks()) {
            PeakFinder finder = new PeakFinder(options.prominence(), options.distance(), null);
            for (PeakFinder.DetectedPeak detected : finder.find(energy, net)) {
                boolean nearKnown = false;
                for (Candidate c : candidates) {
                    if (c.line() != null && Math.abs(detected.energy() - c.energy()) < options.knownLineTolerance()) {
                        nearKnown = true;
                        break;
                    }
                }
                if (!nearKnown) candidates.add(new Candidate(detected.energy(), null, false, List.of()));
            }
        }

        PeakShape defaultShape = options.peakOptions().shape();
        Map<String, PeakShape> shapes = new LinkedHashMap<>();
        Map<String, PeakFitter> fitters = new LinkedHashMap<>();
        shapes.put(defaultShape.id(), defaultShape);
        fitters.put(defaultShape.id(), new PeakFitter(options.peakOptions()));
        List<IdentifiedPeak> peaks = new ArrayList<>();
        List<PeakFitOutcome> failures = new ArrayList<>();
        for (Candidate c : candidates) {
            PeakShape shape = shapeFor(c, defaultShape);
            shapes.putIfAbsent(shape.id(), shape);
            PeakFitter fitter = fitters.computeIfAbsent(shape.id(),
                    id -> new PeakFitter(options.peakOptions().withShape(shape)));
            PeakFitOutcome outcome = fitter.fit(energy, net, c.energy());
            if (outcome.isSuccess()) {
                peaks.add(new IdentifiedPeak(outcome.peak(), c.line(), c.tube(), c.blended()));
            } else {
                failures.add(outcome);
            }
        }
        LOGGER.info("Fitted {} of {} peaks ({} failed)", peaks.size(), candidates.size(), failures.size());

        double[] fitted = background.clone();
        int parameters = 1;
        for (IdentifiedPeak ip : peaks) {
            PeakShape shape = shapes.computeIfAbsent(ip.peak().shape(), PeakShapeRegistry::shape);
            double[] p = ip.peak().parameterVector(shape);
            for (int i = 0; i < energy.length; i++) {
                fitted[i] += shape.value(energy[i], p);
            }
            parameters += shape.parameterCount();
        }
        double[] residuals = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            residuals[i] = counts[i] - fitted[i];
        }
        FitStatistics stats = FitStatistics.of(counts, fitted, parameters);
        return new SpectrumFitResult(background, fitted, residuals, peaks, failures, stats);
    }

    private PeakShape shapeFor(Candidate c, PeakShape defaultShape) {
        PeakShapeSelector selector = options.shapeSelector();
        if (selector == null || c.line() == null) {
            return defaultShape;
        }
        PeakShape selected = selector.select(c.line());
        return selected != null ? selected : defaultShape;
    }

    /**
     * Groups known lines of the same kind lying within {@code multipletFwhms} predicted FWHMs of a
     * group centroid. A group is fitted at its intensity-weighted centroid under its strongest line.
     */
    private List<Candidate> mergeMultiplets(List<Candidate> known) {
        double reach = options.multipletFwhms();
        if (!(reach > 0) || known.size() < 2) {
            return known;
        }
        ResolutionModel resolution = options.peakOptions().resolution();
        List<List<Candidate>> groups = new ArrayList<>();
        for (Candidate c : known) {
            List<Candidate> target = null;
            for (List<Candidate> group : groups) {
                if (group.get(0).tube() != c.tube()) continue;
                double center = centroid(group);
                if (Math.abs(c.energy() - center) < reach * resolution.predict(center)) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                groups.add(target);
            }
            target.add(c);
        }

        List<Candidate> merged = new ArrayList<>(groups.size());
        for (List<Candidate> group : groups) {
            if (group.size() == 1) {
                merged.add(group.get(0));
                continue;
            }
            Candidate strongest = group.get(0);
            for (Candidate c : group) {
                if (weight(c) > weight(strongest)) strongest = c;
            }
            List<ElementLine> blended = new ArrayList<>();
            for (Candidate c : group) {
                if (c != strongest) blended.add(c.line());
            }
            LOGGER.debug("Fitting {} together with {}", strongest.line().label(), blended);
            merged.add(new Candidate(centroid(group), strongest.line(), strongest.tube(), blended));
        }
        return merged;
    }

    private static double centroid(List<Candidate> group) {
        double sum = 0.0;
        double total = 0.0;
        double plain = 0.0;
        for (Candidate c : group) {
            sum += weight(c) * c.energy();
            total += weight(c);
            plain += c.energy();
        }
        return total > 0 ? sum / total : plain / group.size();
    }

    private static double weight(Candidate c) {
        double w = c.line().relativeIntensity();
        return Double.isFinite(w) && w > 0 ? w : 0.0;
    }

    private static boolean inRange(Spectrum spectrum, double e) {
        return e >= spectrum.minEnergy() && e <= spectrum.maxEnergy();
    }

    private record Candidate(double energy, ElementLine line, boolean tube, List<ElementLine> blended) {
    }
}
