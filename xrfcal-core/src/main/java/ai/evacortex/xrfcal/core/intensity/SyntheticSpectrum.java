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
import ai.evacortex.xrfcal.core.shape.PeakShape;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Forward model of a measured spectrum: background plus broadened characteristic lines plus
 * Rayleigh and Compton scatter of the tube lines.
 *
 * <p>Lines are Gaussian. A non-zero {@link IntensityParameters#tailAmplitude()} adds the
 * hypermet low-energy tail {@code h·A·exp(s·(E − E₀))} below each characteristic line.</p>
 */
public final class SyntheticSpectrum {

    /** Electron rest energy, keV. */
    public static final double ELECTRON_REST_KEV = 511.0;

    private static final double CUTOFF_SIGMAS = 6.0;
    private static final double TAIL_CUTOFF = 28.0;

    private final double[] energy;
    private final double[] lineEnergy;
    private final double[] lineHeight;
    private final String[] lineElement;
    private final List<String> elements;
    private final double[] scatterEnergy;

    public SyntheticSpectrum(double[] energy, List<ElementLine> lines, List<Double> tubeLines, Geometry geometry) {
        this.energy = energy.clone();
        this.lineEnergy = new double[lines.size()];
        this.lineHeight = new double[lines.size()];
        this.lineElement = new String[lines.size()];
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            lineEnergy[i] = lines.get(i).energyKeV();
            lineHeight[i] = lines.get(i).relativeIntensity();
            lineElement[i] = lines.get(i).element();
            distinct.add(lineElement[i]);
        }
        this.elements = List.copyOf(new ArrayList<>(distinct));
        this.scatterEnergy = new double[tubeLines.size() * 2];
        double angle = Math.toRadians(geometry.scatteringAngle());
        for (int i = 0; i < tubeLines.size(); i++) {
            double e = tubeLines.get(i);
            scatterEnergy[2 * i] = e;
            scatterEnergy[2 * i + 1] = comptonEnergy(e, angle);
        }
    }

    /**
     * Energy of a photon after Compton scattering through {@code angle} radians.
     */
    public static double comptonEnergy(double energy, double angle) {
        return energy / (1.0 + energy / ELECTRON_REST_KEV * (1.0 - Math.cos(angle)));
    }

    /** Distinct elements of the lines in first-seen order. */
    public List<String> elements() {
        return elements;
    }

    public boolean hasScatter() {
        return scatterEnergy.length > 0;
    }

    /**
     * Net (background-free) synthesized counts.
     */
    public double[] net(IntensityParameters p) {
        double[] out = new double[energy.length];
        double[] width = {p.fwhm0(), p.epsilon()};
        for (int l = 0; l < lineEnergy.length; l++) {
            double h = p.scale() * p.elementScale(lineElement[l]) * lineHeight[l] * p.efficiency().at(lineEnergy[l]);
            addGaussian(out, lineEnergy[l], h, ResolutionModelKind.DETECTOR.evaluate(lineEnergy[l], width));
            if (p.tailAmplitude() > 0 && p.tailSlope() > 0) {
                addTail(out, lineEnergy[l], h * p.tailAmplitude(), p.tailSlope());
            }
        }
        for (double e : scatterEnergy) {
            addGaussian(out, e, p.scatter(), ResolutionModelKind.DETECTOR.evaluate(e, width));
        }
        return out;
    }

    public double[] gross(double[] background, IntensityParameters p) {
        double[] out = net(p);
        for (int i = 0; i < out.length; i++) {
            out[i] += background[i];
        }
        return out;
    }

    private void addGaussian(double[] out, double center, double height, double fwhm) {
        if (height == 0) return;
        double sigma = fwhm / PeakShape.FWHM_PER_SIGMA;
        double reach = CUTOFF_SIGMAS * sigma;
        for (int i = 0; i < energy.length; i++) {
            double d = energy[i] - center;
            if (d < -reach) continue;
            if (d > reach) break;
            out[i] += height * Math.exp(-0.5 * d * d / (sigma * sigma));
        }
    }

    private void addTail(double[] out, double center, double height, double slope) {
        if (height == 0) return;
        double reach = TAIL_CUTOFF / slope;
        for (int i = 0; i < energy.length; i++) {
            double d = energy[i] - center;
            if (d < -reach) continue;
            if (d >= 0) break;
            out[i] += height * Math.exp(slope * d);
        }
    }
}
