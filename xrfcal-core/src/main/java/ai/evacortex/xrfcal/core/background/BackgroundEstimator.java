/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registry-backed entry point for continuum estimation and subtraction.
 *
 * <p>The estimated curve is always clamped to {@code [0, counts[i]]}, so
 * {@link #subtract(double[], double[])} of the result is non-negative and never exceeds the
 * input counts.</p>
 */
public final class BackgroundEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundEstimator.class);

    public static final String DEFAULT_METHOD = "snip";

    private final Map<String, BackgroundMethod> methods;

    public BackgroundEstimator() {
        this(List.of(
                new SnipBackground(),
                new AslsBackground(),
                new PolynomialBackground(),
                new LinearBackground(),
                new AdaptiveBackground(),
                new NoBackground()));
    }

    public BackgroundEstimator(Collection<? extends BackgroundMethod> implementations) {
        Map<String, BackgroundMethod> map = new LinkedHashMap<>();
        for (BackgroundMethod m : implementations) {
            register(map, m.name(), m);
            for (String alias : m.aliases()) {
                register(map, alias, m);
            }
        }
        this.methods = Map.copyOf(map);
    }

    private static void register(Map<String, BackgroundMethod> map, String name, BackgroundMethod method) {
        String key = name.toLowerCase(Locale.ROOT);
        if (map.putIfAbsent(key, method) != null) {
            throw new ConfigurationException("duplicate background method name: " + key);
        }
    }

    public BackgroundMethod method(String name) {
        Objects.requireNonNull(name, "method name must not be null");
        BackgroundMethod method = methods.get(name.toLowerCase(Locale.ROOT));
        if (method == null) {
            throw new ConfigurationException("unknown background method '" + name + "', expected one of " + methods.keySet());
        }
        return method;
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }

    public double[] estimate(double[] energy, double[] counts, String methodName, BackgroundOptions options) {
        Objects.requireNonNull(energy, "energy must not be null");
        Objects.requireNonNull(counts, "counts must not be null");
        if (energy.length != counts.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + energy.length + " vs " + counts.length);
        }
        BackgroundMethod method = method(methodName);
        BackgroundOptions opts = options == null ? BackgroundOptions.defaultOptions() : options;

        double[] raw = method.estimate(energy, counts, opts);
        double[] clamped = new double[counts.length];
        int replaced = 0;
        for (int i = 0; i < counts.length; i++) {
            double b = raw[i];
            if (!Double.isFinite(b)) {
                b = 0.0;
                replaced++;
            }
            clamped[i] = Math.max(0.0, Math.min(b, counts[i]));
        }
        if (replaced > 0) {
            LOGGER.warn("Background method '{}' produced {} non-finite values, replaced by zero", method.name(), replaced);
        }
        return clamped;
    }

    public double[] estimate(Spectrum spectrum, String methodName, BackgroundOptions options) {
        return estimate(spectrum.energy(), spectrum.counts(), methodName, options);
    }

    /** Background-subtracted copy of {@code spectrum}. */
    public Spectrum netSpectrum(Spectrum spectrum, String methodName, BackgroundOptions options) {
        double[] counts = spectrum.counts();
        return spectrum.withCounts(subtract(counts, estimate(spectrum.energy(), counts, methodName, options)));
    }

    public static double[] subtract(double[] counts, double[] background) {
        if (counts.length != background.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + counts.length + " vs " + background.length);
        }
        double[] net = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            net[i] = Math.max(0.0, counts[i] - background[i]);
        }
        return net;
    }
}
