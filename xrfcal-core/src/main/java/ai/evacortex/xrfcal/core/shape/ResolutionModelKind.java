/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Functional forms for detector resolution {@code FWHM(E)}, energies and widths in keV.
 *
 * <p>Each kind carries its parameter names, a regression start point and regression bounds
 * sized for silicon drift detectors.</p>
 */
public enum ResolutionModelKind {

    /** {@code sqrt(fwhm_0² + 2.355²·ε·E)}: electronic noise plus Fano statistics. */
    DETECTOR("detector", List.of("fwhm_0", "epsilon"),
            new double[]{0.1, 0.001}, new double[]{0.05, 0.0001}, new double[]{0.2, 0.01}) {
        @Override
        public double evaluate(double energy, double[] p) {
            return Math.sqrt(p[0] * p[0] + FWHM_SIGMA_SQUARED * p[1] * energy);
        }
    },

    LINEAR("linear", List.of("intercept", "slope"),
            new double[]{0.1, 0.005}, new double[]{0.05, 0.0}, new double[]{0.2, 0.02}) {
        @Override
        public double evaluate(double energy, double[] p) {
            return p[0] + p[1] * energy;
        }
    },

    QUADRATIC("quadratic", List.of("intercept", "linear_coef", "quadratic_coef"),
            new double[]{0.1, 0.005, 0.0001}, new double[]{0.05, -0.01, -0.001}, new double[]{0.2, 0.02, 0.001}) {
        @Override
        public double evaluate(double energy, double[] p) {
            return p[0] + p[1] * energy + p[2] * energy * energy;
        }
    },

    EXPONENTIAL("exponential", List.of("amplitude", "exponent"),
            new double[]{0.1, 0.02}, new double[]{0.05, 0.0}, new double[]{0.2, 0.1}) {
        @Override
        public double evaluate(double energy, double[] p) {
            return p[0] * Math.exp(p[1] * energy);
        }
    },

    POWER("power", List.of("amplitude", "power"),
            new double[]{0.1, 0.3}, new double[]{0.05, 0.0}, new double[]{0.2, 1.0}) {
        @Override
        public double evaluate(double energy, double[] p) {
            return p[0] * Math.pow(energy, p[1]);
        }
    };

    /** {@code 2.355²}, the FWHM-to-sigma factor squared. */
    public static final double FWHM_SIGMA_SQUARED = 2.355 * 2.355;

    private final String id;
    private final List<String> parameterNames;
    private final double[] initialGuess;
    private final double[] lowerBounds;
    private final double[] upperBounds;

    ResolutionModelKind(String id, List<String> parameterNames, double[] initialGuess,
                        double[] lowerBounds, double[] upperBounds) {
        this.id = id;
        this.parameterNames = parameterNames;
        this.initialGuess = initialGuess;
        this.lowerBounds = lowerBounds;
        this.upperBounds = upperBounds;
    }

    /**
     * Raw model value. May be zero or negative for extreme parameters; callers that need a
     * strictly positive width go through {@code ResolutionModel.predict}.
     */
    public abstract double evaluate(double energy, double[] parameters);

    @JsonValue
    public String id() {
        return id;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public int parameterCount() {
        return parameterNames.size();
    }

    public double[] initialGuess() {
        return initialGuess.clone();
    }

    public double[] lowerBounds() {
        return lowerBounds.clone();
    }

    public double[] upperBounds() {
        return upperBounds.clone();
    }

    @JsonCreator
    public static ResolutionModelKind fromId(String id) {
        if (id != null) {
            String key = id.toLowerCase(Locale.ROOT);
            for (ResolutionModelKind kind : values()) {
                if (kind.id.equals(key)) return kind;
            }
        }
        throw new ConfigurationException("unknown resolution model '" + id + "'");
    }
}
