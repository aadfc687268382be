/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A calibrated detector resolution curve {@code FWHM(E)} together with its fit statistics.
 *
 * <p>{@link #predict(double)} is defined for every {@code E ≥ 0} and never returns less than
 * {@link #MIN_FWHM}. Instances are immutable and travel explicitly through option records;
 * there is no process-wide active model.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"model_type", "parameters", "parameter_errors", "r_squared", "rmse", "aic", "bic",
        "n_peaks", "energy_range", "calibration_date"})
public record ResolutionModel(
        @JsonProperty("model_type") ResolutionModelKind kind,
        @JsonProperty("parameters") Map<String, Double> parameters,
        @JsonProperty("parameter_errors") Map<String, Double> parameterErrors,
        @JsonProperty("r_squared") double rSquared,
        @JsonProperty("rmse") double rmse,
        @JsonProperty("aic") double aic,
        @JsonProperty("bic") double bic,
        @JsonProperty("n_peaks") int nPeaks,
        @JsonProperty("energy_range") EnergyRange energyRange,
        @JsonProperty("calibration_date") String calibrationDate
) {

    /** Smallest width ever predicted, in keV. */
    public static final double MIN_FWHM = 1e-6;

    public ResolutionModel {
        Objects.requireNonNull(kind, "model_type must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        for (String name : kind.parameterNames()) {
            Double v = parameters.get(name);
            if (v == null || !Double.isFinite(v)) {
                throw new ConfigurationException("model '" + kind.id() + "' requires finite parameter '" + name + "'");
            }
        }
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        parameterErrors = parameterErrors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameterErrors));
        energyRange = energyRange == null ? EnergyRange.DEFAULT : energyRange;
    }

    /**
     * An uncalibrated model with the given parameters, e.g. entered by hand.
     */
    public static ResolutionModel of(ResolutionModelKind kind, double... values) {
        if (values.length != kind.parameterCount()) {
            throw new ConfigurationException("model '" + kind.id() + "' takes " + kind.parameterCount()
                    + " parameters, got " + values.length);
        }
        Map<String, Double> params = new LinkedHashMap<>();
        List<String> names = kind.parameterNames();
        for (int i = 0; i < values.length; i++) {
            params.put(names.get(i), values[i]);
        }
        return new ResolutionModel(kind, params, Map.of(), 0.0, 0.0, 0.0, 0.0, 0,
                EnergyRange.DEFAULT, LocalDateTime.now().toString());
    }

    /**
     * Built-in detector model for a typical silicon drift detector: 60 eV noise term,
     * ε = 0.5 eV/keV, giving about 146 eV at Mn Kα.
     */
    public static ResolutionModel defaultModel() {
        return of(ResolutionModelKind.DETECTOR, 0.060, 0.0005);
    }

    /**
     * @param energy photon energy in keV
     * @return FWHM in keV, at least {@link #MIN_FWHM}
     */
    public double predict(double energy) {
        double fwhm = kind.evaluate(Math.max(energy, 0.0), parameterVector());
        return Double.isFinite(fwhm) && fwhm > MIN_FWHM ? fwhm : MIN_FWHM;
    }

    public double[] predict(double[] energies) {
        double[] p = parameterVector();
        double[] out = new double[energies.length];
        for (int i = 0; i < energies.length; i++) {
            double fwhm = kind.evaluate(Math.max(energies[i], 0.0), p);
            out[i] = Double.isFinite(fwhm) && fwhm > MIN_FWHM ? fwhm : MIN_FWHM;
        }
        return out;
    }

    @JsonIgnore
    public double[] parameterVector() {
        List<String> names = kind.parameterNames();
        double[] p = new double[names.size()];
        for (int i = 0; i < p.length; i++) {
            p[i] = parameters.get(names.get(i));
        }
        return p;
    }

    public double parameter(String name) {
        Double v = parameters.get(name);
        if (v == null) {
            throw new ConfigurationException("model '" + kind.id() + "' has no parameter '" + name + "'");
        }
        return v;
    }

    /**
     * Projects this model onto the detector form.
     *
     * <p>For a detector model the parameters are returned as is. Other kinds are sampled over the
     * validity range and {@code FWHM²} is regressed linearly on {@code E}.</p>
     *
     * @return {@code {fwhm_0, epsilon}} with {@code fwhm_0 ≥ 1 eV} and {@code epsilon ≥ 0}
     */
    public double[] detectorEquivalent() {
        if (kind == ResolutionModelKind.DETECTOR) {
            return new double[]{parameter("fwhm_0"), parameter("epsilon")};
        }
        int samples = 50;
        double lo = Math.max(energyRange.min(), 0.5);
        double hi = Math.max(energyRange.max(), lo + 1.0);
        double sx = 0, sy = 0, sxx = 0, sxy = 0;
        for (int i = 0; i < samples; i++) {
            double e = lo + (hi - lo) * i / (samples - 1);
            double f = predict(e);
            double y = f * f;
            sx += e;
            sy += y;
            sxx += e * e;
            sxy += e * y;
        }
        double slope = (samples * sxy - sx * sy) / (samples * sxx - sx * sx);
        double intercept = (sy - slope * sx) / samples;
        double fwhm0 = Math.sqrt(Math.max(intercept, 1e-6));
        double epsilon = Math.max(slope, 0.0) / ResolutionModelKind.FWHM_SIGMA_SQUARED;
        return new double[]{fwhm0, epsilon};
    }

    @Override
    public String toString() {
        if (kind == ResolutionModelKind.DETECTOR) {
            return String.format("ResolutionModel[detector, FWHM0=%.1f eV, eps=%.3f eV/keV, R2=%.4f, n=%d]",
                    parameter("fwhm_0") * 1000, parameter("epsilon") * 1000, rSquared, nPeaks);
        }
        return String.format("ResolutionModel[%s, %s, R2=%.4f, n=%d]", kind.id(), parameters, rSquared, nPeaks);
    }
}
