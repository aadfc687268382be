/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an intensity calibration. Failed calibrations carry the starting parameters and an
 * infinite χ².
 *
 * @param tailAmplitude relative height of the fitted low-energy tail; 0 unless the shape was refined
 * @param tailSlope decay of the fitted low-energy tail, keV⁻¹; 0 unless the shape was refined
 * @param elementScales per-element intensity factors; empty unless the shape was refined
 * @param fwhmCalibration resolution model the widths were bounded around, if any
 * @param sourceFingerprint XXH64 of the measured spectrum, see
 *        {@link ai.evacortex.xrfcal.core.storage.SpectrumFingerprint}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"fwhm_0", "epsilon", "efficiency_params", "intensity_scale", "scatter_scale", "tail_amplitude",
        "tail_slope", "element_scales", "chi_squared",
        "r_squared", "success", "message", "fwhm_model_type", "fwhm_calibration", "evaluations",
        "source_fingerprint", "calibration_date"})
public record CalibrationResult(
        @JsonProperty("fwhm_0") double fwhm0,
        @JsonProperty("epsilon") double epsilon,
        @JsonProperty("efficiency_params") Map<String, Double> efficiencyParams,
        @JsonProperty("intensity_scale") double intensityScale,
        @JsonProperty("scatter_scale") double scatterScale,
        @JsonProperty("tail_amplitude") double tailAmplitude,
        @JsonProperty("tail_slope") double tailSlope,
        @JsonProperty("element_scales") Map<String, Double> elementScales,
        @JsonProperty("chi_squared") double chiSquared,
        @JsonProperty("r_squared") double rSquared,
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("fwhm_model_type") String fwhmModelType,
        @JsonProperty("fwhm_calibration") ResolutionModel fwhmCalibration,
        @JsonProperty("evaluations") int evaluations,
        @JsonProperty("source_fingerprint") String sourceFingerprint,
        @JsonProperty("calibration_date") String calibrationDate
) {

    public CalibrationResult {
        efficiencyParams = efficiencyParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(efficiencyParams));
        elementScales = elementScales == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(elementScales));
        fwhmModelType = fwhmModelType == null ? ResolutionModelKind.DETECTOR.id() : fwhmModelType;
    }

    static Map<String, Double> efficiencyMap(EfficiencyCurve curve) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("a", curve.a());
        m.put("b", curve.b());
        m.put("c", curve.c());
        return m;
    }

    @JsonIgnore
    public EfficiencyCurve efficiency() {
        return new EfficiencyCurve(efficiencyParams.getOrDefault("a", 1.0),
                efficiencyParams.getOrDefault("b", 0.0),
                efficiencyParams.getOrDefault("c", 0.0));
    }

    /** Calibrated widths as an uncalibrated-statistics detector model. */
    @JsonIgnore
    public ResolutionModel resolutionModel() {
        return ResolutionModel.of(ResolutionModelKind.DETECTOR, fwhm0, epsilon);
    }
}
