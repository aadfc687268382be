/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.storage;

import ai.evacortex.xrfcal.core.EnergyRange;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.exceptions.CalibrationStoreException;
import ai.evacortex.xrfcal.core.intensity.CalibrationResult;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes calibrations as pretty-printed JSON documents.
 *
 * <p>Resolution models are also accepted in the older flat detector format
 * ({@code fwhm_0_keV} or {@code fwhm_0_eV} with {@code epsilon_*} siblings), which is converted to
 * a detector {@link ResolutionModel} on load.</p>
 */
public final class CalibrationStore {

    private final ObjectMapper mapper;

    public CalibrationStore() {
        this(new ObjectMapper());
    }

    public CalibrationStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void saveModel(ResolutionModel model, Path path) {
        write(model, path, "resolution model");
    }

    public ResolutionModel loadModel(Path path) {
        return modelFromTree(readTree(path, "resolution model"));
    }

    public void saveResult(CalibrationResult result, Path path) {
        write(result, path, "calibration result");
    }

    public CalibrationResult loadResult(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, CalibrationResult.class);
        } catch (IOException e) {
            throw new CalibrationStoreException("Failed to load calibration result from " + path, e);
        }
    }

    public String toJson(Object calibration) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(calibration);
        } catch (JsonProcessingException e) {
            throw new CalibrationStoreException("Failed to serialize " + calibration.getClass().getSimpleName(), e);
        }
    }

    public ResolutionModel modelFromJson(String json) {
        try {
            return modelFromTree(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new CalibrationStoreException("Failed to parse resolution model", e);
        }
    }

    private ResolutionModel modelFromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CalibrationStoreException("Unknown calibration file format: not a JSON object");
        }
        if (node.has("model_type") && node.has("parameters")) {
            try {
                return mapper.treeToValue(node, ResolutionModel.class);
            } catch (JsonProcessingException e) {
                throw new CalibrationStoreException("Failed to read resolution model", e);
            }
        }
        if (node.has("fwhm_0_keV") || node.has("fwhm_0_eV")) {
            return fromLegacy((ObjectNode) node);
        }
        throw new CalibrationStoreException("Unknown calibration file format");
    }

    private static ResolutionModel fromLegacy(ObjectNode node) {
        double fwhm0;
        double epsilon;
        if (node.has("fwhm_0_keV")) {
            fwhm0 = node.get("fwhm_0_keV").asDouble();
            epsilon = node.has("epsilon_keV")
                    ? node.get("epsilon_keV").asDouble()
                    : node.path("epsilon_eV_per_keV").asDouble(3.0) / 1000;
        } else {
            fwhm0 = node.get("fwhm_0_eV").asDouble() / 1000;
            epsilon = node.path("epsilon_eV_per_keV").asDouble(3.5) / 1000;
        }
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("fwhm_0", fwhm0);
        params.put("epsilon", epsilon);
        Map<String, Double> errors = new LinkedHashMap<>();
        errors.put("fwhm_0", node.path("fwhm_0_error_eV").asDouble(0.0) / 1000);
        errors.put("epsilon", node.path("epsilon_error_eV_per_keV").asDouble(0.0) / 1000);
        return new ResolutionModel(ResolutionModelKind.DETECTOR, params, errors,
                node.path("r_squared").asDouble(0.0),
                node.path("rmse_eV").asDouble(0.0) / 1000,
                node.path("aic").asDouble(0.0),
                node.path("bic").asDouble(0.0),
                node.path("n_peaks").asInt(0),
                EnergyRange.DEFAULT,
                node.path("calibration_date").asText(LocalDateTime.now().toString()));
    }

    private JsonNode readTree(Path path, String what) {
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new CalibrationStoreException("Failed to load " + what + " from " + path, e);
        }
    }

    private void write(Object value, Path path, String what) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, value);
            }
        } catch (IOException e) {
            throw new CalibrationStoreException("Failed to save " + what + " to " + path, e);
        }
    }
}
