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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationStoreTest {

    @TempDir
    Path dir;

    private final CalibrationStore store = new CalibrationStore();

    private static ResolutionModel calibrated() {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("fwhm_0", 0.0812);
        params.put("epsilon", 0.00041);
        Map<String, Double> errors = new LinkedHashMap<>();
        errors.put("fwhm_0", 0.0011);
        errors.put("epsilon", 0.00002);
        return new ResolutionModel(ResolutionModelKind.DETECTOR, params, errors, 0.987, 0.0021, -120.5, -119.8,
                14, new EnergyRange(1.254, 17.668), "2025-03-14T10:15:30");
    }

    @Test
    void modelRoundTrip() {
        Path file = dir.resolve("nested").resolve("fwhm.json");
        ResolutionModel model = calibrated();

        store.saveModel(model, file);
        ResolutionModel loaded = store.loadModel(file);

        assertTrue(Files.exists(file));
        assertEquals(model, loaded);
        assertEquals(model.predict(5.9), loaded.predict(5.9), 1e-15);
    }

    @Test
    void writtenModelUsesSnakeCaseKeys() {
        String json = store.toJson(calibrated());
        assertTrue(json.contains("\"model_type\" : \"detector\""), json);
        assertTrue(json.contains("\"parameter_errors\""));
        assertTrue(json.contains("\"n_peaks\" : 14"));
    }

    @Test
    void nonDetectorModelRoundTrip() {
        ResolutionModel quadratic = ResolutionModel.of(ResolutionModelKind.QUADRATIC, 0.09, 0.004, 0.0001);
        ResolutionModel loaded = store.modelFromJson(store.toJson(quadratic));
        assertEquals(ResolutionModelKind.QUADRATIC, loaded.kind());
        assertEquals(quadratic.predict(8.0), loaded.predict(8.0), 1e-15);
    }

    @Test
    void resultRoundTrip() {
        Path file = dir.resolve("intensity.json");
        Map<String, Double> efficiency = new LinkedHashMap<>();
        efficiency.put("a", 1.02);
        efficiency.put("b", -0.01);
        efficiency.put("c", 0.0005);
        CalibrationResult result = new CalibrationResult(0.079, 0.00098, efficiency, 2012.5, 0.0, 0.06, 2.5,
                Map.of("Fe", 1.1, "Cu", 0.93), 1.07, 0.996, true, "converged after 412 evaluations", null, calibrated(), 412, "00ff00ff00ff00ff",
                "2025-03-14T11:00:00");

        store.saveResult(result, file);
        CalibrationResult loaded = store.loadResult(file);

        assertEquals(result, loaded);
        assertEquals("detector", loaded.fwhmModelType());
        assertEquals(1.02, loaded.efficiency().a());
        assertEquals(1.1, loaded.elementScales().get("Fe"));
    }

    @Test
    void legacyElectronVoltDocument() {
        String legacy = "{\"fwhm_0_eV\": 120.0, \"epsilon_eV_per_keV\": 3.5, \"fwhm_0_error_eV\": 2.0,"
                + " \"r_squared\": 0.98, \"rmse_eV\": 4.0, \"n_peaks\": 9, \"calibration_date\": \"2024-05-01\"}";

        ResolutionModel model = store.modelFromJson(legacy);

        assertEquals(ResolutionModelKind.DETECTOR, model.kind());
        assertEquals(0.120, model.parameter("fwhm_0"), 1e-12);
        assertEquals(0.0035, model.parameter("epsilon"), 1e-12);
        assertEquals(0.002, model.parameterErrors().get("fwhm_0"), 1e-12);
        assertEquals(0.004, model.rmse(), 1e-12);
        assertEquals(9, model.nPeaks());
        assertEquals("2024-05-01", model.calibrationDate());
    }

    @Test
    void legacyKiloElectronVoltDocumentDefaultsEpsilon() {
        ResolutionModel model = store.modelFromJson("{\"fwhm_0_keV\": 0.1}");
        assertEquals(0.1, model.parameter("fwhm_0"), 1e-12);
        assertEquals(0.003, model.parameter("epsilon"), 1e-12);
    }

    @Test
    void unknownDocumentIsRejected() throws IOException {
        Path file = dir.resolve("other.json");
        Files.writeString(file, "{\"gain\": 0.01, \"offset\": 0.0}");

        CalibrationStoreException e = assertThrows(CalibrationStoreException.class, () -> store.loadModel(file));
        assertTrue(e.getMessage().contains("Unknown calibration file format"));
        assertThrows(CalibrationStoreException.class, () -> store.modelFromJson("[1, 2]"));
        assertThrows(CalibrationStoreException.class, () -> store.modelFromJson("{not json"));
    }

    @Test
    void missingFileIsStoreError() {
        Path missing = dir.resolve("missing.json");
        CalibrationStoreException e = assertThrows(CalibrationStoreException.class, () -> store.loadModel(missing));
        assertTrue(e.getMessage().startsWith("Failed to load"));
        assertThrows(CalibrationStoreException.class, () -> store.loadResult(missing));
    }
}
