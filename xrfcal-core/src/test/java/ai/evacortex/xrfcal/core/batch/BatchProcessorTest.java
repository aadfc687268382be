/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.batch;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.SpectrumTestUtils;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.fit.SpectrumFitOptions;
import ai.evacortex.xrfcal.core.fit.SpectrumFitter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    private static final ElementLine FE = ElementLine.of("Fe", "Kα1", 6.404);

    private static BatchProcessor processor(String backgroundMethod) {
        SpectrumFitOptions options = SpectrumFitOptions.defaultOptions()
                .withBackground(backgroundMethod, BackgroundOptions.defaultOptions())
                .withAutoFindPeaks(false);
        return new BatchProcessor(new SpectrumFitter(options), List.of(FE), List.of());
    }

    private static Spectrum twoChannels() {
        return new Spectrum(new double[]{6.0, 6.01}, new double[]{10, 12});
    }

    @Test
    void failingSpectrumDoesNotStopTheBatch() {
        List<Spectrum> spectra = List.of(
                SpectrumTestUtils.singlePeak(6.404, 0.146, 3000, 50),
                twoChannels(),
                SpectrumTestUtils.singlePeak(6.404, 0.146, 1500, 30));
        List<String> seen = new ArrayList<>();

        BatchResult result = processor("polynomial").process(spectra,
                (completed, total, item) -> seen.add(completed + "/" + total + " " + item.name()));

        assertEquals(List.of("1/3 spectrum_000", "2/3 spectrum_001", "3/3 spectrum_002"), seen);
        assertEquals(3, result.items().size());
        assertTrue(result.items().get(0).success());
        assertTrue(result.items().get(2).success());
        assertNotNull(result.items().get(2).fit());

        BatchItemResult failed = result.items().get(1);
        assertFalse(failed.success());
        assertNull(failed.fit());
        assertEquals(Double.POSITIVE_INFINITY, failed.chiSquared());
        assertEquals(0.0, failed.rSquared());
        assertTrue(failed.errorMessage().contains("unmasked channels"), failed.errorMessage());
        assertEquals(List.of(failed), result.failures());

        BatchSummary summary = result.summary();
        assertEquals(3, summary.totalSpectra());
        assertEquals(2, summary.successfulFits());
        assertEquals(1, summary.failedFits());
        assertEquals(200.0 / 3, summary.successRate(), 1e-9);
        double meanR2 = (result.items().get(0).rSquared() + result.items().get(2).rSquared()) / 2;
        assertEquals(meanR2, summary.averageRSquared(), 1e-12);
        assertTrue(Double.isFinite(summary.averageChiSquared()));
        assertTrue(summary.totalProcessingTime() >= summary.averageFitTime());
    }

    @Test
    void namedSpectraKeepTheirNames() {
        Map<String, Spectrum> spectra = new LinkedHashMap<>();
        spectra.put("steel-01", SpectrumTestUtils.singlePeak(6.404, 0.146, 3000, 50));
        spectra.put("steel-02", SpectrumTestUtils.singlePeak(6.404, 0.146, 2000, 50));

        BatchResult result = processor("linear").process(spectra, BatchListener.NONE);

        assertTrue(result.item("steel-02").orElseThrow().success());
        assertTrue(result.item("steel-02").orElseThrow().rSquared() > 0.99);
        assertTrue(result.failures().isEmpty());
        assertEquals(100.0, result.summary().successRate());
    }

    @Test
    void emptyBatchHasZeroSummary() {
        BatchSummary summary = processor("linear").process(List.of()).summary();

        assertEquals(0, summary.totalSpectra());
        assertEquals(0.0, summary.successRate());
        assertEquals(0.0, summary.averageChiSquared());
        assertEquals(0.0, summary.averageRSquared());
    }

    @Test
    void configurationErrorsAreThrown() {
        List<Spectrum> spectra = List.of(SpectrumTestUtils.singlePeak(6.404, 0.146, 3000, 50));
        boolean[] shortMask = new boolean[3];
        SpectrumFitOptions options = SpectrumFitOptions.defaultOptions()
                .withBackground("polynomial", BackgroundOptions.defaultOptions().withPolynomial(3, shortMask));
        BatchProcessor misconfigured = new BatchProcessor(new SpectrumFitter(options), List.of(FE), List.of());

        assertThrows(ConfigurationException.class, () -> misconfigured.process(spectra));
    }

    @Test
    void summaryUsesSnakeCaseKeys() {
        BatchSummary summary = processor("linear")
                .process(List.of(SpectrumTestUtils.singlePeak(6.404, 0.146, 3000, 50))).summary();

        JsonNode json = new ObjectMapper().valueToTree(summary);

        assertEquals(1, json.get("total_spectra").asInt());
        assertEquals(100.0, json.get("success_rate").asDouble());
        assertTrue(json.has("average_r_squared"));
        assertTrue(json.has("total_processing_time"));
    }
}
