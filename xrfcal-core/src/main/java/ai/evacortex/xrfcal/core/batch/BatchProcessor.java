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
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import ai.evacortex.xrfcal.core.fit.SpectrumFitResult;
import ai.evacortex.xrfcal.core.fit.SpectrumFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decomposes a set of in-memory spectra with one {@link SpectrumFitter} and one set of expected lines.
 *
 * <p>A spectrum that fails is recorded and the batch moves on. Configuration errors concern every
 * spectrum alike and are thrown.</p>
 */
public final class BatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

    private final SpectrumFitter fitter;
    private final List<ElementLine> sampleLines;
    private final List<ElementLine> tubeLines;

    public BatchProcessor(SpectrumFitter fitter, List<ElementLine> sampleLines, List<ElementLine> tubeLines) {
        this.fitter = Objects.requireNonNull(fitter, "fitter must not be null");
        this.sampleLines = List.copyOf(sampleLines);
        this.tubeLines = tubeLines == null ? List.of() : List.copyOf(tubeLines);
    }

    /** Names the spectra {@code spectrum_000}, {@code spectrum_001}, ... in list order. */
    public BatchResult process(List<Spectrum> spectra) {
        return process(spectra, BatchListener.NONE);
    }

    public BatchResult process(List<Spectrum> spectra, BatchListener listener) {
        Map<String, Spectrum> named = new LinkedHashMap<>();
        for (int i = 0; i < spectra.size(); i++) {
            named.put(String.format("spectrum_%03d", i), spectra.get(i));
        }
        return process(named, listener);
    }

    public BatchResult process(Map<String, Spectrum> spectra, BatchListener listener) {
        Objects.requireNonNull(spectra, "spectra must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        LOGGER.info("Processing batch of {} spectra", spectra.size());

        List<BatchItemResult> items = new ArrayList<>(spectra.size());
        for (Map.Entry<String, Spectrum> entry : spectra.entrySet()) {
            BatchItemResult item = fitOne(entry.getKey(), entry.getValue());
            items.add(item);
            listener.onItem(items.size(), spectra.size(), item);
        }

        BatchResult result = BatchResult.of(items);
        BatchSummary summary = result.summary();
        LOGGER.info("Batch done: {}/{} successful, mean R2 {}, {} s total", summary.successfulFits(),
                summary.totalSpectra(), summary.averageRSquared(), summary.totalProcessingTime());
        return result;
    }

    private BatchItemResult fitOne(String name, Spectrum spectrum) {
        long start = System.nanoTime();
        try {
            if (spectrum == null) {
                return BatchItemResult.failed(name, "no spectrum", seconds(start));
            }
            SpectrumFitResult fit = fitter.fit(spectrum, sampleLines, tubeLines);
            return BatchItemResult.succeeded(name, fit, seconds(start));
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.warn("Fit of '{}' failed: {}", name, e.toString());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return BatchItemResult.failed(name, message, seconds(start));
        }
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1e9;
    }
}
