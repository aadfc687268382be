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
import ai.evacortex.xrfcal.core.Spectrum;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expected lines from an external fundamental-parameters predictor.
 */
public final class PredictedLineSource implements ExpectedLineSource {

    private final IntensityPredictor predictor;

    public PredictedLineSource(IntensityPredictor predictor) {
        this.predictor = Objects.requireNonNull(predictor, "predictor must not be null");
    }

    @Override
    public List<ElementLine> expectedLines(CalibrationStandard standard, Spectrum measured) {
        Map<String, Double> composition = standard.composition();
        if (composition.isEmpty()) return List.of();
        Map<String, Map<String, LineIntensity>> predicted =
                predictor.predictIntensities(composition, standard.excitationKeV(), standard.geometry());
        List<ElementLine> out = new ArrayList<>();
        if (predicted == null) return out;
        for (Map.Entry<String, Map<String, LineIntensity>> element : predicted.entrySet()) {
            for (Map.Entry<String, LineIntensity> line : element.getValue().entrySet()) {
                LineIntensity li = line.getValue();
                if (li.energyKeV() > 0 && li.energyKeV() < standard.excitationKeV()
                        && Double.isFinite(li.relativeRate()) && li.relativeRate() > 0) {
                    out.add(new ElementLine(element.getKey(), line.getKey(), li.energyKeV(), li.relativeRate()));
                }
            }
        }
        return out;
    }
}
