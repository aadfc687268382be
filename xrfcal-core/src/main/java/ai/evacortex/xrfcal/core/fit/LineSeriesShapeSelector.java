/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.lines.Elements;
import ai.evacortex.xrfcal.core.shape.PeakShape;
import ai.evacortex.xrfcal.core.shape.PeakShapeRegistry;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Selects the profile from the line series and the atomic number of the emitter.
 *
 * <ul>
 *   <li>K lines of elements lighter than zinc: {@code gaussian}</li>
 *   <li>K lines from zinc upward: {@code voigt}</li>
 *   <li>L and M lines: {@code hypermet}</li>
 * </ul>
 *
 * <p>Lines of unknown elements or series get the fallback shape.</p>
 */
public final class LineSeriesShapeSelector implements PeakShapeSelector {

    public static final int HEAVY_K_MIN_Z = 30;

    private final PeakShape lightK;
    private final PeakShape heavyK;
    private final PeakShape lm;
    private final PeakShape fallback;

    public LineSeriesShapeSelector() {
        this(PeakShapeRegistry.defaultRegistry());
    }

    public LineSeriesShapeSelector(PeakShapeRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.lightK = registry.get("gaussian");
        this.heavyK = registry.get("voigt");
        this.lm = registry.get("hypermet");
        this.fallback = registry.get("gaussian");
    }

    @Override
    public PeakShape select(ElementLine line) {
        if (line == null || line.line().isEmpty()) {
            return fallback;
        }
        return switch (Character.toUpperCase(line.line().charAt(0))) {
            case 'K' -> {
                OptionalInt z = Elements.atomicNumber(line.element());
                if (z.isEmpty()) yield fallback;
                yield z.getAsInt() < HEAVY_K_MIN_Z ? lightK : heavyK;
            }
            case 'L', 'M' -> lm;
            default -> fallback;
        };
    }
}
