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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shapes keyed by {@link PeakShape#id()}.
 */
public final class PeakShapeRegistry {

    private static final PeakShapeRegistry DEFAULT = new PeakShapeRegistry(List.of(
            new GaussianShape(),
            new LorentzianShape(),
            new VoigtShape(),
            new PseudoVoigtShape(),
            new HypermetShape(),
            new TailGaussianShape()));

    private final Map<String, PeakShape> shapes;

    public PeakShapeRegistry(Collection<? extends PeakShape> implementations) {
        Map<String, PeakShape> map = new LinkedHashMap<>();
        for (PeakShape shape : implementations) {
            if (map.putIfAbsent(shape.id(), shape) != null) {
                throw new ConfigurationException("duplicate peak shape id: " + shape.id());
            }
        }
        this.shapes = Map.copyOf(map);
    }

    public static PeakShapeRegistry defaultRegistry() {
        return DEFAULT;
    }

    /** Shorthand for {@code defaultRegistry().get(id)}. */
    public static PeakShape shape(String id) {
        return DEFAULT.get(id);
    }

    public PeakShape get(String id) {
        if (id == null) {
            throw new ConfigurationException("peak shape id must not be null");
        }
        PeakShape shape = shapes.get(id.toLowerCase(Locale.ROOT));
        if (shape == null) {
            throw new ConfigurationException("unknown peak shape '" + id + "', expected one of " + shapes.keySet());
        }
        return shape;
    }

    public Set<String> ids() {
        return shapes.keySet();
    }
}
