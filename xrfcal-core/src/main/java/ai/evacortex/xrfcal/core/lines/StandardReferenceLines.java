/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import ai.evacortex.xrfcal.core.ElementLine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Characteristic lines expected in the pure-element reference spectra used for resolution
 * calibration. Every reference except cubic zirconia also shows Al Kα from the sample holder.
 * Zr L lines are left out: they overlap and suffer matrix effects.
 */
public final class StandardReferenceLines {

    public static final String CUBIC_ZIRCONIA = "cubic zirconia";

    private static final ElementLine AL_KA = ElementLine.of("Al", "Kα", 1.487);

    private static final Map<String, List<ElementLine>> LINES;

    static {
        Map<String, List<ElementLine>> m = new LinkedHashMap<>();
        m.put("Fe", List.of(
                ElementLine.of("Fe", "Kα1", 6.404),
                ElementLine.of("Fe", "Kα2", 6.391),
                ElementLine.of("Fe", "Kβ1", 7.058),
                AL_KA));
        m.put("Cu", List.of(
                ElementLine.of("Cu", "Kα1", 8.048),
                ElementLine.of("Cu", "Kα2", 8.028),
                ElementLine.of("Cu", "Kβ1", 8.905),
                AL_KA));
        m.put("Ti", List.of(
                ElementLine.of("Ti", "Kα1", 4.511),
                ElementLine.of("Ti", "Kα2", 4.505),
                ElementLine.of("Ti", "Kβ1", 4.932),
                AL_KA));
        m.put("Zn", List.of(
                ElementLine.of("Zn", "Kα1", 8.639),
                ElementLine.of("Zn", "Kα2", 8.616),
                ElementLine.of("Zn", "Kβ1", 9.572),
                AL_KA));
        m.put("Mg", List.of(
                ElementLine.of("Mg", "Kα", 1.254),
                AL_KA));
        m.put(CUBIC_ZIRCONIA, List.of(
                ElementLine.of("Zr", "Kα1", 15.775),
                ElementLine.of("Zr", "Kβ1", 17.668)));
        LINES = Collections.unmodifiableMap(m);
    }

    private StandardReferenceLines() {
    }

    public static Set<String> referenceNames() {
        return LINES.keySet();
    }

    /**
     * @param reference reference name, e.g. {@code "Fe"} or {@link #CUBIC_ZIRCONIA}
     * @return expected lines, empty for an unknown reference
     */
    public static List<ElementLine> lines(String reference) {
        return LINES.getOrDefault(reference, List.of());
    }

    public static Map<String, List<ElementLine>> all() {
        return LINES;
    }
}
