/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import java.util.List;
import java.util.Map;

/**
 * {@code ReferenceLineDatabase} exposes atomic emission-line energies, e.g. from external atomic
 * physics tables.
 *
 * <p>Implementations must be thread-safe and side-effect free. Unknown elements yield an empty map
 * rather than an exception.</p>
 *
 * @see CachingLineDatabase
 */
public interface ReferenceLineDatabase {

    /**
     * Lines of an element grouped by series.
     *
     * @param elementSymbol chemical symbol, e.g. {@code "Fe"}
     * @return series name ({@code "K"}, {@code "L"}, {@code "M"}) to lines; never {@code null}
     */
    Map<String, List<EmissionLine>> lines(String elementSymbol);
}
