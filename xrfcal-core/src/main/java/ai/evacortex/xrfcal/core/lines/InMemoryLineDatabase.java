/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable table-backed {@link ReferenceLineDatabase}.
 */
public final class InMemoryLineDatabase implements ReferenceLineDatabase {

    private final Map<String, Map<String, List<EmissionLine>>> table;

    private InMemoryLineDatabase(Map<String, Map<String, List<EmissionLine>>> table) {
        this.table = table;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, List<EmissionLine>> lines(String elementSymbol) {
        return table.getOrDefault(elementSymbol, Map.of());
    }

    public static final class Builder {
        private final Map<String, Map<String, List<EmissionLine>>> table = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String element, String series, String name, double energyKeV) {
            table.computeIfAbsent(element, e -> new LinkedHashMap<>())
                    .computeIfAbsent(series, s -> new ArrayList<>())
                    .add(new EmissionLine(name, energyKeV));
            return this;
        }

        public InMemoryLineDatabase build() {
            Map<String, Map<String, List<EmissionLine>>> copy = new LinkedHashMap<>();
            table.forEach((element, bySeries) -> {
                Map<String, List<EmissionLine>> series = new LinkedHashMap<>();
                bySeries.forEach((name, lines) -> series.put(name, List.copyOf(lines)));
                copy.put(element, Collections.unmodifiableMap(series));
            });
            return new InMemoryLineDatabase(Collections.unmodifiableMap(copy));
        }
    }
}
