/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.batch;

import java.util.List;
import java.util.Optional;

/**
 * Items of a batch in input order, with their summary.
 */
public record BatchResult(List<BatchItemResult> items, BatchSummary summary) {

    public BatchResult {
        items = List.copyOf(items);
    }

    public static BatchResult of(List<BatchItemResult> items) {
        return new BatchResult(items, BatchSummary.of(items));
    }

    public List<BatchItemResult> failures() {
        return items.stream().filter(i -> !i.success()).toList();
    }

    public Optional<BatchItemResult> item(String name) {
        return items.stream().filter(i -> i.name().equals(name)).findFirst();
    }
}
