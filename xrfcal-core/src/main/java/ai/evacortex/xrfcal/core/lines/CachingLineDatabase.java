/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Memoizes lookups of a slower {@link ReferenceLineDatabase}, typically one backed by external
 * atomic-physics tables.
 */
public final class CachingLineDatabase implements ReferenceLineDatabase {

    private static final long DEFAULT_MAXIMUM_SIZE = 128;

    private final LoadingCache<String, Map<String, List<EmissionLine>>> cache;

    public CachingLineDatabase(ReferenceLineDatabase delegate) {
        this(delegate, DEFAULT_MAXIMUM_SIZE);
    }

    public CachingLineDatabase(ReferenceLineDatabase delegate, long maximumSize) {
        Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build(symbol -> Map.copyOf(delegate.lines(symbol)));
    }

    @Override
    public Map<String, List<EmissionLine>> lines(String elementSymbol) {
        return cache.get(elementSymbol);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
