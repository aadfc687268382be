/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingLineDatabaseTest {

    private final InMemoryLineDatabase backing = InMemoryLineDatabase.builder()
            .add("Fe", "K", "Kα1", 6.404)
            .add("Fe", "K", "Kβ1", 7.058)
            .add("Fe", "L", "Lα1", 0.705)
            .build();

    @Test
    void lookupsAreMemoized() {
        AtomicInteger calls = new AtomicInteger();
        CachingLineDatabase cached = new CachingLineDatabase(symbol -> {
            calls.incrementAndGet();
            return backing.lines(symbol);
        });

        Map<String, List<EmissionLine>> first = cached.lines("Fe");
        Map<String, List<EmissionLine>> second = cached.lines("Fe");

        assertEquals(1, calls.get());
        assertEquals(first, second);
        assertEquals(new EmissionLine("Kα1", 6.404), first.get("K").get(0));
        assertEquals(1, first.get("L").size());

        cached.invalidateAll();
        cached.lines("Fe");
        assertEquals(2, calls.get());
    }

    @Test
    void unknownElementsAreEmpty() {
        assertTrue(new CachingLineDatabase(backing).lines("Og").isEmpty());
    }

    @Test
    void standardReferencesCarrySampleHolderLine() {
        assertEquals(6, StandardReferenceLines.referenceNames().size());
        for (String name : StandardReferenceLines.referenceNames()) {
            boolean hasAl = StandardReferenceLines.lines(name).stream().anyMatch(l -> l.element().equals("Al"));
            assertEquals(!name.equals(StandardReferenceLines.CUBIC_ZIRCONIA), hasAl, name);
        }
        assertTrue(StandardReferenceLines.lines("Unobtainium").isEmpty());
    }
}
