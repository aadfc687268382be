/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.math;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FiltersTest {

    @Test
    void reflectMirrorsAcrossEdges() {
        assertEquals(0, Filters.reflect(-1, 5));
        assertEquals(1, Filters.reflect(-2, 5));
        assertEquals(4, Filters.reflect(5, 5));
        assertEquals(3, Filters.reflect(6, 5));
        assertEquals(2, Filters.reflect(2, 5));
    }

    @Test
    void percentileFilterPicksRankWithinWindow() {
        double[] data = {5, 1, 9, 3, 7, 2, 8};
        assertArrayEquals(new double[]{1, 1, 1, 3, 2, 2, 2}, Filters.percentile(data, 3, 0.0), 0.0);
        double[] flat = new double[20];
        Arrays.fill(flat, 4.0);
        assertArrayEquals(flat, Filters.percentile(flat, 7, 50.0), 0.0);
        assertThrows(IllegalArgumentException.class, () -> Filters.percentile(data, 0, 5.0));
    }

    @Test
    void gaussianSmoothingPreservesMassAndConstants() {
        double[] spike = new double[101];
        spike[50] = 1.0;
        double[] smoothed = Filters.gaussian(spike, 3.0);
        assertEquals(1.0, Arrays.stream(smoothed).sum(), 1e-12);
        assertTrue(smoothed[50] > smoothed[47] && smoothed[50] > smoothed[53]);
        assertEquals(smoothed[47], smoothed[53], 1e-15);

        double[] flat = new double[30];
        Arrays.fill(flat, 2.5);
        assertArrayEquals(flat, Filters.gaussian(flat, 4.0), 1e-12);
    }
}
