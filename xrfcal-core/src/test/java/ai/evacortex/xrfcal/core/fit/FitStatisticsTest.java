/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FitStatisticsTest {

    @Test
    void poissonWeightedChiSquared() {
        FitStatistics stats = FitStatistics.of(new double[]{10, 0, 4}, new double[]{8, 1, 4}, 1);

        assertEquals(1.4, stats.chiSquared(), 1e-12);
        assertEquals(2, stats.dof());
        assertEquals(0.7, stats.reducedChiSquared(), 1e-12);
    }

    @Test
    void noDegreesOfFreedomGivesInfiniteReducedChiSquared() {
        FitStatistics stats = FitStatistics.of(new double[]{10, 0, 4}, new double[]{8, 1, 4}, 3);
        assertEquals(Double.POSITIVE_INFINITY, stats.reducedChiSquared());
    }
}
