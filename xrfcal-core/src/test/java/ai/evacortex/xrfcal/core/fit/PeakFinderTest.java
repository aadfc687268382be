/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.SpectrumTestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakFinderTest {

    private final double[] energy = SpectrumTestUtils.grid(5.0, 0.01, 301);

    @Test
    void findsPeaksInChannelOrder() {
        double[] c = new double[energy.length];
        SpectrumTestUtils.addPeak(energy, c, 7.0, 0.12, 800);
        SpectrumTestUtils.addPeak(energy, c, 6.0, 0.12, 1000);

        List<PeakFinder.DetectedPeak> peaks = new PeakFinder().find(energy, c);

        assertEquals(2, peaks.size());
        assertEquals(6.0, peaks.get(0).energy(), 1e-9);
        assertEquals(7.0, peaks.get(1).energy(), 1e-9);
        assertTrue(peaks.get(0).channel() < peaks.get(1).channel());
        assertEquals(1000, peaks.get(0).height(), 1e-6);
    }

    @Test
    void closeNeighboursYieldToTheHigherPeak() {
        double[] c = new double[energy.length];
        SpectrumTestUtils.addPeak(energy, c, 6.00, 0.02, 1000);
        SpectrumTestUtils.addPeak(energy, c, 6.05, 0.02, 500);

        assertEquals(2, new PeakFinder(null, 3, null).find(energy, c).size());
        List<PeakFinder.DetectedPeak> merged = new PeakFinder(null, 10, null).find(energy, c);
        assertEquals(1, merged.size());
        assertEquals(6.00, merged.get(0).energy(), 1e-9);
    }

    @Test
    void lowProminenceAndHeightAreFiltered() {
        double[] c = new double[energy.length];
        SpectrumTestUtils.addPeak(energy, c, 6.0, 0.12, 1000);
        SpectrumTestUtils.addPeak(energy, c, 7.0, 0.12, 20);

        assertEquals(1, new PeakFinder().find(energy, c).size());
        assertEquals(2, new PeakFinder(10.0, 10, null).find(energy, c).size());
        assertEquals(1, new PeakFinder(10.0, 10, 100.0).find(energy, c).size());
    }

    @Test
    void prominenceIsMeasuredFromHigherSaddle() {
        double[] c = {0, 5, 1, 10, 3, 2};
        assertEquals(4.0, PeakFinder.prominence(c, 1), 1e-12);
        assertEquals(8.0, PeakFinder.prominence(c, 3), 1e-12);
    }

    @Test
    void distanceMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PeakFinder(null, 0, null));
    }
}
