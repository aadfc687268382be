/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.SpectrumTestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakFitterTest {

    private static double[] minus(double[] counts, double offset) {
        double[] out = new double[counts.length];
        for (int i = 0; i < counts.length; i++) out[i] = counts[i] - offset;
        return out;
    }

    @Test
    void recoversCenterAndWidthOfIsolatedPeak() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 5000, 50);
        double[] net = minus(s.counts(), 50);

        PeakFitOutcome outcome = new PeakFitter().fit(s.energy(), net, 6.40);

        assertTrue(outcome.isSuccess(), outcome.message());
        Peak peak = outcome.peak();
        assertEquals(6.40, peak.energy(), 1e-3);
        assertEquals(0.12, peak.fwhm(), 0.12 * 0.01);
        assertEquals(5000, peak.amplitude(), 50);
        assertEquals("gaussian", peak.shape());
        assertTrue(peak.rSquared() > 0.999);
    }

    @Test
    void nelderMeadAgreesWithDefaultBackend() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 5000, 0);
        PeakFitOutcome outcome = new PeakFitter(PeakFitOptions.defaultOptions().withBackend("nelder-mead"))
                .fit(s, 6.41);

        assertTrue(outcome.isSuccess(), outcome.message());
        assertEquals(6.40, outcome.peak().energy(), 2e-3);
        assertEquals(0.12, outcome.peak().fwhm(), 0.12 * 0.02);
    }

    @Test
    void fixedShapeKeepsGuessedWidth() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 5000, 0);
        PeakFitOptions options = PeakFitOptions.defaultOptions()
                .withFwhm(0.15, 0.05, 0.30)
                .withFixedShape(true);

        PeakFitOutcome outcome = new PeakFitter(options).fit(s, 6.40);

        assertTrue(outcome.isSuccess(), outcome.message());
        assertEquals(0.15, outcome.peak().fwhm(), 1e-9);
    }

    @Test
    void tooFewPointsInWindow() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 5000, 0);
        PeakFitOutcome outcome = new PeakFitter().fit(s, 20.0);

        assertFalse(outcome.isSuccess());
        assertEquals(PeakFitFailure.INSUFFICIENT_POINTS, outcome.failure());
        assertTrue(outcome.asOptional().isEmpty());
    }

    @Test
    void emptyWindowHasNoSignal() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 0, 0);
        PeakFitOutcome outcome = new PeakFitter().fit(s, 6.40);

        assertEquals(PeakFitFailure.NO_SIGNAL, outcome.failure());
        assertEquals(6.40, outcome.requestedEnergy());
    }

    @Test
    void weakMaximumIsRejected() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 30, 0);
        PeakFitOutcome outcome = new PeakFitter(PeakFitOptions.defaultOptions().withMinHeight(100)).fit(s, 6.40);

        assertEquals(PeakFitFailure.TOO_WEAK, outcome.failure());
        assertTrue(outcome.message().contains("too weak"));
    }

    @Test
    void fitAllIsolatesFailures() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.40, 0.12, 5000, 0);
        List<PeakFitOutcome> outcomes = new PeakFitter().fitAll(s, List.of(6.40, 20.0));

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertFalse(outcomes.get(1).isSuccess());
    }

    @Test
    void outcomeRequiresExactlyOneBranch() {
        assertThrows(IllegalArgumentException.class,
                () -> new PeakFitOutcome(1.0, null, null, "neither"));
    }
}
