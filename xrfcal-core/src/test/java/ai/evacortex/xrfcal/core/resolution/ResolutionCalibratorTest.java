/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.resolution;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.PeakMeasurement;
import ai.evacortex.xrfcal.core.ResolutionModel;
import ai.evacortex.xrfcal.core.Spectrum;
import ai.evacortex.xrfcal.core.SpectrumTestUtils;
import ai.evacortex.xrfcal.core.background.BackgroundOptions;
import ai.evacortex.xrfcal.core.exceptions.InsufficientDataException;
import ai.evacortex.xrfcal.core.fit.PeakFitFailure;
import ai.evacortex.xrfcal.core.lines.StandardReferenceLines;
import ai.evacortex.xrfcal.core.shape.ResolutionModelKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCalibratorTest {

    private static final double FWHM0 = 0.080;
    private static final double EPSILON = 0.0004;

    private static PeakMeasurement measurement(String element, double energy, double fwhm) {
        return new PeakMeasurement(element, "Kα1", energy, 1000, fwhm, 1000, 0.99);
    }

    private static List<PeakMeasurement> onCurve(double... energies) {
        List<PeakMeasurement> out = new ArrayList<>();
        for (int i = 0; i < energies.length; i++) {
            out.add(measurement("E" + i, energies[i], SpectrumTestUtils.detectorFwhm(FWHM0, EPSILON, energies[i])));
        }
        return out;
    }

    private static ResolutionModel ranked(double aic, double bic) {
        Map<String, Double> params = ResolutionModel.of(ResolutionModelKind.DETECTOR, FWHM0, EPSILON).parameters();
        return new ResolutionModel(ResolutionModelKind.DETECTOR, params, null, 0.99, 0.001, aic, bic, 6, null,
                "2025-01-01T00:00");
    }

    @Test
    void rankingPrefersLowerAicThenLowerBic() {
        ResolutionModel a = ranked(-50, -40);
        ResolutionModel b = ranked(-50, -45);
        ResolutionModel c = ranked(-60, 0);

        List<ResolutionModel> models = new ArrayList<>(List.of(a, b, c));
        models.sort(ResolutionCalibrator.MODEL_RANKING);

        assertSame(c, models.get(0));
        assertSame(b, models.get(1));
        assertSame(a, models.get(2));
    }

    @Test
    void detectorFitRecoversParameters() {
        ResolutionModel model = new ResolutionCalibrator()
                .fitModel(ResolutionModelKind.DETECTOR, onCurve(1.5, 4.5, 6.4, 8.0, 9.6, 15.8));

        assertEquals(FWHM0, model.parameter("fwhm_0"), 1e-5);
        assertEquals(EPSILON, model.parameter("epsilon"), 1e-6);
        assertTrue(model.rSquared() > 0.9999);
        assertEquals(6, model.nPeaks());
        assertEquals(1.5, model.energyRange().min(), 1e-12);
        assertEquals(15.8, model.energyRange().max(), 1e-12);
    }

    @Test
    void fitModelNeedsThreePeaks() {
        assertThrows(InsufficientDataException.class,
                () -> new ResolutionCalibrator().fitModel(ResolutionModelKind.LINEAR, onCurve(4.5, 8.0)));
    }

    @Test
    void compareModelsReturnsRankedList() {
        List<PeakMeasurement> ms = new ArrayList<>();
        double[] energies = {1.5, 4.5, 6.4, 8.0, 9.6, 15.8};
        for (int i = 0; i < energies.length; i++) {
            double jitter = (i % 2 == 0 ? 1 : -1) * 0.0005;
            ms.add(measurement("E" + i, energies[i],
                    SpectrumTestUtils.detectorFwhm(FWHM0, EPSILON, energies[i]) + jitter));
        }

        List<ResolutionModel> models = new ResolutionCalibrator().compareModels(ms);

        assertFalse(models.isEmpty());
        for (int i = 1; i < models.size(); i++) {
            assertTrue(ResolutionCalibrator.MODEL_RANKING.compare(models.get(i - 1), models.get(i)) <= 0);
        }
        assertTrue(models.stream().anyMatch(m -> m.kind() == ResolutionModelKind.DETECTOR));
    }

    @Test
    void singleCorruptedWidthIsRemoved() {
        List<PeakMeasurement> ms = onCurve(1.5, 4.5, 6.4, 8.0, 9.6, 15.8);
        PeakMeasurement bad = ms.get(3);
        ms.set(3, measurement(bad.element(), bad.energy(), bad.fwhm() * 5));

        ResolutionCalibrator calibrator = new ResolutionCalibrator();
        OutlierRejection screen = calibrator.removeOutliers(ms);

        assertEquals(1, screen.outliers().size());
        assertEquals(8.0, screen.outliers().get(0).energy(), 1e-12);
        assertEquals(5, screen.kept().size());

        double filtered = calibrator.fitModel(ResolutionModelKind.DETECTOR, screen.kept()).rSquared();
        double unfiltered = calibrator.fitModel(ResolutionModelKind.DETECTOR, ms).rSquared();
        assertTrue(filtered > unfiltered);
    }

    @Test
    void cleanDataLosesNothing() {
        OutlierRejection screen = new ResolutionCalibrator().removeOutliers(onCurve(1.5, 4.5, 6.4, 8.0, 9.6, 15.8));
        assertTrue(screen.outliers().isEmpty());
        assertEquals(6, screen.kept().size());
    }

    @Test
    void flatSpectrumHasInsufficientPeaks() {
        double[] e = SpectrumTestUtils.grid(0.01, 0.02, 1024);
        Spectrum flat = new Spectrum(e, SpectrumTestUtils.constant(e.length, 50));

        ResolutionCalibrationResult result = new ResolutionCalibrator()
                .calibrate(List.of(ReferenceSpectrum.standard("Fe", flat)));

        assertFalse(result.success());
        assertTrue(result.message().contains("insufficient peaks"), result.message());
        assertTrue(result.asOptional().isEmpty());
        assertEquals(4, result.rejected().size());
    }

    @Test
    void linesOutsideTheSpectrumAreRejected() {
        Spectrum s = SpectrumTestUtils.singlePeak(6.404, 0.14, 2000, 10);
        ElementLine zr = ElementLine.of("Zr", "Kα1", 15.775);

        List<RejectedLine> rejected = new ArrayList<>();
        ResolutionCalibrationOptions options = ResolutionCalibrationOptions.defaultOptions()
                .withBackground("linear", BackgroundOptions.defaultOptions());
        List<PeakMeasurement> accepted = new ResolutionCalibrator(options).measure(
                List.of(new ReferenceSpectrum("mixed", s, List.of(ElementLine.of("Fe", "Kα1", 6.404), zr))), rejected);

        assertEquals(1, accepted.size());
        assertEquals(1, rejected.size());
        assertEquals(zr, rejected.get(0).line());
        assertEquals(PeakFitFailure.INSUFFICIENT_POINTS, rejected.get(0).reason());
        assertTrue(rejected.get(0).message().contains("outside spectrum range"));
    }

    @Test
    void highEnergyLinesNeedMoreCounts() {
        ResolutionCalibrationOptions options = ResolutionCalibrationOptions.defaultOptions();
        assertEquals(80.0, options.minCountsAt(6.4));
        assertEquals(150.0, options.minCountsAt(15.8));
        assertEquals(150.0, new ResolutionCalibrator(options).lineOptions(15.8).minHeight());
    }

    @Test
    void calibratesFromSyntheticReferenceSet() {
        List<ReferenceSpectrum> refs = new ArrayList<>();
        long seed = 42;
        for (String name : List.of("Fe", "Cu", "Ti", "Zn", "Mg", "cubic zirconia")) {
            refs.add(ReferenceSpectrum.standard(name, synthetic(name, seed++)));
        }

        ResolutionCalibrator calibrator = new ResolutionCalibrator();
        List<RejectedLine> rejected = new ArrayList<>();
        List<PeakMeasurement> passedGate = calibrator.measure(refs, rejected);
        ResolutionCalibrationResult result = calibrator.calibrate(refs);

        assertTrue(passedGate.size() >= 10, "passed " + passedGate.size() + ", rejected " + rejected);
        ResolutionCalibrationOptions gate = ResolutionCalibrationOptions.defaultOptions();
        for (PeakMeasurement m : passedGate) {
            assertTrue(m.rSquared() > gate.minRSquared(), m.toString());
            assertTrue(m.fwhm() > gate.minFwhm() && m.fwhm() < gate.maxFwhm(), m.toString());
        }
        assertTrue(result.success(), result.message());
        assertEquals(passedGate.size(), result.accepted().size() + result.outliers().size());
        assertEquals(rejected.size(), result.rejected().size());
        assertTrue(result.accepted().size() >= 8);
        ResolutionModel model = result.model();
        assertEquals(ResolutionModelKind.DETECTOR, model.kind());
        assertTrue(model.rSquared() > 0.95, "R2 " + model.rSquared());
        assertEquals(EPSILON, model.parameter("epsilon"), 0.2 * EPSILON);
        assertEquals(FWHM0, model.parameter("fwhm_0"), 0.02);
        double truth = SpectrumTestUtils.detectorFwhm(FWHM0, EPSILON, 5.9);
        assertEquals(truth, model.predict(5.9), 0.05 * truth);
    }

    private static Spectrum synthetic(String reference, long seed) {
        double[] e = SpectrumTestUtils.grid(0.01, 0.02, 1024);
        double[] expected = new double[e.length];
        for (int i = 0; i < e.length; i++) {
            expected[i] = 30 * Math.exp(-e[i] / 8) + 5;
        }
        for (ElementLine line : StandardReferenceLines.lines(reference)) {
            double fwhm = SpectrumTestUtils.detectorFwhm(FWHM0, EPSILON, line.energyKeV());
            SpectrumTestUtils.addPeak(e, expected, line.energyKeV(), fwhm, height(line));
        }
        return new Spectrum(e, SpectrumTestUtils.poisson(expected, seed));
    }

    private static double height(ElementLine line) {
        return switch (line.element()) {
            case "Al" -> 150;
            case "Mg" -> 1500;
            case "Zr" -> line.line().equals("Kα1") ? 1500 : 300;
            default -> switch (line.line()) {
                case "Kα1" -> 2000;
                case "Kα2" -> 1000;
                default -> 300;
            };
        };
    }
}
