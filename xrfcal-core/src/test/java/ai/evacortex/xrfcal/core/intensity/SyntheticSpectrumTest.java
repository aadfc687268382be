/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.intensity;

import ai.evacortex.xrfcal.core.ElementLine;
import ai.evacortex.xrfcal.core.SpectrumTestUtils;
import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticSpectrumTest {

    private final double[] energy = SpectrumTestUtils.grid(1.0, 0.01, 2500);

    @Test
    void comptonShiftAtRightAngle() {
        assertEquals(19.432, SyntheticSpectrum.comptonEnergy(20.2, Math.PI / 2), 1e-3);
        assertEquals(20.2, SyntheticSpectrum.comptonEnergy(20.2, 0.0), 1e-12);
    }

    @Test
    void lineHeightFollowsScaleAndEfficiency() {
        SyntheticSpectrum model = new SyntheticSpectrum(energy,
                List.of(new ElementLine("Fe", "Kα1", 6.40, 0.5)), List.of(), Geometry.defaultGeometry());
        double[] net = model.net(new IntensityParameters(0.08, 0.001, 1000, new EfficiencyCurve(0.8, 0, 0), 0));

        int peak = 540;
        assertEquals(6.40, energy[peak], 1e-9);
        assertEquals(400, net[peak], 1e-6);
        assertEquals(0.0, net[0]);
        assertFalse(model.hasScatter());
    }

    @Test
    void tubeLinesAddRayleighAndComptonPeaks() {
        SyntheticSpectrum model = new SyntheticSpectrum(energy, List.of(), List.of(20.2), new Geometry(45, 45));
        double[] net = model.net(new IntensityParameters(0.08, 0.001, 1000, EfficiencyCurve.flat(), 50));

        assertTrue(model.hasScatter());
        assertEquals(50, net[1920], 1e-3);
        assertEquals(50, net[1843], 2.0);
    }

    @Test
    void grossAddsBackground() {
        SyntheticSpectrum model = new SyntheticSpectrum(energy, List.of(), List.of(), Geometry.defaultGeometry());
        double[] gross = model.gross(SpectrumTestUtils.constant(energy.length, 7),
                new IntensityParameters(0.08, 0.001, 1, EfficiencyCurve.flat(), 0));
        assertEquals(7, gross[100]);
    }

    @Test
    void efficiencyIsClipped() {
        assertEquals(1.0, EfficiencyCurve.flat().at(12.0));
        assertEquals(EfficiencyCurve.MAX, new EfficiencyCurve(1, 0.5, 0).at(10));
        assertEquals(EfficiencyCurve.MIN, new EfficiencyCurve(0.5, -0.2, 0).at(10));
        assertEquals(0.9, new EfficiencyCurve(0.5, 0.1, 0).at(4), 1e-12);
    }

    @Test
    void geometryAnglesAreValidated() {
        assertEquals(90.0, Geometry.defaultGeometry().scatteringAngle());
        assertEquals(100.0, new Geometry(30, 50).scatteringAngle());
        assertThrows(ConfigurationException.class, () -> new Geometry(0, 45));
        assertThrows(ConfigurationException.class, () -> new Geometry(45, 90));
    }

    @Test
    void parameterVectorRoundTrip() {
        IntensityParameters p = new IntensityParameters(0.08, 0.001, 1000, new EfficiencyCurve(1.1, 0.01, -0.001), 3);
        assertEquals(p, IntensityParameters.fromArray(p.toArray()));
        assertEquals(IntensityParameters.SIZE, p.toArray().length);
    }

    @Test
    void tailAddsLowEnergyShoulderOnly() {
        SyntheticSpectrum model = new SyntheticSpectrum(energy,
                List.of(new ElementLine("Fe", "Kα1", 6.40, 0.4)), List.of(), Geometry.defaultGeometry());
        double[] pure = model.net(new IntensityParameters(0.08, 0.001, 1000, EfficiencyCurve.flat(), 0));
        double[] tailed = model.net(new IntensityParameters(0.08, 0.001, 1000, EfficiencyCurve.flat(), 0,
                0.1, 3.0, Map.of()));

        assertEquals(400 * 0.1 * Math.exp(-1.5), tailed[490] - pure[490], 1e-6);
        assertEquals(pure[590], tailed[590]);
        assertTrue(tailed[300] > pure[300]);
    }

    @Test
    void elementScalesApplyPerElement() {
        SyntheticSpectrum model = new SyntheticSpectrum(energy,
                List.of(new ElementLine("Fe", "Kα1", 6.40, 0.5), new ElementLine("Cu", "Kα1", 8.04, 0.5)),
                List.of(), Geometry.defaultGeometry());
        double[] net = model.net(new IntensityParameters(0.08, 0.001, 1000, EfficiencyCurve.flat(), 0,
                0.0, 0.0, Map.of("Fe", 2.0)));

        assertEquals(List.of("Fe", "Cu"), model.elements());
        assertEquals(1000, net[540], 1e-6);
        assertEquals(500, net[704], 1e-6);
    }

    @Test
    void shapeParameterVectorRoundTrip() {
        List<String> elements = List.of("Fe", "Cu");
        IntensityParameters p = new IntensityParameters(0.08, 0.001, 1000, EfficiencyCurve.flat(), 3,
                0.05, 2.0, Map.of("Fe", 1.2, "Cu", 0.9));
        double[] array = p.toArray(elements);

        assertEquals(IntensityParameters.SHAPE_SIZE + 2, array.length);
        assertEquals(p, IntensityParameters.fromArray(array, elements));
    }
}
