/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PeakShapeRegistryTest {

    @Test
    void defaultRegistryHoldsAllShapes() {
        assertEquals(Set.of("gaussian", "lorentzian", "voigt", "pseudo_voigt", "hypermet", "tail_gaussian"),
                PeakShapeRegistry.defaultRegistry().ids());
        assertEquals("voigt", PeakShapeRegistry.shape("Voigt").id());
    }

    @Test
    void unknownShapeIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> PeakShapeRegistry.shape("doniach"));
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> new PeakShapeRegistry(List.of(new GaussianShape(), new GaussianShape())));
    }

    @Test
    void resolutionKindsRoundTripThroughIds() {
        for (ResolutionModelKind kind : ResolutionModelKind.values()) {
            assertSame(kind, ResolutionModelKind.fromId(kind.id()));
            assertEquals(kind.parameterCount(), kind.initialGuess().length);
            for (int i = 0; i < kind.parameterCount(); i++) {
                assertTrue(kind.lowerBounds()[i] <= kind.initialGuess()[i]);
                assertTrue(kind.initialGuess()[i] <= kind.upperBounds()[i]);
            }
        }
        assertThrows(ConfigurationException.class, () -> ResolutionModelKind.fromId("cubic"));
    }
}
