/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.shape;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.TestInstance;

@DisplayName("HypermetShape contract")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class HypermetShapeTest extends PeakShapeContractTest {

    @Override
    protected PeakShape shape() {
        return new HypermetShape();
    }

    @Override
    protected double[] parameters() {
        return new double[]{1000.0, CENTER, 0.06, 0.05, 3.0};
    }

    @Override
    protected boolean symmetric() {
        return false;
    }
}
