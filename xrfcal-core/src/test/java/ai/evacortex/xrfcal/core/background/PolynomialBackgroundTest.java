/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.background;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.TestInstance;

@DisplayName("PolynomialBackground contract")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PolynomialBackgroundTest extends BackgroundMethodContractTest {

    @Override
    protected String methodName() {
        return "polynomial";
    }
}
