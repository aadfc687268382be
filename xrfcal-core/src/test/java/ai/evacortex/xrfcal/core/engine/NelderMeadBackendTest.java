/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.TestInstance;

@DisplayName("NelderMeadBackend contract")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class NelderMeadBackendTest extends CurveFitBackendContractTest {

    private final CurveFitBackend backend = new NelderMeadBackend();

    @Override
    protected CurveFitBackend backend() {
        return backend;
    }
}
