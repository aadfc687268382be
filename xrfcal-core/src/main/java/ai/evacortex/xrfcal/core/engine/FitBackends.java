/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.engine;

import ai.evacortex.xrfcal.core.exceptions.ConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves {@link CurveFitBackend} adapters by name. Unknown names are configuration errors.
 */
public final class FitBackends {

    private static final Map<String, Supplier<CurveFitBackend>> BACKENDS = Map.of(
            LevenbergMarquardtBackend.NAME, LevenbergMarquardtBackend::new,
            "lm", LevenbergMarquardtBackend::new,
            NelderMeadBackend.NAME, NelderMeadBackend::new,
            "simplex", NelderMeadBackend::new);

    private FitBackends() {
    }

    public static CurveFitBackend defaultBackend() {
        return new LevenbergMarquardtBackend();
    }

    public static CurveFitBackend forName(String name) {
        if (name == null) {
            throw new ConfigurationException("fit backend name must not be null");
        }
        Supplier<CurveFitBackend> supplier = BACKENDS.get(name.toLowerCase(Locale.ROOT));
        if (supplier == null) {
            throw new ConfigurationException("unknown fit backend '" + name + "', expected one of " + BACKENDS.keySet());
        }
        return supplier.get();
    }

    public static Set<String> names() {
        return BACKENDS.keySet();
    }
}
