/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.lines;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Atomic numbers of the elements up to uranium, by symbol.
 */
public final class Elements {

    private static final String[] SYMBOLS = {
            "H", "He", "Li", "Be", "B", "C", "N", "O", "F", "Ne",
            "Na", "Mg", "Al", "Si", "P", "S", "Cl", "Ar", "K", "Ca",
            "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn",
            "Ga", "Ge", "As", "Se", "Br", "Kr", "Rb", "Sr", "Y", "Zr",
            "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd", "In", "Sn",
            "Sb", "Te", "I", "Xe", "Cs", "Ba", "La", "Ce", "Pr", "Nd",
            "Pm", "Sm", "Eu", "Gd", "Tb", "Dy", "Ho", "Er", "Tm", "Yb",
            "Lu", "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg",
            "Tl", "Pb", "Bi", "Po", "At", "Rn", "Fr", "Ra", "Ac", "Th",
            "Pa", "U"};

    private static final Map<String, Integer> NUMBERS;

    static {
        Map<String, Integer> m = new HashMap<>();
        for (int i = 0; i < SYMBOLS.length; i++) {
            m.put(SYMBOLS[i], i + 1);
        }
        NUMBERS = Map.copyOf(m);
    }

    private Elements() {
    }

    /** Atomic number of {@code symbol}; empty for unknown or misspelled symbols. */
    public static OptionalInt atomicNumber(String symbol) {
        Integer z = symbol == null ? null : NUMBERS.get(symbol.trim());
        return z == null ? OptionalInt.empty() : OptionalInt.of(z);
    }

    public static String symbol(int atomicNumber) {
        if (atomicNumber < 1 || atomicNumber > SYMBOLS.length) {
            throw new IllegalArgumentException("atomic number out of range: " + atomicNumber);
        }
        return SYMBOLS[atomicNumber - 1];
    }
}
