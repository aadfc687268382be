/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.storage;

import ai.evacortex.xrfcal.core.Spectrum;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * Content fingerprint of a spectrum: XXH64 over the big-endian IEEE-754 bytes of the interleaved
 * energy and count values, rendered as 16 hex digits.
 */
public final class SpectrumFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private SpectrumFingerprint() {
    }

    public static String of(Spectrum spectrum) {
        return HexFormat.of().toHexDigits(hash(spectrum));
    }

    public static long hash(Spectrum spectrum) {
        double[] energy = spectrum.energy();
        double[] counts = spectrum.counts();
        ByteBuffer buffer = ByteBuffer.allocate(energy.length * 16);
        for (int i = 0; i < energy.length; i++) {
            buffer.putDouble(energy[i]);
            buffer.putDouble(counts[i]);
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
