/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core;

import ai.evacortex.xrfcal.core.exceptions.InvalidSpectrumException;

import java.util.Arrays;

/**
 * Energy-indexed detector counts.
 *
 * <p>{@code energy} is in keV and strictly increasing, {@code counts} is non-negative and of the
 * same, positive length. Both arrays are copied on construction and on access so a
 * {@code Spectrum} never changes after it is built.</p>
 */
public record Spectrum(double[] energy, double[] counts) {

    public Spectrum {
        if (energy == null || counts == null) {
            throw new InvalidSpectrumException("energy and counts must not be null");
        }
        if (energy.length == 0 || energy.length != counts.length) {
            throw new InvalidSpectrumException("length mismatch: " + energy.length + " vs " + counts.length);
        }
        for (int i = 0; i < energy.length; i++) {
            if (!Double.isFinite(energy[i]) || !Double.isFinite(counts[i])) {
                throw new InvalidSpectrumException("non-finite value at channel " + i);
            }
            if (counts[i] < 0) {
                throw new InvalidSpectrumException("negative counts at channel " + i);
            }
            if (i > 0 && energy[i] <= energy[i - 1]) {
                throw new InvalidSpectrumException("energy not strictly increasing at channel " + i);
            }
        }
        energy = energy.clone();
        counts = counts.clone();
    }

    @Override
    public double[] energy() {
        return energy.clone();
    }

    @Override
    public double[] counts() {
        return counts.clone();
    }

    public int length() {
        return energy.length;
    }

    public double energyAt(int channel) {
        return energy[channel];
    }

    public double countsAt(int channel) {
        return counts[channel];
    }

    public double minEnergy() {
        return energy[0];
    }

    public double maxEnergy() {
        return energy[energy.length - 1];
    }

    /** Returns a spectrum on the same energy axis carrying other counts. */
    public Spectrum withCounts(double[] newCounts) {
        return new Spectrum(energy, newCounts);
    }

    /** Channel whose energy is closest to {@code keV}. */
    public int channelOf(double keV) {
        int idx = Arrays.binarySearch(energy, keV);
        if (idx >= 0) return idx;
        int ins = -idx - 1;
        if (ins == 0) return 0;
        if (ins >= energy.length) return energy.length - 1;
        return (keV - energy[ins - 1]) <= (energy[ins] - keV) ? ins - 1 : ins;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Spectrum)) return false;
        Spectrum other = (Spectrum) obj;
        return Arrays.equals(energy, other.energy) && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(energy) * 31 + Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return String.format("Spectrum[%d channels, %.3f..%.3f keV]", energy.length, minEnergy(), maxEnergy());
    }
}
