/*
 * XRFCal — Spectral Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.xrfcal.core.fit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Local-maximum detection with minimum height, minimum channel distance and minimum prominence,
 * applied in that order.
 */
public final class PeakFinder {

    public static final double DEFAULT_PROMINENCE_FRACTION = 0.05;
    public static final int DEFAULT_DISTANCE = 10;

    /**
     * @param channel  index of the maximum
     * @param energy   energy at the maximum, keV
     * @param height   counts at the maximum
     * @param prominence height above the higher of the two flanking minima
     */
    public record DetectedPeak(int channel, double energy, double height, double prominence) {
    }

    private final Double prominence;
    private final int distance;
    private final Double minHeight;

    /**
     * @param prominence minimum prominence, or {@code null} for 5 % of the maximum count
     * @param distance   minimum channel separation, at least 1
     * @param minHeight  minimum height, or {@code null} for none
     */
    public PeakFinder(Double prominence, int distance, Double minHeight) {
        if (distance < 1) {
            throw new IllegalArgumentException("distance must be >= 1: " + distance);
        }
        this.prominence = prominence;
        this.distance = distance;
        this.minHeight = minHeight;
    }

    public PeakFinder() {
        this(null, DEFAULT_DISTANCE, null);
    }

    public List<DetectedPeak> find(double[] energy, double[] counts) {
        int n = counts.length;
        double max = 0.0;
        for (double c : counts) max = Math.max(max, c);
        double minProminence = prominence != null ? prominence : max * DEFAULT_PROMINENCE_FRACTION;

        List<Integer> candidates = new ArrayList<>();
        int i = 1;
        while (i < n - 1) {
            if (counts[i] > counts[i - 1]) {
                int ahead = i + 1;
                while (ahead < n - 1 && counts[ahead] == counts[i]) ahead++;
                if (counts[ahead] < counts[i]) {
                    // plateau maxima report their middle sample
                    candidates.add((i + ahead - 1) / 2);
                    i = ahead;
                    continue;
                }
            }
            i++;
        }

        if (minHeight != null) {
            candidates.removeIf(c -> counts[c] < minHeight);
        }

        // higher peaks claim their neighbourhood first
        List<Integer> byHeight = new ArrayList<>(candidates);
        byHeight.sort(Comparator.comparingDouble((Integer c) -> counts[c]).reversed());
        boolean[] removed = new boolean[n];
        List<Integer> kept = new ArrayList<>();
        for (int c : byHeight) {
            if (removed[c]) continue;
            kept.add(c);
            for (int other : candidates) {
                if (other != c && Math.abs(other - c) < distance) removed[other] = true;
            }
        }
        kept.sort(Comparator.naturalOrder());

        List<DetectedPeak> peaks = new ArrayList<>();
        for (int c : kept) {
            double p = prominence(counts, c);
            if (p >= minProminence) {
                peaks.add(new DetectedPeak(c, energy[c], counts[c], p));
            }
        }
        return peaks;
    }

    static double prominence(double[] counts, int peak) {
        double h = counts[peak];
        double leftMin = h;
        for (int j = peak - 1; j >= 0 && counts[j] <= h; j--) {
            leftMin = Math.min(leftMin, counts[j]);
        }
        double rightMin = h;
        for (int j = peak + 1; j < counts.length && counts[j] <= h; j++) {
            rightMin = Math.min(rightMin, counts[j]);
        }
        return h - Math.max(leftMin, rightMin);
    }
}
