package org.tims.convert;

import java.util.Arrays;

/**
 * Re-bins non-uniformly spaced m/z data onto a grid of bin edges.
 * <p>
 * A point at {@code x} falls into bin {@code k}, the number of edges {@code <= x}
 * (right-open digitization). Only occupied bins produce output, in ascending bin
 * order. The m/z of a bin is the intensity-weighted mean of its members (the
 * arithmetic mean when their intensities sum to zero) and its intensity is the
 * sum of member intensities.
 */
public final class SpectrumBinner {

    /** Bin width used to merge the isolation windows of a ddaPASEF precursor. */
    public static final double PASEF_MERGE_BIN_WIDTH = 0.005;

    private SpectrumBinner() {
    }

    /**
     * {@code count} evenly spaced edges from {@code lower} to {@code upper} inclusive.
     */
    public static double[] linearEdges(double lower, double upper, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Bin count must be positive, got " + count);
        }
        double[] edges = new double[count];
        if (count == 1) {
            edges[0] = lower;
            return edges;
        }
        double step = (upper - lower) / (count - 1);
        for (int i = 0; i < count; i++) {
            edges[i] = lower + i * step;
        }
        edges[count - 1] = upper;
        return edges;
    }

    /**
     * Edges {@code lower, lower + width, ...} strictly below {@code upper}.
     */
    public static double[] fixedWidthEdges(double lower, double upper, double width) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("Bin width must be positive, got " + width);
        }
        int count = upper > lower ? (int) Math.ceil((upper - lower) / width) : 0;
        double[] edges = new double[count];
        for (int i = 0; i < count; i++) {
            edges[i] = lower + i * width;
        }
        return edges;
    }

    /**
     * Index of the bin that {@code x} falls into.
     */
    public static int digitize(double x, double[] edges) {
        int low = 0;
        int high = edges.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (edges[mid] <= x) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Bins the spectrum into {@code binCount} bins spanning its own m/z range.
     */
    public static ExtractionResult binToCount(double[] mz, double[] intensity, int binCount) {
        if (binCount <= 0) {
            throw new IllegalArgumentException("Bin count must be positive, got " + binCount);
        }
        if (mz.length == 0) {
            return ExtractionResult.empty();
        }
        double lower = Arrays.stream(mz).min().getAsDouble();
        double upper = Arrays.stream(mz).max().getAsDouble();
        return bin(mz, intensity, linearEdges(lower, upper, binCount));
    }

    /**
     * Bins the spectrum into fixed-width bins over an acquisition m/z range.
     */
    public static ExtractionResult binToWidth(double[] mz, double[] intensity,
                                              double lower, double upper, double width) {
        return bin(mz, intensity, fixedWidthEdges(lower, upper, width));
    }

    public static ExtractionResult bin(double[] mz, double[] intensity, double[] edges) {
        if (mz.length != intensity.length) {
            throw new IllegalArgumentException("m/z and intensity arrays must have same length");
        }
        if (mz.length == 0) {
            return ExtractionResult.empty();
        }

        int binSlots = edges.length + 1;
        int[] counts = new int[binSlots];
        double[] mzSum = new double[binSlots];
        double[] weightedMzSum = new double[binSlots];
        double[] intensitySum = new double[binSlots];
        double[] mzLow = new double[binSlots];
        double[] mzHigh = new double[binSlots];

        int occupied = 0;
        for (int i = 0; i < mz.length; i++) {
            int k = digitize(mz[i], edges);
            if (counts[k] == 0) {
                occupied++;
                mzLow[k] = mz[i];
                mzHigh[k] = mz[i];
            } else {
                mzLow[k] = Math.min(mzLow[k], mz[i]);
                mzHigh[k] = Math.max(mzHigh[k], mz[i]);
            }
            counts[k]++;
            mzSum[k] += mz[i];
            weightedMzSum[k] += mz[i] * intensity[i];
            intensitySum[k] += intensity[i];
        }

        double[] binnedMz = new double[occupied];
        double[] binnedIntensity = new double[occupied];
        int j = 0;
        for (int k = 0; k < binSlots; k++) {
            if (counts[k] == 0) continue;
            double value;
            if (counts[k] == 1) {
                value = mzLow[k];
            } else if (intensitySum[k] != 0) {
                value = weightedMzSum[k] / intensitySum[k];
            } else {
                value = mzSum[k] / Math.max(counts[k], 1);
            }
            // keep the mean inside its bin
            binnedMz[j] = Math.min(Math.max(value, mzLow[k]), mzHigh[k]);
            binnedIntensity[j] = intensitySum[k];
            j++;
        }
        return ExtractionResult.of(binnedMz, binnedIntensity);
    }

    /**
     * Sorts points by m/z and sums the intensities of equal m/z values, so that the
     * result is strictly ascending.
     */
    public static ExtractionResult collapse(double[] mz, double[] intensity) {
        if (mz.length != intensity.length) {
            throw new IllegalArgumentException("m/z and intensity arrays must have same length");
        }
        if (mz.length == 0) {
            return ExtractionResult.empty();
        }
        Integer[] order = new Integer[mz.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(mz[a], mz[b]));

        double[] outMz = new double[mz.length];
        double[] outIntensity = new double[mz.length];
        int n = 0;
        for (Integer idx : order) {
            if (n > 0 && outMz[n - 1] == mz[idx]) {
                outIntensity[n - 1] += intensity[idx];
            } else {
                outMz[n] = mz[idx];
                outIntensity[n] = intensity[idx];
                n++;
            }
        }
        return ExtractionResult.of(Arrays.copyOf(outMz, n), Arrays.copyOf(outIntensity, n));
    }
}
