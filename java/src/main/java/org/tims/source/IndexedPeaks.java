package org.tims.source;

/**
 * Peaks in instrument index units, as read from a frame before m/z calibration.
 */
public final class IndexedPeaks {
    private static final IndexedPeaks EMPTY = new IndexedPeaks(new double[0], new double[0]);

    private final double[] indices;
    private final double[] intensities;

    public IndexedPeaks(double[] indices, double[] intensities) {
        this.indices = indices;
        this.intensities = intensities;
    }

    public static IndexedPeaks empty() {
        return EMPTY;
    }

    public double[] getIndices() { return indices; }
    public double[] getIntensities() { return intensities; }

    public int size() {
        return indices.length;
    }

    /**
     * Non-empty with one intensity per index.
     */
    public boolean isUsable() {
        return indices.length != 0 && intensities.length != 0 && indices.length == intensities.length;
    }
}
