package org.tims.source;

/**
 * Calibrated m/z and intensity arrays as returned by a source decode call.
 */
public final class PeakList {
    private final double[] mz;
    private final double[] intensities;

    public PeakList(double[] mz, double[] intensities) {
        this.mz = mz;
        this.intensities = intensities;
    }

    public double[] getMz() { return mz; }
    public double[] getIntensities() { return intensities; }

    public boolean isUsable() {
        return mz.length != 0 && intensities.length != 0 && mz.length == intensities.length;
    }
}
