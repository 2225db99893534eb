package org.tims.convert;

/**
 * Decoded arrays of one spectrum, or the explicit absence of data.
 * <p>
 * A populated result always holds equal-length, non-empty m/z and intensity
 * arrays; the mobility array is present only for mobility-resolved extraction.
 */
public final class ExtractionResult {
    private static final ExtractionResult EMPTY = new ExtractionResult(new double[0], new double[0], null);

    private final double[] mz;
    private final double[] intensity;
    private final double[] mobility;

    private ExtractionResult(double[] mz, double[] intensity, double[] mobility) {
        this.mz = mz;
        this.intensity = intensity;
        this.mobility = mobility;
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    /**
     * Result for the given arrays; empty or length-mismatched arrays yield {@link #empty()}.
     */
    public static ExtractionResult of(double[] mz, double[] intensity) {
        return of(mz, intensity, null);
    }

    public static ExtractionResult of(double[] mz, double[] intensity, double[] mobility) {
        if (mz == null || intensity == null || mz.length == 0 || mz.length != intensity.length) {
            return EMPTY;
        }
        if (mobility != null && mobility.length != mz.length) {
            return EMPTY;
        }
        return new ExtractionResult(mz, intensity, mobility);
    }

    public boolean isEmpty() {
        return mz.length == 0;
    }

    public int size() {
        return mz.length;
    }

    public double[] getMz() { return mz; }
    public double[] getIntensity() { return intensity; }
    public double[] getMobility() { return mobility; }
    public boolean hasMobility() { return mobility != null; }
}
