package org.tims.core;

/**
 * A mass spectrum with m/z and intensity data, normalized from one frame (or one
 * isolation window of a frame) of an acquisition.
 * <p>
 * Instances are immutable. The scan number and the reference to the parent
 * spectrum are assigned at emission time through {@link #withEmission(int, Integer)}.
 * <p>
 * Without a mobility array, m/z values are strictly ascending. With one, points are
 * ordered by m/z, then mobility, and no (m/z, mobility, intensity) point appears
 * twice; the same m/z may repeat at different mobilities.
 */
public final class Spectrum {
    private final double[] mz;
    private final double[] intensity;
    private final double[] mobility;
    private final int scanNumber;
    private final Integer parentScanNumber;
    private final int frame;
    private final Integer parentFrame;
    private final Integer parentScan;
    private final int msLevel;
    private final String scanType;
    private final SpectrumType type;
    private final Polarity polarity;
    private final double retentionTime;
    private final SpotCoordinate coordinate;
    private final Precursor precursor;
    private final boolean ms2NoPrecursor;

    // Cached statistics
    private final double tic;
    private final double basePeakIntensity;
    private final double basePeakMz;
    private final double mzMin;
    private final double mzMax;

    private Spectrum(Builder b) {
        if (b.mz.length != b.intensity.length) {
            throw new IllegalArgumentException("m/z and intensity arrays must have same length");
        }
        if (b.mobility != null && b.mobility.length != b.mz.length) {
            throw new IllegalArgumentException("mobility array must have same length as m/z array");
        }
        this.mz = b.mz;
        this.intensity = b.intensity;
        this.mobility = b.mobility;
        this.scanNumber = b.scanNumber;
        this.parentScanNumber = b.parentScanNumber;
        this.frame = b.frame;
        this.parentFrame = b.parentFrame;
        this.parentScan = b.parentScan;
        this.msLevel = b.msLevel;
        this.scanType = b.scanType != null ? b.scanType : (b.msLevel == 1 ? "MS1 spectrum" : "MSn spectrum");
        this.type = b.type;
        this.polarity = b.polarity;
        this.retentionTime = b.retentionTime;
        this.coordinate = b.coordinate;
        this.precursor = b.precursor;
        this.ms2NoPrecursor = b.ms2NoPrecursor;

        double sum = 0;
        double maxIntensity = Double.NEGATIVE_INFINITY;
        double maxMz = 0;
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < mz.length; i++) {
            sum += intensity[i];
            if (intensity[i] > maxIntensity) {
                maxIntensity = intensity[i];
                maxMz = mz[i];
            }
            if (mz[i] < low) low = mz[i];
            if (mz[i] > high) high = mz[i];
        }
        if (mz.length == 0) {
            this.tic = 0;
            this.basePeakIntensity = 0;
            this.basePeakMz = 0;
            this.mzMin = 0;
            this.mzMax = 0;
        } else {
            this.tic = sum;
            this.basePeakIntensity = maxIntensity;
            this.basePeakMz = maxMz;
            this.mzMin = low;
            this.mzMax = high;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this spectrum carrying its position in the output.
     */
    public Spectrum withEmission(int scanNumber, Integer parentScanNumber) {
        Builder b = toBuilder();
        b.scanNumber = scanNumber;
        b.parentScanNumber = parentScanNumber;
        return new Spectrum(b);
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.mz = mz;
        b.intensity = intensity;
        b.mobility = mobility;
        b.scanNumber = scanNumber;
        b.parentScanNumber = parentScanNumber;
        b.frame = frame;
        b.parentFrame = parentFrame;
        b.parentScan = parentScan;
        b.msLevel = msLevel;
        b.scanType = scanType;
        b.type = type;
        b.polarity = polarity;
        b.retentionTime = retentionTime;
        b.coordinate = coordinate;
        b.precursor = precursor;
        b.ms2NoPrecursor = ms2NoPrecursor;
        return b;
    }

    // Getters
    public int size() { return mz.length; }
    public boolean isEmpty() { return mz.length == 0; }

    public double[] getMz() { return mz; }
    public double[] getIntensity() { return intensity; }
    public double[] getMobility() { return mobility; }
    public boolean hasMobility() { return mobility != null; }

    public double getMzAt(int i) { return mz[i]; }
    public double getIntensityAt(int i) { return intensity[i]; }

    public int getScanNumber() { return scanNumber; }
    public Integer getParentScanNumber() { return parentScanNumber; }

    public String getNativeId() {
        return "scan=" + scanNumber;
    }

    public int getFrame() { return frame; }
    public Integer getParentFrame() { return parentFrame; }
    public Integer getParentScan() { return parentScan; }

    public int getMsLevel() { return msLevel; }
    public String getScanType() { return scanType; }
    public SpectrumType getType() { return type; }
    public boolean isCentroided() { return type == SpectrumType.CENTROID; }
    public Polarity getPolarity() { return polarity; }

    /** Retention time in minutes. */
    public double getRetentionTime() { return retentionTime; }

    public SpotCoordinate getCoordinate() { return coordinate; }
    public Precursor getPrecursor() { return precursor; }
    public boolean isMs2NoPrecursor() { return ms2NoPrecursor; }

    public double getTic() { return tic; }
    public double getBasePeakIntensity() { return basePeakIntensity; }
    public double getBasePeakMz() { return basePeakMz; }
    public double getMzMin() { return mzMin; }
    public double getMzMax() { return mzMax; }

    /**
     * Check if spectrum is sorted by m/z.
     */
    public boolean isSorted() {
        for (int i = 1; i < mz.length; i++) {
            if (mz[i] < mz[i-1]) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("Spectrum(scan=%d, frame=%d, size=%d, msLevel=%d, rt=%.4fmin, mz=[%.2f, %.2f])",
            scanNumber, frame, size(), msLevel, retentionTime, mzMin, mzMax);
    }

    public static final class Builder {
        private double[] mz = new double[0];
        private double[] intensity = new double[0];
        private double[] mobility;
        private int scanNumber;
        private Integer parentScanNumber;
        private int frame;
        private Integer parentFrame;
        private Integer parentScan;
        private int msLevel = 1;
        private String scanType;
        private SpectrumType type = SpectrumType.CENTROID;
        private Polarity polarity = Polarity.UNKNOWN;
        private double retentionTime;
        private SpotCoordinate coordinate;
        private Precursor precursor;
        private boolean ms2NoPrecursor;

        private Builder() {
        }

        public Builder data(double[] mz, double[] intensity) {
            this.mz = mz.clone();
            this.intensity = intensity.clone();
            return this;
        }

        public Builder mobility(double[] mobility) {
            this.mobility = mobility == null ? null : mobility.clone();
            return this;
        }

        public Builder scanNumber(int scanNumber) { this.scanNumber = scanNumber; return this; }
        public Builder parentScanNumber(Integer parentScanNumber) { this.parentScanNumber = parentScanNumber; return this; }
        public Builder frame(int frame) { this.frame = frame; return this; }
        public Builder parentFrame(Integer parentFrame) { this.parentFrame = parentFrame; return this; }
        public Builder parentScan(Integer parentScan) { this.parentScan = parentScan; return this; }
        public Builder msLevel(int msLevel) { this.msLevel = msLevel; return this; }
        public Builder scanType(String scanType) { this.scanType = scanType; return this; }
        public Builder type(SpectrumType type) { this.type = type; return this; }
        public Builder polarity(Polarity polarity) { this.polarity = polarity; return this; }
        public Builder retentionTime(double minutes) { this.retentionTime = minutes; return this; }
        public Builder coordinate(SpotCoordinate coordinate) { this.coordinate = coordinate; return this; }
        public Builder precursor(Precursor precursor) { this.precursor = precursor; return this; }
        public Builder ms2NoPrecursor(boolean ms2NoPrecursor) { this.ms2NoPrecursor = ms2NoPrecursor; return this; }

        public int getFrame() { return frame; }
        public int getMsLevel() { return msLevel; }

        public Spectrum build() {
            return new Spectrum(this);
        }
    }
}
