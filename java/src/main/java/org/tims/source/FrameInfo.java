package org.tims.source;

/**
 * Acquisition metadata of one frame.
 * <p>
 * For BAF sources the scan mode and polarity code are those of the spectrum's
 * acquisition key, and the MS/MS type is always 0.
 */
public final class FrameInfo {
    private final int id;
    private final int scanMode;
    private final int msmsType;
    private final String polarityCode;
    private final double retentionTimeSeconds;
    private final int numScans;
    private final TableRow row;

    public FrameInfo(int id, int scanMode, int msmsType, String polarityCode,
                     double retentionTimeSeconds, int numScans, TableRow row) {
        this.id = id;
        this.scanMode = scanMode;
        this.msmsType = msmsType;
        this.polarityCode = polarityCode;
        this.retentionTimeSeconds = retentionTimeSeconds;
        this.numScans = numScans;
        this.row = row;
    }

    public int getId() { return id; }
    public int getScanMode() { return scanMode; }
    public int getMsmsType() { return msmsType; }
    public String getPolarityCode() { return polarityCode; }
    public double getRetentionTimeSeconds() { return retentionTimeSeconds; }

    /** Number of mobility sub-scans in the frame (1 for sources without mobility). */
    public int getNumScans() { return numScans; }

    /** The raw frame (or BAF spectrum) row. */
    public TableRow getRow() { return row; }

    @Override
    public String toString() {
        return String.format("Frame(id=%d, scanMode=%d, msmsType=%d)", id, scanMode, msmsType);
    }
}
