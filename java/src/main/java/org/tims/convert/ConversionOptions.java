package org.tims.convert;

import org.tims.core.ExtractionMode;
import org.tims.core.Schema;
import org.tims.io.Compression;
import org.tims.io.ImzMLMode;

import java.nio.file.Path;

/**
 * Immutable settings of one conversion run.
 */
public final class ConversionOptions {
    public static final int DEFAULT_CHUNK_SIZE = 10;

    private final ExtractionMode extractionMode;
    private final boolean ms2Only;
    private final boolean excludeMobility;
    private final int profileBins;
    private final int encoding;
    private final Compression compression;
    private final int chunkSize;
    private final MaldiOutputMode maldiOutputMode;
    private final Path plateMap;
    private final ImzMLMode imzmlMode;
    private final int bafPositivePolarityCode;
    private final boolean barebonesMetadata;

    private ConversionOptions(Builder b) {
        this.extractionMode = b.extractionMode;
        this.ms2Only = b.ms2Only;
        this.excludeMobility = b.excludeMobility;
        this.profileBins = b.profileBins;
        this.encoding = b.encoding;
        this.compression = b.compression;
        this.chunkSize = b.chunkSize;
        this.maldiOutputMode = b.maldiOutputMode;
        this.plateMap = b.plateMap;
        this.imzmlMode = b.imzmlMode;
        this.bafPositivePolarityCode = b.bafPositivePolarityCode;
        this.barebonesMetadata = b.barebonesMetadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.extractionMode = extractionMode;
        b.ms2Only = ms2Only;
        b.excludeMobility = excludeMobility;
        b.profileBins = profileBins;
        b.encoding = encoding;
        b.compression = compression;
        b.chunkSize = chunkSize;
        b.maldiOutputMode = maldiOutputMode;
        b.plateMap = plateMap;
        b.imzmlMode = imzmlMode;
        b.bafPositivePolarityCode = bafPositivePolarityCode;
        b.barebonesMetadata = barebonesMetadata;
        return b;
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public ExtractionMode getExtractionMode() { return extractionMode; }
    public boolean isMs2Only() { return ms2Only; }
    public boolean isExcludeMobility() { return excludeMobility; }
    public int getProfileBins() { return profileBins; }
    public int getEncoding() { return encoding; }
    public Compression getCompression() { return compression; }
    public int getChunkSize() { return chunkSize; }
    public MaldiOutputMode getMaldiOutputMode() { return maldiOutputMode; }
    public Path getPlateMap() { return plateMap; }
    public ImzMLMode getImzmlMode() { return imzmlMode; }
    public int getBafPositivePolarityCode() { return bafPositivePolarityCode; }
    public boolean isBarebonesMetadata() { return barebonesMetadata; }

    /**
     * Whether spectra of the given schema are written without a mobility array.
     * Profile extraction never carries mobility, and only TDF data has any.
     */
    public boolean isMobilityExcluded(Schema schema) {
        return excludeMobility || extractionMode == ExtractionMode.PROFILE || !schema.hasMobility();
    }

    @Override
    public String toString() {
        return String.format("ConversionOptions(mode=%s, ms2Only=%s, excludeMobility=%s, profileBins=%d, "
                + "encoding=%d, compression=%s, chunkSize=%d, maldiOutput=%s)",
            extractionMode, ms2Only, excludeMobility, profileBins, encoding, compression, chunkSize,
            maldiOutputMode);
    }

    public static final class Builder {
        private ExtractionMode extractionMode = ExtractionMode.CENTROID;
        private boolean ms2Only;
        private boolean excludeMobility;
        private int profileBins;
        private int encoding = 64;
        private Compression compression = Compression.ZLIB;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private MaldiOutputMode maldiOutputMode = MaldiOutputMode.COMBINED;
        private Path plateMap;
        private ImzMLMode imzmlMode = ImzMLMode.PROCESSED;
        private int bafPositivePolarityCode;
        private boolean barebonesMetadata;

        private Builder() {
        }

        public Builder extractionMode(ExtractionMode mode) { this.extractionMode = mode; return this; }
        public Builder ms2Only(boolean ms2Only) { this.ms2Only = ms2Only; return this; }
        public Builder excludeMobility(boolean exclude) { this.excludeMobility = exclude; return this; }
        public Builder profileBins(int bins) { this.profileBins = bins; return this; }
        public Builder encoding(int encoding) { this.encoding = encoding; return this; }
        public Builder compression(Compression compression) { this.compression = compression; return this; }
        public Builder chunkSize(int chunkSize) { this.chunkSize = chunkSize; return this; }
        public Builder maldiOutputMode(MaldiOutputMode mode) { this.maldiOutputMode = mode; return this; }
        public Builder plateMap(Path plateMap) { this.plateMap = plateMap; return this; }
        public Builder imzmlMode(ImzMLMode mode) { this.imzmlMode = mode; return this; }
        public Builder bafPositivePolarityCode(int code) { this.bafPositivePolarityCode = code; return this; }
        public Builder barebonesMetadata(boolean barebones) { this.barebonesMetadata = barebones; return this; }

        public ConversionOptions build() {
            if (extractionMode == null) {
                throw new IllegalArgumentException("Extraction mode is required");
            }
            if (encoding != 32 && encoding != 64) {
                throw new IllegalArgumentException("Encoding must be 32 or 64, got " + encoding);
            }
            if (profileBins < 0) {
                throw new IllegalArgumentException("Profile bin count must not be negative, got " + profileBins);
            }
            if (chunkSize < 1) {
                throw new IllegalArgumentException("Chunk size must be at least 1, got " + chunkSize);
            }
            if (compression == null || maldiOutputMode == null || imzmlMode == null) {
                throw new IllegalArgumentException("Compression, MALDI output mode and imzML mode are required");
            }
            return new ConversionOptions(this);
        }
    }
}
