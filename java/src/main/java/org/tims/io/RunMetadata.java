package org.tims.io;

import org.tims.core.Schema;
import org.tims.core.SpectrumType;

import java.nio.file.Path;

/**
 * Run-level description written ahead of the spectra: file content, source file,
 * software and instrument configuration.
 */
public final class RunMetadata {
    private final Path sourcePath;
    private final Schema schema;
    private final boolean includesMs1;
    private final SpectrumType spectrumType;
    private final String acquisitionSoftware;
    private final String acquisitionSoftwareVersion;
    private final String instrumentSourceType;
    private final boolean maldi;

    private RunMetadata(Builder b) {
        this.sourcePath = b.sourcePath;
        this.schema = b.schema;
        this.includesMs1 = b.includesMs1;
        this.spectrumType = b.spectrumType;
        this.acquisitionSoftware = b.acquisitionSoftware;
        this.acquisitionSoftwareVersion = b.acquisitionSoftwareVersion;
        this.instrumentSourceType = b.instrumentSourceType;
        this.maldi = b.maldi;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getSourcePath() { return sourcePath; }
    public Schema getSchema() { return schema; }
    public boolean includesMs1() { return includesMs1; }
    public SpectrumType getSpectrumType() { return spectrumType; }

    /** Null when acquisition software details are omitted. */
    public String getAcquisitionSoftware() { return acquisitionSoftware; }
    public String getAcquisitionSoftwareVersion() { return acquisitionSoftwareVersion; }
    public boolean hasAcquisitionSoftware() { return acquisitionSoftware != null; }

    public String getInstrumentSourceType() { return instrumentSourceType; }
    public boolean isMaldi() { return maldi; }

    /**
     * Ion source CV term as {accession, name}.
     */
    public String[] getIonSourceTerm() {
        if (maldi) {
            return new String[]{"MS:1000075", "matrix-assisted laser desorption ionization"};
        }
        String code = instrumentSourceType == null ? "" : instrumentSourceType.trim();
        switch (code) {
            case "2":
                return new String[]{"MS:1000070", "atmospheric pressure chemical ionization"};
            case "3":
                return new String[]{"MS:1000398", "nanoelectrospray"};
            case "5":
                return new String[]{"MS:1000382", "atmospheric pressure photoionization"};
            case "1":
            default:
                return new String[]{"MS:1000073", "electrospray ionization"};
        }
    }

    public static final class Builder {
        private Path sourcePath;
        private Schema schema = Schema.TDF;
        private boolean includesMs1 = true;
        private SpectrumType spectrumType = SpectrumType.CENTROID;
        private String acquisitionSoftware;
        private String acquisitionSoftwareVersion;
        private String instrumentSourceType;
        private boolean maldi;

        private Builder() {
        }

        public Builder sourcePath(Path sourcePath) { this.sourcePath = sourcePath; return this; }
        public Builder schema(Schema schema) { this.schema = schema; return this; }
        public Builder includesMs1(boolean includesMs1) { this.includesMs1 = includesMs1; return this; }
        public Builder spectrumType(SpectrumType type) { this.spectrumType = type; return this; }
        public Builder acquisitionSoftware(String name, String version) {
            this.acquisitionSoftware = name;
            this.acquisitionSoftwareVersion = version;
            return this;
        }
        public Builder instrumentSourceType(String code) { this.instrumentSourceType = code; return this; }
        public Builder maldi(boolean maldi) { this.maldi = maldi; return this; }

        public RunMetadata build() {
            if (sourcePath == null) {
                throw new IllegalArgumentException("Source path is required");
            }
            return new RunMetadata(this);
        }
    }
}
