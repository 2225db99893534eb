package org.tims.core;

/**
 * Source file schema of an acquisition.
 */
public enum Schema {
    /** Mobility-resolved frames (analysis.tdf). */
    TDF("MS:1002817", "Bruker TDF format", "MS:1002818", "Bruker TDF nativeID format"),
    /** Frames without mobility separation (analysis.tsf). */
    TSF("MS:1003282", "Bruker TSF format", "MS:1003283", "Bruker TSF nativeID format"),
    /** Legacy spectra (analysis.baf). */
    BAF("MS:1000815", "Bruker BAF format", "MS:1000772", "Bruker BAF nativeID format");

    private final String fileFormatAccession;
    private final String fileFormatName;
    private final String nativeIdAccession;
    private final String nativeIdName;

    Schema(String fileFormatAccession, String fileFormatName,
           String nativeIdAccession, String nativeIdName) {
        this.fileFormatAccession = fileFormatAccession;
        this.fileFormatName = fileFormatName;
        this.nativeIdAccession = nativeIdAccession;
        this.nativeIdName = nativeIdName;
    }

    public boolean hasMobility() {
        return this == TDF;
    }

    public String getFileFormatAccession() { return fileFormatAccession; }
    public String getFileFormatName() { return fileFormatName; }
    public String getNativeIdAccession() { return nativeIdAccession; }
    public String getNativeIdName() { return nativeIdName; }
}
