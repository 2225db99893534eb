package org.tims.io;

import java.util.Locale;

/**
 * Compression applied to binary data arrays.
 */
public enum Compression {
    ZLIB("MS:1000574", "zlib compression"),
    NONE("MS:1000576", "no compression");

    private final String accession;
    private final String cvName;

    Compression(String accession, String cvName) {
        this.accession = accession;
        this.cvName = cvName;
    }

    public String getAccession() { return accession; }
    public String getCvName() { return cvName; }

    public static Compression parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
