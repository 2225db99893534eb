package org.tims.io;

import java.util.Locale;

/**
 * Storage mode of an imzML binary file.
 */
public enum ImzMLMode {
    /** One m/z array per spectrum. */
    PROCESSED("IMS:1000031", "processed"),
    /** A single m/z array shared by all spectra. */
    CONTINUOUS("IMS:1000030", "continuous");

    private final String accession;
    private final String cvName;

    ImzMLMode(String accession, String cvName) {
        this.accession = accession;
        this.cvName = cvName;
    }

    public String getAccession() { return accession; }
    public String getCvName() { return cvName; }

    public static ImzMLMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
