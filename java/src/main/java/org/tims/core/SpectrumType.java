package org.tims.core;

/**
 * Spectral representation of a spectrum's data arrays.
 */
public enum SpectrumType {
    CENTROID("MS:1000127", "centroid spectrum"),
    PROFILE("MS:1000128", "profile spectrum");

    private final String accession;
    private final String cvName;

    SpectrumType(String accession, String cvName) {
        this.accession = accession;
        this.cvName = cvName;
    }

    public String getAccession() { return accession; }
    public String getCvName() { return cvName; }
}
