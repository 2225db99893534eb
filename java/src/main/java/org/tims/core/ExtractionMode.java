package org.tims.core;

import java.util.Locale;

/**
 * Resolution at which spectra are decoded from a frame.
 */
public enum ExtractionMode {
    RAW,
    CENTROID,
    PROFILE;

    /**
     * Raw data is written with centroid semantics.
     */
    public SpectrumType getSpectrumType() {
        return this == PROFILE ? SpectrumType.PROFILE : SpectrumType.CENTROID;
    }

    public boolean isCentroided() {
        return this != PROFILE;
    }

    public static ExtractionMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
