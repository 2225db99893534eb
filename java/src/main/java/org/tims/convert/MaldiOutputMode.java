package org.tims.convert;

import java.util.Locale;

/**
 * Grouping of MALDI single-spectra acquisitions into output files.
 */
public enum MaldiOutputMode {
    /** All spots in one file. */
    COMBINED,
    /** One file per spot, named after its plate-map label. */
    INDIVIDUAL,
    /** One file per plate-map label. */
    SAMPLE;

    public boolean requiresPlateMap() {
        return this != COMBINED;
    }

    public static MaldiOutputMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
