package org.tims.core;

/**
 * Acquisition mode of a single frame, as resolved from its scan mode and MS/MS type codes.
 */
public enum AcquisitionMode {
    MS1(1, false),
    /** MS1 frame that also owns ddaPASEF precursors. */
    DDA_PASEF_PRECURSOR(1, false),
    /** PASEF fragment frame, read through the precursor tables of its parent. */
    DDA_PASEF_PRODUCT(2, false),
    DIA_PASEF(2, false),
    PRM_PASEF(2, false),
    BBCID(2, true),
    ISCID(2, true),
    MRM(2, false),
    /** Data-dependent MS/MS linked to a parent frame through metadata. */
    AUTO_MSMS(2, false),
    MALDI_MS1(1, false),
    MALDI_MS2(2, false);

    private final int msLevel;
    private final boolean withoutPrecursor;

    AcquisitionMode(int msLevel, boolean withoutPrecursor) {
        this.msLevel = msLevel;
        this.withoutPrecursor = withoutPrecursor;
    }

    public int getMsLevel() {
        return msLevel;
    }

    /**
     * Whether spectra of this mode are fragment spectra without a resolvable precursor ion.
     */
    public boolean isWithoutPrecursor() {
        return withoutPrecursor;
    }

    public boolean isMaldi() {
        return this == MALDI_MS1 || this == MALDI_MS2;
    }
}
