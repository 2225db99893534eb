package org.tims.source;

/**
 * Names of the metadata tables consulted during conversion.
 */
public final class Tables {
    public static final String FRAMES = "Frames";
    public static final String PRECURSORS = "Precursors";
    public static final String PASEF_FRAME_MSMS_INFO = "PasefFrameMsMsInfo";
    public static final String DIA_FRAME_MSMS_INFO = "DiaFrameMsMsInfo";
    public static final String DIA_FRAME_MSMS_WINDOWS = "DiaFrameMsMsWindows";
    public static final String PRM_FRAME_MSMS_INFO = "PrmFrameMsMsInfo";
    public static final String PRM_TARGETS = "PrmTargets";
    public static final String FRAME_MSMS_INFO = "FrameMsMsInfo";
    public static final String MALDI_FRAME_INFO = "MaldiFrameInfo";

    // BAF (analysis.sqlite)
    public static final String SPECTRA = "Spectra";
    public static final String ACQUISITION_KEYS = "AcquisitionKeys";
    public static final String STEPS = "Steps";
    public static final String VARIABLES = "Variables";

    private Tables() {
    }
}
