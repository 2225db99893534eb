package org.tims.convert.mode;

import org.tims.core.AcquisitionMode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of the population strategy for every acquisition mode.
 */
public final class ModeHandlers {
    private static final Map<AcquisitionMode, ModeHandler> HANDLERS;

    static {
        Map<AcquisitionMode, ModeHandler> handlers = new EnumMap<>(AcquisitionMode.class);
        handlers.put(AcquisitionMode.MS1, new Ms1Handler());
        handlers.put(AcquisitionMode.DDA_PASEF_PRECURSOR, new DdaPasefPrecursorHandler());
        handlers.put(AcquisitionMode.DDA_PASEF_PRODUCT, new DdaPasefProductHandler());
        handlers.put(AcquisitionMode.DIA_PASEF, new DiaPasefHandler());
        handlers.put(AcquisitionMode.PRM_PASEF, new PrmPasefHandler());
        handlers.put(AcquisitionMode.BBCID, new NoPrecursorMs2Handler(AcquisitionMode.BBCID));
        handlers.put(AcquisitionMode.ISCID, new NoPrecursorMs2Handler(AcquisitionMode.ISCID));
        handlers.put(AcquisitionMode.MRM, new MrmHandler());
        handlers.put(AcquisitionMode.AUTO_MSMS, new AutoMsMsHandler());
        handlers.put(AcquisitionMode.MALDI_MS1, new MaldiHandler(AcquisitionMode.MALDI_MS1));
        handlers.put(AcquisitionMode.MALDI_MS2, new MaldiHandler(AcquisitionMode.MALDI_MS2));
        HANDLERS = Collections.unmodifiableMap(handlers);
    }

    private ModeHandlers() {
    }

    public static ModeHandler forMode(AcquisitionMode mode) {
        ModeHandler handler = HANDLERS.get(mode);
        if (handler == null) {
            throw new IllegalStateException("No handler for acquisition mode " + mode);
        }
        return handler;
    }
}
