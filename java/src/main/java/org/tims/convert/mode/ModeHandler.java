package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.WindowAccumulator;
import org.tims.source.FrameInfo;

/**
 * Population strategy of one acquisition mode.
 */
public interface ModeHandler {

    /**
     * Upper bound of the spectra {@link #process} can emit for the frame, from
     * metadata alone.
     */
    int expectedCount(FrameInfo frame, ConversionContext context);

    /**
     * Builds the spectra of a frame into the window accumulator. Frames that
     * decode to no data add nothing.
     */
    void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator);
}
