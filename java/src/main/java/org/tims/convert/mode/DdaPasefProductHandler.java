package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.WindowAccumulator;
import org.tims.source.FrameInfo;

/**
 * PASEF fragment frames. Their data is read through the precursors of the parent
 * frame, so they emit nothing themselves.
 */
public class DdaPasefProductHandler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return 0;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        // read through DdaPasefPrecursorHandler
    }
}
