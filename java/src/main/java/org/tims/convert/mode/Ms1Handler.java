package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;

/**
 * MS1 frames, skipped when only MS/MS spectra are requested.
 */
public class Ms1Handler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return context.getOptions().isMs2Only() ? 0 : 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        if (context.getOptions().isMs2Only()) {
            return;
        }
        ScanRecordBuilder builder = context.getRecordBuilder();
        Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.MS1);
        builder.complete(record, context.getExtractor().extract(frame))
            .ifPresent(accumulator::addParent);
    }
}
