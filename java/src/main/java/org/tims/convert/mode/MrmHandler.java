package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.Tables;

/**
 * MRM frames: targeted MS/MS without a parent frame, always written without mobility.
 */
public class MrmHandler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        ScanRecordBuilder builder = context.getRecordBuilder();
        Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.MRM)
            .precursor(builder.frameMsMsPrecursor(builder.single(Tables.FRAME_MSMS_INFO, "Frame", frame.getId())));
        builder.complete(record, context.getExtractor().extract(frame, 0, frame.getNumScans(), false))
            .ifPresent(accumulator::addStandalone);
    }
}
