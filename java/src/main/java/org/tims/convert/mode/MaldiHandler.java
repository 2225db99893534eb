package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.Tables;

/**
 * MALDI frames, positioned by spot or pixel. MS/MS frames carry their FrameMsMsInfo
 * precursor; none of them link to a parent.
 */
public class MaldiHandler implements ModeHandler {
    private final AcquisitionMode mode;

    public MaldiHandler(AcquisitionMode mode) {
        if (!mode.isMaldi()) {
            throw new IllegalArgumentException(mode + " is not a MALDI mode");
        }
        this.mode = mode;
    }

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        if (mode.getMsLevel() == 1 && context.getOptions().isMs2Only()) {
            return 0;
        }
        return 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        if (expectedCount(frame, context) == 0) {
            return;
        }
        ScanRecordBuilder builder = context.getRecordBuilder();
        Spectrum.Builder record = builder.newMaldiRecord(frame, mode);
        if (mode == AcquisitionMode.MALDI_MS2) {
            record.precursor(builder.frameMsMsPrecursor(
                builder.single(Tables.FRAME_MSMS_INFO, "Frame", frame.getId())));
        }
        builder.complete(record, context.getExtractor().extract(frame))
            .ifPresent(accumulator::addStandalone);
    }
}
