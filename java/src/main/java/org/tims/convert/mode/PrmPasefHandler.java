package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

/**
 * prmPASEF frames, always written without mobility.
 */
public class PrmPasefHandler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        ScanRecordBuilder builder = context.getRecordBuilder();
        TableRow info = builder.single(Tables.PRM_FRAME_MSMS_INFO, "Frame", frame.getId());
        TableRow target = builder.single(Tables.PRM_TARGETS, "Id", info.getLong("Target"));

        Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.PRM_PASEF)
            .precursor(builder.prmPasefPrecursor(info, target));
        builder.complete(record, context.getExtractor().extract(frame,
                info.getInt("ScanNumBegin"), info.getInt("ScanNumEnd"), false))
            .ifPresent(accumulator::addStandalone);
    }
}
