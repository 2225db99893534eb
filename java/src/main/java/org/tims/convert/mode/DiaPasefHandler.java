package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

import java.util.List;

/**
 * diaPASEF frames: one spectrum per isolation window of the frame's window group.
 */
public class DiaPasefHandler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return windowsOf(frame, context).size();
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        ScanRecordBuilder builder = context.getRecordBuilder();
        for (TableRow window : windowsOf(frame, context)) {
            Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.DIA_PASEF)
                .precursor(builder.diaPasefPrecursor(window));
            builder.complete(record, context.getExtractor().extract(frame,
                    window.getInt("ScanNumBegin"), window.getInt("ScanNumEnd"), true))
                .ifPresent(accumulator::addStandalone);
        }
    }

    private static List<TableRow> windowsOf(FrameInfo frame, ConversionContext context) {
        TableRow info = context.getRecordBuilder().single(Tables.DIA_FRAME_MSMS_INFO, "Frame", frame.getId());
        return context.getSource().getRows(Tables.DIA_FRAME_MSMS_WINDOWS, "WindowGroup", info.getLong("WindowGroup"));
    }
}
