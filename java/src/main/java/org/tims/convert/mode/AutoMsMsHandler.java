package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Precursor;
import org.tims.core.Schema;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

/**
 * Data-dependent MS/MS of TSF and BAF acquisitions, linked to the parent frame
 * named in the metadata.
 */
public class AutoMsMsHandler implements ModeHandler {

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        ScanRecordBuilder builder = context.getRecordBuilder();
        Precursor precursor;
        Integer parentFrame;
        if (context.getSource().getSchema() == Schema.BAF) {
            precursor = builder.bafAutoMsMsPrecursor(frame.getId());
            parentFrame = parentOf(frame.getRow());
        } else {
            TableRow info = builder.single(Tables.FRAME_MSMS_INFO, "Frame", frame.getId());
            precursor = builder.frameMsMsPrecursor(info);
            parentFrame = parentOf(info);
        }
        Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.AUTO_MSMS)
            .parentFrame(parentFrame)
            .precursor(precursor);
        builder.complete(record, context.getExtractor().extract(frame))
            .ifPresent(accumulator::addProduct);
    }

    private static Integer parentOf(TableRow row) {
        if (!row.has("Parent") || row.get("Parent") == null) {
            return null;
        }
        return row.getInt("Parent");
    }
}
