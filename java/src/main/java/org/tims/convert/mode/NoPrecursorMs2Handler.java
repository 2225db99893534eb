package org.tims.convert.mode;

import org.tims.convert.ConversionContext;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Schema;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

/**
 * bbCID and isCID frames: fragment spectra of everything in the source, with a
 * collision energy but no precursor ion.
 */
public class NoPrecursorMs2Handler implements ModeHandler {
    private final AcquisitionMode mode;

    public NoPrecursorMs2Handler(AcquisitionMode mode) {
        this.mode = mode;
    }

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return 1;
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        ScanRecordBuilder builder = context.getRecordBuilder();
        Double collisionEnergy;
        if (context.getSource().getSchema() == Schema.BAF) {
            collisionEnergy = builder.bafVariable(frame.getId(), ScanRecordBuilder.BAF_COLLISION_ENERGY);
        } else {
            TableRow info = builder.single(Tables.FRAME_MSMS_INFO, "Frame", frame.getId());
            double value = info.getDouble("CollisionEnergy");
            collisionEnergy = Double.isNaN(value) ? null : value;
        }
        Spectrum.Builder record = builder.newRecord(frame, mode)
            .precursor(builder.noPrecursor(collisionEnergy));
        builder.complete(record, context.getExtractor().extract(frame))
            .ifPresent(accumulator::addStandalone);
    }
}
