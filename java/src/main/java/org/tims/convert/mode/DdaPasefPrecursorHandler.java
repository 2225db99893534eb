package org.tims.convert.mode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.convert.ConversionContext;
import org.tims.convert.ExtractionResult;
import org.tims.convert.ScanRecordBuilder;
import org.tims.convert.WindowAccumulator;
import org.tims.core.AcquisitionMode;
import org.tims.core.Spectrum;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

import java.util.List;

/**
 * An MS1 frame that owns ddaPASEF precursors. Every precursor yields one product
 * spectrum merged from all of its PASEF isolation windows, which may lie in later
 * frames. Products are built even when MS1 spectra are not written.
 */
public class DdaPasefPrecursorHandler extends Ms1Handler {
    private static final Logger LOG = LoggerFactory.getLogger(DdaPasefPrecursorHandler.class);

    @Override
    public int expectedCount(FrameInfo frame, ConversionContext context) {
        return super.expectedCount(frame, context) + precursorsOf(frame, context).size();
    }

    @Override
    public void process(FrameInfo frame, ConversionContext context, WindowAccumulator accumulator) {
        super.process(frame, context, accumulator);

        ScanRecordBuilder builder = context.getRecordBuilder();
        for (TableRow precursor : precursorsOf(frame, context)) {
            long precursorId = precursor.getLong("Id");
            List<TableRow> pasefWindows = context.getSource()
                .getRows(Tables.PASEF_FRAME_MSMS_INFO, "Precursor", precursorId);
            if (pasefWindows.isEmpty()) {
                LOG.debug("Precursor {} has no PASEF windows", precursorId);
                continue;
            }
            ExtractionResult arrays = context.getExtractor().extractPasefPrecursor(pasefWindows);
            if (arrays.isEmpty()) {
                LOG.debug("Precursor {} decoded to no data, spectrum dropped", precursorId);
                continue;
            }
            Spectrum.Builder record = builder.newRecord(frame, AcquisitionMode.DDA_PASEF_PRODUCT)
                .frame(pasefWindows.get(0).getInt("Frame"))
                .parentFrame(frame.getId())
                .parentScan((int) Math.round(precursor.getDouble("ScanNumber")))
                .precursor(builder.ddaPasefPrecursor(precursor, pasefWindows));
            builder.complete(record, arrays).ifPresent(accumulator::addProduct);
        }
    }

    private static List<TableRow> precursorsOf(FrameInfo frame, ConversionContext context) {
        return context.getSource().getRows(Tables.PRECURSORS, "Parent", frame.getId());
    }
}
