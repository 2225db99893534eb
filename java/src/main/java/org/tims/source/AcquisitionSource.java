package org.tims.source;

import org.tims.core.Schema;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

/**
 * Read access to one acquisition: its metadata tables and the decode functions
 * of the vendor library.
 * <p>
 * A source is owned by a single conversion for its lifetime and is never read
 * concurrently. Decode operations that a schema does not offer throw
 * {@link UnsupportedOperationException}; faults inside the vendor library are
 * reported as {@link AcquisitionSourceException}.
 */
public interface AcquisitionSource extends Closeable {

    String MALDI_APPLICATION_TYPE = "MaldiApplicationType";
    String MZ_ACQ_RANGE_LOWER = "MzAcqRangeLower";
    String MZ_ACQ_RANGE_UPPER = "MzAcqRangeUpper";

    Schema getSchema();

    /**
     * Key/value pairs of the GlobalMetadata table.
     */
    Map<String, String> getGlobalMetadata();

    /**
     * All frame ids (BAF spectrum ids) in ascending order.
     */
    List<Integer> getFrameIds();

    FrameInfo getFrame(int frameId);

    /**
     * Rows of {@code table} whose {@code column} equals {@code key}, in table order.
     */
    List<TableRow> getRows(String table, String column, long key);

    default boolean isMaldi() {
        return getGlobalMetadata().containsKey(MALDI_APPLICATION_TYPE);
    }

    // TDF

    /**
     * Reads the sub-scans {@code [scanBegin, scanEnd)} of a frame; element {@code i}
     * of the result holds scan {@code scanBegin + i}.
     */
    default List<IndexedPeaks> readScans(int frame, int scanBegin, int scanEnd) {
        throw unsupported("readScans");
    }

    /**
     * Index to m/z calibration of a frame (TDF and TSF).
     */
    default double[] indexToMz(int frame, double[] indices) {
        throw unsupported("indexToMz");
    }

    default PeakList extractCentroidedSpectrum(int frame, int scanBegin, int scanEnd) {
        throw unsupported("extractCentroidedSpectrum");
    }

    default IndexedPeaks extractProfile(int frame, int scanBegin, int scanEnd) {
        throw unsupported("extractProfile");
    }

    /**
     * Inverse reduced mobility (1/K0) of a sub-scan.
     */
    default double scanNumberToOneOverK0(int frame, int scanNumber) {
        throw unsupported("scanNumberToOneOverK0");
    }

    default double oneOverK0ToCcs(double oneOverK0, int charge, double mz) {
        throw unsupported("oneOverK0ToCcs");
    }

    // TSF

    default IndexedPeaks readLineSpectrum(int frame) {
        throw unsupported("readLineSpectrum");
    }

    default IndexedPeaks readProfileSpectrum(int frame) {
        throw unsupported("readProfileSpectrum");
    }

    // BAF

    default double[] readDoubleArray(long arrayId) {
        throw unsupported("readDoubleArray");
    }

    private UnsupportedOperationException unsupported(String operation) {
        return new UnsupportedOperationException(operation + " is not available for " + getSchema() + " data");
    }
}
