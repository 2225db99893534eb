package org.tims.testing;

import org.tims.core.Schema;
import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSourceException;
import org.tims.source.FrameInfo;
import org.tims.source.IndexedPeaks;
import org.tims.source.PeakList;
import org.tims.source.TableRow;
import org.tims.source.Tables;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory acquisition built table by table.
 * <p>
 * Peak indices calibrate to m/z one to one, and sub-scan {@code n} has the inverse
 * mobility {@code 1.0 + n / 1000}.
 */
public class FakeAcquisitionSource implements AcquisitionSource {
    private final Schema schema;
    private final Map<String, String> globalMetadata = new LinkedHashMap<>();
    private final TreeMap<Integer, FrameInfo> frames = new TreeMap<>();
    private final Map<String, List<TableRow>> tables = new HashMap<>();
    private final Map<Integer, Map<Integer, IndexedPeaks>> scans = new HashMap<>();
    private final Map<Integer, IndexedPeaks> lineSpectra = new HashMap<>();
    private final Map<Integer, IndexedPeaks> profileSpectra = new HashMap<>();
    private final Map<Long, double[]> arrays = new HashMap<>();
    private final Set<Integer> failingFrames = new HashSet<>();
    private final Set<Integer> miscalibratedFrames = new HashSet<>();
    private boolean closed;

    public FakeAcquisitionSource(Schema schema) {
        this.schema = schema;
        global(MZ_ACQ_RANGE_LOWER, "100.0");
        global(MZ_ACQ_RANGE_UPPER, "1700.0");
    }

    public static FakeAcquisitionSource tdf() {
        return new FakeAcquisitionSource(Schema.TDF);
    }

    public static FakeAcquisitionSource tsf() {
        return new FakeAcquisitionSource(Schema.TSF);
    }

    public static FakeAcquisitionSource baf() {
        return new FakeAcquisitionSource(Schema.BAF);
    }

    // Building

    public FakeAcquisitionSource global(String key, String value) {
        globalMetadata.put(key, value);
        return this;
    }

    public FakeAcquisitionSource frame(int id, int scanMode, int msmsType, double rtSeconds, int numScans) {
        return frame(id, scanMode, msmsType, "+", rtSeconds, numScans, new HashMap<>());
    }

    public FakeAcquisitionSource frame(int id, int scanMode, int msmsType, String polarity,
                                       double rtSeconds, int numScans, Map<String, Object> columns) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Id", id);
        values.put("ScanMode", scanMode);
        values.put("MsMsType", msmsType);
        values.put("Polarity", polarity);
        values.put("Time", rtSeconds);
        values.put("NumScans", numScans);
        values.putAll(columns);
        TableRow row = new TableRow(schema == Schema.BAF ? Tables.SPECTRA : Tables.FRAMES, values);
        frames.put(id, new FrameInfo(id, scanMode, msmsType, polarity, rtSeconds, numScans, row));
        return this;
    }

    /** Peaks of one TDF sub-scan; indices are m/z values. */
    public FakeAcquisitionSource scan(int frame, int scanNumber, double[] mz, double[] intensity) {
        scans.computeIfAbsent(frame, k -> new TreeMap<>()).put(scanNumber, new IndexedPeaks(mz, intensity));
        return this;
    }

    public FakeAcquisitionSource lineSpectrum(int frame, double[] mz, double[] intensity) {
        lineSpectra.put(frame, new IndexedPeaks(mz, intensity));
        return this;
    }

    public FakeAcquisitionSource profileSpectrum(int frame, double[] mz, double[] intensity) {
        profileSpectra.put(frame, new IndexedPeaks(mz, intensity));
        return this;
    }

    public FakeAcquisitionSource array(long id, double[] values) {
        arrays.put(id, values);
        return this;
    }

    /** Adds a row from alternating column names and values. */
    public FakeAcquisitionSource row(String table, Object... columnsAndValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        tables.computeIfAbsent(table, k -> new ArrayList<>()).add(new TableRow(table, values));
        return this;
    }

    /** Decoding this frame raises a source fault. */
    public FakeAcquisitionSource failOn(int frame) {
        failingFrames.add(frame);
        return this;
    }

    /** Calibration of this frame returns one m/z more than it was given indices. */
    public FakeAcquisitionSource miscalibrate(int frame) {
        miscalibratedFrames.add(frame);
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    // AcquisitionSource

    @Override
    public Schema getSchema() {
        return schema;
    }

    @Override
    public Map<String, String> getGlobalMetadata() {
        return globalMetadata;
    }

    @Override
    public List<Integer> getFrameIds() {
        return new ArrayList<>(frames.keySet());
    }

    @Override
    public FrameInfo getFrame(int frameId) {
        FrameInfo frame = frames.get(frameId);
        if (frame == null) {
            throw new AcquisitionSourceException("No frame " + frameId);
        }
        return frame;
    }

    @Override
    public List<TableRow> getRows(String table, String column, long key) {
        List<TableRow> result = new ArrayList<>();
        for (TableRow row : tables.getOrDefault(table, new ArrayList<>())) {
            Object value = row.asMap().get(column);
            if (value instanceof Number && ((Number) value).longValue() == key) {
                result.add(row);
            }
        }
        return result;
    }

    @Override
    public List<IndexedPeaks> readScans(int frame, int scanBegin, int scanEnd) {
        checkFrame(frame);
        Map<Integer, IndexedPeaks> frameScans = scans.getOrDefault(frame, new HashMap<>());
        List<IndexedPeaks> result = new ArrayList<>();
        for (int scan = scanBegin; scan < scanEnd; scan++) {
            result.add(frameScans.getOrDefault(scan, IndexedPeaks.empty()));
        }
        return result;
    }

    @Override
    public double[] indexToMz(int frame, double[] indices) {
        checkFrame(frame);
        if (miscalibratedFrames.contains(frame)) {
            double[] mz = Arrays.copyOf(indices, indices.length + 1);
            mz[indices.length] = 1500.0;
            return mz;
        }
        return indices.clone();
    }

    @Override
    public PeakList extractCentroidedSpectrum(int frame, int scanBegin, int scanEnd) {
        IndexedPeaks merged = merge(readScans(frame, scanBegin, scanEnd));
        return new PeakList(merged.getIndices(), merged.getIntensities());
    }

    @Override
    public IndexedPeaks extractProfile(int frame, int scanBegin, int scanEnd) {
        return merge(readScans(frame, scanBegin, scanEnd));
    }

    @Override
    public double scanNumberToOneOverK0(int frame, int scanNumber) {
        return 1.0 + scanNumber / 1000.0;
    }

    @Override
    public double oneOverK0ToCcs(double oneOverK0, int charge, double mz) {
        return 100.0 * oneOverK0 + charge;
    }

    @Override
    public IndexedPeaks readLineSpectrum(int frame) {
        checkFrame(frame);
        return lineSpectra.getOrDefault(frame, IndexedPeaks.empty());
    }

    @Override
    public IndexedPeaks readProfileSpectrum(int frame) {
        checkFrame(frame);
        return profileSpectra.getOrDefault(frame, IndexedPeaks.empty());
    }

    @Override
    public double[] readDoubleArray(long arrayId) {
        double[] values = arrays.get(arrayId);
        if (values == null) {
            throw new AcquisitionSourceException("No array " + arrayId);
        }
        return values;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void checkFrame(int frame) {
        if (failingFrames.contains(frame)) {
            throw new AcquisitionSourceException("Decoding failed for frame " + frame);
        }
    }

    private static IndexedPeaks merge(List<IndexedPeaks> parts) {
        int total = 0;
        for (IndexedPeaks part : parts) total += part.size();
        double[] indices = new double[total];
        double[] intensities = new double[total];
        int offset = 0;
        for (IndexedPeaks part : parts) {
            System.arraycopy(part.getIndices(), 0, indices, offset, part.size());
            System.arraycopy(part.getIntensities(), 0, intensities, offset, part.size());
            offset += part.size();
        }
        return new IndexedPeaks(indices, intensities);
    }
}
