package org.tims.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.core.ExtractionMode;
import org.tims.core.Schema;
import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSourceException;
import org.tims.source.FrameInfo;
import org.tims.source.IndexedPeaks;
import org.tims.source.PeakList;
import org.tims.source.TableRow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decodes the m/z, intensity and mobility arrays of frames at the configured
 * extraction resolution.
 */
public class ArrayExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ArrayExtractor.class);

    private final AcquisitionSource source;
    private final ExtractionMode mode;
    private final int profileBins;
    private final boolean mobilityExcluded;
    private boolean rawFallbackLogged;

    public ArrayExtractor(AcquisitionSource source, ConversionOptions options) {
        this.source = source;
        this.mode = options.getExtractionMode();
        this.profileBins = options.getProfileBins();
        this.mobilityExcluded = options.isMobilityExcluded(source.getSchema());
    }

    /**
     * Whether {@link #extract(FrameInfo, int, int, boolean)} returns mobility arrays
     * when they are allowed.
     */
    public boolean isMobilityResolved() {
        return !mobilityExcluded;
    }

    /**
     * Arrays of a whole frame, mobility-resolved when the run allows it.
     */
    public ExtractionResult extract(FrameInfo frame) {
        switch (source.getSchema()) {
            case TDF:
                return extract(frame, 0, frame.getNumScans(), true);
            case TSF:
                return extractTsf(frame.getId());
            case BAF:
                return extractBaf(frame.getRow());
            default:
                throw new IllegalStateException("Unknown schema " + source.getSchema());
        }
    }

    /**
     * Arrays of the sub-scans {@code [scanBegin, scanEnd)} of a TDF frame.
     *
     * @param allowMobility false for modes that are always written without mobility
     */
    public ExtractionResult extract(FrameInfo frame, int scanBegin, int scanEnd, boolean allowMobility) {
        if (source.getSchema() != Schema.TDF) {
            return extract(frame);
        }
        if (allowMobility && !mobilityExcluded) {
            return extractTdf3d(frame.getId(), scanBegin, scanEnd);
        }
        return extractTdf2d(frame.getId(), scanBegin, scanEnd);
    }

    /**
     * One spectrum from all PASEF isolation windows of a ddaPASEF precursor, merged
     * into fixed-width bins over the acquisition m/z range.
     */
    public ExtractionResult extractPasefPrecursor(List<TableRow> pasefWindows) {
        List<double[]> mzArrays = new ArrayList<>();
        List<double[]> intensityArrays = new ArrayList<>();
        for (TableRow window : pasefWindows) {
            ExtractionResult part = extractTdf2d(window.getInt("Frame"),
                window.getInt("ScanNumBegin"), window.getInt("ScanNumEnd"));
            if (!part.isEmpty()) {
                mzArrays.add(part.getMz());
                intensityArrays.add(part.getIntensity());
            }
        }
        if (mzArrays.isEmpty()) {
            return ExtractionResult.empty();
        }
        double lower = globalDouble(AcquisitionSource.MZ_ACQ_RANGE_LOWER);
        double upper = globalDouble(AcquisitionSource.MZ_ACQ_RANGE_UPPER);
        return SpectrumBinner.binToWidth(concat(mzArrays), concat(intensityArrays),
            lower, upper, SpectrumBinner.PASEF_MERGE_BIN_WIDTH);
    }

    ExtractionResult extractTdf2d(int frame, int scanBegin, int scanEnd) {
        switch (mode) {
            case RAW: {
                List<IndexedPeaks> scans = source.readScans(frame, scanBegin, scanEnd);
                List<double[]> mzArrays = new ArrayList<>();
                List<double[]> intensityArrays = new ArrayList<>();
                for (IndexedPeaks scan : scans) {
                    if (!scan.isUsable()) continue;
                    double[] mz = source.indexToMz(frame, scan.getIndices());
                    if (mz.length != scan.size()) continue;
                    mzArrays.add(mz);
                    intensityArrays.add(scan.getIntensities());
                }
                if (mzArrays.isEmpty()) {
                    return ExtractionResult.empty();
                }
                return SpectrumBinner.collapse(concat(mzArrays), concat(intensityArrays));
            }
            case CENTROID: {
                PeakList peaks = source.extractCentroidedSpectrum(frame, scanBegin, scanEnd);
                if (!peaks.isUsable()) {
                    return ExtractionResult.empty();
                }
                return SpectrumBinner.collapse(peaks.getMz(), peaks.getIntensities());
            }
            case PROFILE: {
                IndexedPeaks profile = source.extractProfile(frame, scanBegin, scanEnd);
                return calibratedProfile(frame, profile);
            }
            default:
                throw new IllegalStateException("Unknown extraction mode " + mode);
        }
    }

    /**
     * Every sub-scan decoded separately and tagged with its 1/K0 value. Exact
     * duplicate (m/z, intensity, mobility) points are removed and the result is
     * ordered by m/z, then mobility.
     */
    ExtractionResult extractTdf3d(int frame, int scanBegin, int scanEnd) {
        List<IndexedPeaks> scans = source.readScans(frame, scanBegin, scanEnd);
        if (scans.size() > scanEnd - scanBegin) {
            throw new AcquisitionSourceException("Frame " + frame + " returned " + scans.size()
                + " scans for range [" + scanBegin + ", " + scanEnd + ")");
        }
        List<double[]> mzArrays = new ArrayList<>();
        List<double[]> intensityArrays = new ArrayList<>();
        List<double[]> mobilityArrays = new ArrayList<>();
        for (int i = 0; i < scans.size(); i++) {
            IndexedPeaks scan = scans.get(i);
            if (!scan.isUsable()) continue;
            double[] mz = source.indexToMz(frame, scan.getIndices());
            if (mz.length != scan.size()) continue;
            double[] mobility = new double[mz.length];
            Arrays.fill(mobility, source.scanNumberToOneOverK0(frame, scanBegin + i));
            mzArrays.add(mz);
            intensityArrays.add(scan.getIntensities());
            mobilityArrays.add(mobility);
        }
        if (mzArrays.isEmpty()) {
            return ExtractionResult.empty();
        }
        return uniquePoints(concat(mzArrays), concat(intensityArrays), concat(mobilityArrays));
    }

    ExtractionResult extractTsf(int frame) {
        IndexedPeaks peaks;
        if (mode == ExtractionMode.PROFILE) {
            peaks = source.readProfileSpectrum(frame);
            return calibratedProfile(frame, peaks);
        }
        if (mode == ExtractionMode.RAW && !rawFallbackLogged) {
            LOG.info("Raw extraction is not available for TSF data, using centroided line spectra");
            rawFallbackLogged = true;
        }
        peaks = source.readLineSpectrum(frame);
        if (!peaks.isUsable()) {
            return ExtractionResult.empty();
        }
        double[] mz = source.indexToMz(frame, peaks.getIndices());
        if (mz.length != peaks.size()) {
            return ExtractionResult.empty();
        }
        return SpectrumBinner.collapse(mz, peaks.getIntensities());
    }

    ExtractionResult extractBaf(TableRow spectrumRow) {
        boolean profile = mode == ExtractionMode.PROFILE;
        String mzColumn = profile ? "ProfileMzId" : "LineMzId";
        String intensityColumn = profile ? "ProfileIntensityId" : "LineIntensityId";
        if (spectrumRow.get(mzColumn) == null || spectrumRow.get(intensityColumn) == null) {
            return ExtractionResult.empty();
        }
        double[] mz = source.readDoubleArray(spectrumRow.getLong(mzColumn));
        double[] intensity = source.readDoubleArray(spectrumRow.getLong(intensityColumn));
        if (mz.length == 0 || mz.length != intensity.length) {
            return ExtractionResult.empty();
        }
        if (profile && profileBins > 0) {
            return SpectrumBinner.binToCount(mz, intensity, profileBins);
        }
        return SpectrumBinner.collapse(mz, intensity);
    }

    private ExtractionResult calibratedProfile(int frame, IndexedPeaks profile) {
        if (!profile.isUsable()) {
            return ExtractionResult.empty();
        }
        double[] mz = source.indexToMz(frame, profile.getIndices());
        if (mz.length != profile.size()) {
            return ExtractionResult.empty();
        }
        if (profileBins > 0) {
            return SpectrumBinner.binToCount(mz, profile.getIntensities(), profileBins);
        }
        return SpectrumBinner.collapse(mz, profile.getIntensities());
    }

    private double globalDouble(String key) {
        String value = source.getGlobalMetadata().get(key);
        if (value == null) {
            throw new AcquisitionSourceException("GlobalMetadata has no " + key);
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new AcquisitionSourceException("GlobalMetadata " + key + " is not numeric: " + value, e);
        }
    }

    static ExtractionResult uniquePoints(double[] mz, double[] intensity, double[] mobility) {
        Integer[] order = new Integer[mz.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> {
            int c = Double.compare(mz[a], mz[b]);
            if (c != 0) return c;
            c = Double.compare(mobility[a], mobility[b]);
            if (c != 0) return c;
            return Double.compare(intensity[a], intensity[b]);
        });

        double[] outMz = new double[mz.length];
        double[] outIntensity = new double[mz.length];
        double[] outMobility = new double[mz.length];
        int n = 0;
        for (Integer idx : order) {
            if (n > 0 && outMz[n - 1] == mz[idx] && outMobility[n - 1] == mobility[idx]
                    && outIntensity[n - 1] == intensity[idx]) {
                continue;
            }
            outMz[n] = mz[idx];
            outIntensity[n] = intensity[idx];
            outMobility[n] = mobility[idx];
            n++;
        }
        return ExtractionResult.of(Arrays.copyOf(outMz, n), Arrays.copyOf(outIntensity, n),
            Arrays.copyOf(outMobility, n));
    }

    private static double[] concat(List<double[]> arrays) {
        int total = 0;
        for (double[] a : arrays) total += a.length;
        double[] result = new double[total];
        int offset = 0;
        for (double[] a : arrays) {
            System.arraycopy(a, 0, result, offset, a.length);
            offset += a.length;
        }
        return result;
    }
}
