package org.tims.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.core.AcquisitionMode;
import org.tims.core.Polarity;
import org.tims.core.Precursor;
import org.tims.core.Schema;
import org.tims.core.Spectrum;
import org.tims.core.SpotCoordinate;
import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSourceException;
import org.tims.source.FrameInfo;
import org.tims.source.TableRow;
import org.tims.source.Tables;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles canonical spectra from frame metadata, mode-specific metadata rows and
 * extracted arrays.
 * <p>
 * Isolation windows are always symmetric, {@code IsolationWidth / 2} on each side.
 * Collision cross sections are computed only for precursors with a valid charge.
 */
public class ScanRecordBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ScanRecordBuilder.class);

    static final String SINGLE_SPECTRA = "SingleSpectra";
    static final String IMAGING = "Imaging";

    // BAF Variables ids
    public static final int BAF_COLLISION_ENERGY = 5;
    public static final int BAF_CHARGE = 6;
    public static final int BAF_TARGET_MZ = 7;
    public static final int BAF_ISOLATION_WIDTH = 8;

    private final AcquisitionSource source;
    private final ConversionOptions options;
    private final Set<String> unknownPolarityCodes = new HashSet<>();

    public ScanRecordBuilder(AcquisitionSource source, ConversionOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Record with the classification and timing of an LC frame.
     */
    public Spectrum.Builder newRecord(FrameInfo frame, AcquisitionMode mode) {
        return Spectrum.builder()
            .frame(frame.getId())
            .msLevel(mode.getMsLevel())
            .type(options.getExtractionMode().getSpectrumType())
            .polarity(resolvePolarity(frame))
            .retentionTime(frame.getRetentionTimeSeconds() / 60)
            .ms2NoPrecursor(mode.isWithoutPrecursor());
    }

    /**
     * Record of a MALDI frame: positioned by its spot or pixel, retention time 0.
     */
    public Spectrum.Builder newMaldiRecord(FrameInfo frame, AcquisitionMode mode) {
        return newRecord(frame, mode)
            .retentionTime(0)
            .coordinate(coordinateOf(frame.getId()));
    }

    public SpotCoordinate coordinateOf(int frameId) {
        TableRow info = single(Tables.MALDI_FRAME_INFO, "Frame", frameId);
        String applicationType = source.getGlobalMetadata().get(AcquisitionSource.MALDI_APPLICATION_TYPE);
        if (SINGLE_SPECTRA.equals(applicationType)) {
            return SpotCoordinate.spot(info.getString("SpotName"));
        }
        if (IMAGING.equals(applicationType)) {
            int x = info.getInt("XIndexPos");
            int y = info.getInt("YIndexPos");
            if (info.has("ZIndexPos") && info.get("ZIndexPos") != null) {
                return SpotCoordinate.pixel(x, y, info.getInt("ZIndexPos"));
            }
            return SpotCoordinate.pixel(x, y);
        }
        throw new AcquisitionSourceException("Unsupported MALDI application type " + applicationType);
    }

    /**
     * Polarity of a frame. TDF and TSF frames carry "+" or "-"; BAF acquisition keys
     * carry a numeric code whose positive value is configurable.
     */
    public Polarity resolvePolarity(FrameInfo frame) {
        String code = frame.getPolarityCode();
        if (source.getSchema() != Schema.BAF) {
            Polarity polarity = Polarity.fromSymbol(code);
            if (polarity == Polarity.UNKNOWN) {
                warnUnknownPolarity(code);
            }
            return polarity;
        }
        int positive = options.getBafPositivePolarityCode();
        try {
            int value = Integer.parseInt(code == null ? "" : code.trim());
            if (value == positive) return Polarity.POSITIVE;
            if (value == 1 - positive) return Polarity.NEGATIVE;
        } catch (NumberFormatException e) {
            LOG.debug("Non-numeric BAF polarity code {}", code);
        }
        warnUnknownPolarity(code);
        return Polarity.UNKNOWN;
    }

    private void warnUnknownPolarity(String code) {
        if (unknownPolarityCodes.add(String.valueOf(code))) {
            LOG.warn("Unknown polarity code '{}', spectra are written without polarity", code);
        }
    }

    /**
     * Attaches the arrays to the record, or reports that there is nothing to emit.
     */
    public Optional<Spectrum> complete(Spectrum.Builder record, ExtractionResult arrays) {
        if (arrays.isEmpty()) {
            LOG.debug("Frame {} decoded to no data, spectrum dropped", record.getFrame());
            return Optional.empty();
        }
        return Optional.of(record
            .data(arrays.getMz(), arrays.getIntensity())
            .mobility(arrays.getMobility())
            .build());
    }

    // Precursor population per mode

    /**
     * ddaPASEF: a row of the Precursors table and its PASEF isolation windows.
     */
    public Precursor ddaPasefPrecursor(TableRow precursor, List<TableRow> pasefWindows) {
        int parent = precursor.getInt("Parent");
        int scanNumber = (int) Math.round(precursor.getDouble("ScanNumber"));
        double selectedMz = precursor.getDouble("LargestPeakMz");
        double mobility = source.scanNumberToOneOverK0(parent, scanNumber);
        Integer charge = chargeOf(precursor, "Charge");

        Precursor.Builder b = Precursor.builder()
            .targetMz(precursor.getDouble("AverageMz"))
            .selectedIonMz(selectedMz)
            .selectedIonIntensity(precursor.getDouble("Intensity"))
            .selectedIonMobility(mobility)
            .charge(charge);
        if (!pasefWindows.isEmpty()) {
            TableRow first = pasefWindows.get(0);
            b.isolationWidth(first.getDouble("IsolationWidth"))
                .collisionEnergy(optionalDouble(first, "CollisionEnergy"));
        }
        if (charge != null) {
            b.selectedIonCcs(source.oneOverK0ToCcs(mobility, charge, selectedMz));
        }
        return b.build();
    }

    /**
     * diaPASEF: one isolation window of a window group.
     */
    public Precursor diaPasefPrecursor(TableRow window) {
        double isolationMz = window.getDouble("IsolationMz");
        return Precursor.builder()
            .targetMz(isolationMz)
            .selectedIonMz(isolationMz)
            .isolationWidth(window.getDouble("IsolationWidth"))
            .collisionEnergy(optionalDouble(window, "CollisionEnergy"))
            .build();
    }

    /**
     * prmPASEF: the frame's PrmFrameMsMsInfo row and its PrmTargets row.
     */
    public Precursor prmPasefPrecursor(TableRow frameInfo, TableRow target) {
        double isolationMz = frameInfo.getDouble("IsolationMz");
        double mobility = target.getDouble("OneOverK0");
        Integer charge = chargeOf(target, "Charge");

        Precursor.Builder b = Precursor.builder()
            .targetMz(isolationMz)
            .selectedIonMz(isolationMz)
            .isolationWidth(frameInfo.getDouble("IsolationWidth"))
            .selectedIonMobility(Double.isNaN(mobility) ? null : mobility)
            .charge(charge)
            .collisionEnergy(optionalDouble(frameInfo, "CollisionEnergy"));
        if (charge != null && !Double.isNaN(mobility)) {
            b.selectedIonCcs(source.oneOverK0ToCcs(mobility, charge, isolationMz));
        }
        return b.build();
    }

    /**
     * MRM, TSF Auto MS/MS and MALDI MS/MS: a FrameMsMsInfo row.
     */
    public Precursor frameMsMsPrecursor(TableRow frameMsMsInfo) {
        double triggerMass = frameMsMsInfo.getDouble("TriggerMass");
        return Precursor.builder()
            .targetMz(triggerMass)
            .selectedIonMz(triggerMass)
            .isolationWidth(frameMsMsInfo.getDouble("IsolationWidth"))
            .charge(chargeOf(frameMsMsInfo, "PrecursorCharge"))
            .collisionEnergy(optionalDouble(frameMsMsInfo, "CollisionEnergy"))
            .build();
    }

    /**
     * bbCID and isCID: only the collision energy is known.
     */
    public Precursor noPrecursor(Double collisionEnergy) {
        return Precursor.builder().collisionEnergy(collisionEnergy).build();
    }

    /**
     * BAF Auto MS/MS: Variables 7, 8, 6 and 5 of the spectrum and its Steps row.
     */
    public Precursor bafAutoMsMsPrecursor(int spectrumId) {
        TableRow step = single(Tables.STEPS, "TargetSpectrum", spectrumId);
        Double charge = bafVariable(spectrumId, BAF_CHARGE);
        return Precursor.builder()
            .targetMz(bafVariable(spectrumId, BAF_TARGET_MZ))
            .isolationWidth(requireValue(bafVariable(spectrumId, BAF_ISOLATION_WIDTH), spectrumId, BAF_ISOLATION_WIDTH))
            .selectedIonMz(step.getDouble("Mass"))
            .charge(charge == null ? null : validCharge(charge))
            .collisionEnergy(bafVariable(spectrumId, BAF_COLLISION_ENERGY))
            .build();
    }

    /**
     * Value of a BAF acquisition variable for one spectrum, null when not recorded.
     */
    public Double bafVariable(int spectrumId, int variable) {
        for (TableRow row : source.getRows(Tables.VARIABLES, "Spectrum", spectrumId)) {
            if (row.getInt("Variable") == variable) {
                double value = row.getDouble("Value");
                return Double.isNaN(value) ? null : value;
            }
        }
        return null;
    }

    /**
     * The one row of {@code table} with {@code column == key}.
     */
    public TableRow single(String table, String column, long key) {
        List<TableRow> rows = source.getRows(table, column, key);
        if (rows.isEmpty()) {
            throw new AcquisitionSourceException("No " + table + " row with " + column + " = " + key);
        }
        return rows.get(0);
    }

    /**
     * Charge state of a row, or null when it is absent, NaN or zero.
     */
    static Integer chargeOf(TableRow row, String column) {
        if (!row.has(column)) return null;
        return validCharge(row.getDouble(column));
    }

    static Integer validCharge(double charge) {
        if (Double.isNaN(charge) || Double.isInfinite(charge) || (int) charge == 0) {
            return null;
        }
        return (int) charge;
    }

    private static Double optionalDouble(TableRow row, String column) {
        if (!row.has(column)) return null;
        double value = row.getDouble(column);
        return Double.isNaN(value) ? null : value;
    }

    private static double requireValue(Double value, int spectrumId, int variable) {
        if (value == null) {
            throw new AcquisitionSourceException("Spectrum " + spectrumId + " has no variable " + variable);
        }
        return value;
    }
}
