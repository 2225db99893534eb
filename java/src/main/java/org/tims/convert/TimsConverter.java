package org.tims.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.io.BinaryDataCodec;
import org.tims.io.ImzMLWriter;
import org.tims.io.MzMLWriter;
import org.tims.io.PlateMap;
import org.tims.io.RunMetadata;
import org.tims.io.SpectrumSink;
import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSourceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts one acquisition into its output files.
 * <p>
 * LC acquisitions produce a single mzML file. MALDI single-spectra acquisitions
 * produce one or more mzML files grouped by {@link MaldiOutputMode}, and MALDI
 * imaging acquisitions produce an imzML file with its binary companion.
 */
public class TimsConverter {
    private static final Logger LOG = LoggerFactory.getLogger(TimsConverter.class);

    public static final String MZML_EXTENSION = ".mzML";
    public static final String IMZML_EXTENSION = ".imzML";

    static final String ACQUISITION_SOFTWARE = "AcquisitionSoftware";
    static final String ACQUISITION_SOFTWARE_VERSION = "AcquisitionSoftwareVersion";
    static final String INSTRUMENT_SOURCE_TYPE = "InstrumentSourceType";

    private final AcquisitionSource source;
    private final ConversionOptions options;

    private volatile StreamingSerializer current;
    private volatile boolean abortRequested;

    public TimsConverter(AcquisitionSource source, ConversionOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Stops the running conversion before its next frame window.
     */
    public void abort() {
        abortRequested = true;
        StreamingSerializer serializer = current;
        if (serializer != null) {
            serializer.abort();
        }
    }

    /**
     * Converts {@code input} into {@code outputDir}.
     *
     * @param outfile output file name, or null to derive it from the input name
     */
    public List<ConversionSummary> convert(Path input, Path outputDir, String outfile) throws ConversionException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ConversionException("Could not create output directory " + outputDir, e);
        }
        String baseName = outfile != null ? stem(outfile) : stem(input.getFileName().toString());
        List<Integer> frameIds = source.getFrameIds();

        if (!source.isMaldi()) {
            LOG.info("Converting LC acquisition {} ({} frames)", input, frameIds.size());
            Path output = outputDir.resolve(baseName + MZML_EXTENSION);
            return Collections.singletonList(convertMzML(input, output, options, frameIds));
        }

        String applicationType = source.getGlobalMetadata().get(AcquisitionSource.MALDI_APPLICATION_TYPE);
        if (ScanRecordBuilder.IMAGING.equals(applicationType)) {
            LOG.info("Converting MALDI imaging acquisition {} ({} frames)", input, frameIds.size());
            return Collections.singletonList(
                convertImzML(input, outputDir.resolve(baseName + IMZML_EXTENSION), frameIds));
        }
        if (!ScanRecordBuilder.SINGLE_SPECTRA.equals(applicationType)) {
            throw new ConversionException("Unsupported MALDI application type " + applicationType);
        }

        MaldiOutputMode mode = options.getMaldiOutputMode();
        LOG.info("Converting MALDI acquisition {} ({} frames, {} output)", input, frameIds.size(), mode);
        if (!mode.requiresPlateMap()) {
            Path output = outputDir.resolve(baseName + MZML_EXTENSION);
            return Collections.singletonList(convertMzML(input, output, options, frameIds));
        }

        PlateMap plateMap = readPlateMap();
        Map<String, List<Integer>> groups = group(frameIds, plateMap, mode == MaldiOutputMode.INDIVIDUAL);
        List<ConversionSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            Path output = outputDir.resolve(group.getKey() + MZML_EXTENSION);
            summaries.add(convertMzML(input, output, options, group.getValue()));
        }
        return summaries;
    }

    private ConversionSummary convertMzML(Path input, Path output, ConversionOptions runOptions,
                                          List<Integer> frameIds) throws ConversionException {
        SpectrumSink sink = new MzMLWriter(output, codec());
        return stream(runOptions, sink, output, metadata(input, runOptions), frameIds);
    }

    private ConversionSummary convertImzML(Path input, Path output, List<Integer> frameIds)
            throws ConversionException {
        // imaging runs keep their MS/MS spectra
        ConversionOptions imagingOptions = options.toBuilder().ms2Only(false).build();
        SpectrumSink sink = new ImzMLWriter(output, codec(), options.getImzmlMode());
        return stream(imagingOptions, sink, output, metadata(input, imagingOptions), frameIds);
    }

    private ConversionSummary stream(ConversionOptions runOptions, SpectrumSink sink, Path output,
                                     RunMetadata metadata, List<Integer> frameIds) throws ConversionException {
        if (abortRequested) {
            throw new ConversionException("Conversion aborted before writing " + output);
        }
        StreamingSerializer serializer = new StreamingSerializer(new ConversionContext(source, runOptions), sink, output);
        current = serializer;
        try {
            return serializer.run(metadata, frameIds);
        } finally {
            current = null;
        }
    }

    RunMetadata metadata(Path input, ConversionOptions runOptions) {
        Map<String, String> global = source.getGlobalMetadata();
        RunMetadata.Builder builder = RunMetadata.builder()
            .sourcePath(input)
            .schema(source.getSchema())
            .includesMs1(!runOptions.isMs2Only())
            .spectrumType(runOptions.getExtractionMode().getSpectrumType())
            .instrumentSourceType(global.get(INSTRUMENT_SOURCE_TYPE))
            .maldi(source.isMaldi());
        if (!runOptions.isBarebonesMetadata() && global.containsKey(ACQUISITION_SOFTWARE)) {
            builder.acquisitionSoftware(global.get(ACQUISITION_SOFTWARE), global.get(ACQUISITION_SOFTWARE_VERSION));
        }
        return builder.build();
    }

    private BinaryDataCodec codec() {
        return new BinaryDataCodec(options.getEncoding(), options.getCompression());
    }

    private PlateMap readPlateMap() throws ConversionException {
        Path file = options.getPlateMap();
        if (file == null) {
            throw new ConversionException("A plate map is required for MALDI output mode "
                + options.getMaldiOutputMode().name().toLowerCase(Locale.ROOT));
        }
        try {
            PlateMap plateMap = PlateMap.read(file);
            LOG.info("Read {} labelled spots from plate map {}", plateMap.size(), file);
            return plateMap;
        } catch (IOException | IllegalArgumentException e) {
            throw new ConversionException("Could not read plate map " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Frames of labelled spots, grouped per spot ({@code <label>_<spot>}) or per label.
     * Frames on unlabelled spots are left out.
     */
    private Map<String, List<Integer>> group(List<Integer> frameIds, PlateMap plateMap, boolean perSpot)
            throws ConversionException {
        ScanRecordBuilder records = new ScanRecordBuilder(source, options);
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int id : frameIds) {
            String spot;
            try {
                spot = records.coordinateOf(id).getSpotName();
            } catch (AcquisitionSourceException e) {
                throw new ConversionException("No spot for frame " + id + ": " + e.getMessage(), e);
            }
            Optional<String> label = plateMap.labelOf(spot);
            if (!label.isPresent()) {
                LOG.debug("Skipping frame {} on unlabelled spot {}", id, spot);
                continue;
            }
            String key = perSpot ? label.get() + "_" + spot : label.get();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
        }
        return groups;
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
