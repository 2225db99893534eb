package org.tims.tools;

import org.tims.convert.ConversionOptions;
import org.tims.convert.ConversionSummary;
import org.tims.convert.MaldiOutputMode;
import org.tims.convert.TimsConverter;
import org.tims.core.ExtractionMode;
import org.tims.io.Compression;
import org.tims.io.ImzMLMode;
import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSources;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Convert a timsTOF acquisition to mzML or imzML.
 */
@Command(
    name = "convert",
    description = "Convert a timsTOF acquisition (.d directory) to mzML or imzML"
)
public class ConvertCommand implements Callable<Integer> {

    @ParentCommand
    private TimsMain parent;

    @Parameters(index = "0", description = "Input acquisition (.d directory or analysis file)")
    private File input;

    @Option(names = {"-o", "--outdir"}, description = "Output directory (default: next to the input)")
    private File outdir;

    @Option(names = {"--outfile"}, description = "Output file name (default: input name)")
    private String outfile;

    @Option(names = {"--mode"}, defaultValue = "centroid",
        description = "Extraction mode: raw, centroid or profile (default: ${DEFAULT-VALUE})")
    private String mode;

    @Option(names = {"--ms2-only"}, description = "Only write MS/MS spectra")
    private boolean ms2Only;

    @Option(names = {"--exclude-mobility"}, description = "Write spectra without ion mobility arrays")
    private boolean excludeMobility;

    @Option(names = {"--profile-bins"}, defaultValue = "0",
        description = "Bin profile spectra into N bins, 0 to disable (default: ${DEFAULT-VALUE})")
    private int profileBins;

    @Option(names = {"--encoding"}, defaultValue = "64",
        description = "Binary array precision, 32 or 64 bit (default: ${DEFAULT-VALUE})")
    private int encoding;

    @Option(names = {"--compression"}, defaultValue = "zlib",
        description = "Binary array compression: zlib or none (default: ${DEFAULT-VALUE})")
    private String compression;

    @Option(names = {"--chunk-size"}, defaultValue = "10",
        description = "Frame windows per progress chunk (default: ${DEFAULT-VALUE})")
    private int chunkSize;

    @Option(names = {"--maldi-output"}, defaultValue = "combined",
        description = "MALDI output grouping: combined, individual or sample (default: ${DEFAULT-VALUE})")
    private String maldiOutput;

    @Option(names = {"--plate-map"}, description = "Plate map CSV, required for individual and sample output")
    private File plateMap;

    @Option(names = {"--imzml-mode"}, defaultValue = "processed",
        description = "imzML storage mode: processed or continuous (default: ${DEFAULT-VALUE})")
    private String imzmlMode;

    @Option(names = {"--baf-positive-code"}, defaultValue = "0",
        description = "BAF polarity code of positive mode spectra (default: ${DEFAULT-VALUE})")
    private int bafPositiveCode;

    @Option(names = {"--barebones-metadata"}, description = "Leave acquisition software out of the output header")
    private boolean barebonesMetadata;

    @Option(names = {"--source-type"}, description = "Name of the acquisition source provider to use")
    private String sourceType;

    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.applyLogLevel();
        }
        if (!input.exists()) {
            System.err.println("Error: Input not found: " + input);
            return 1;
        }

        ConversionOptions options;
        try {
            options = ConversionOptions.builder()
                .extractionMode(ExtractionMode.parse(mode))
                .ms2Only(ms2Only)
                .excludeMobility(excludeMobility)
                .profileBins(profileBins)
                .encoding(encoding)
                .compression(Compression.parse(compression))
                .chunkSize(chunkSize)
                .maldiOutputMode(MaldiOutputMode.parse(maldiOutput))
                .plateMap(plateMap == null ? null : plateMap.toPath())
                .imzmlMode(ImzMLMode.parse(imzmlMode))
                .bafPositivePolarityCode(bafPositiveCode)
                .barebonesMetadata(barebonesMetadata)
                .build();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid option: " + e.getMessage());
            return 1;
        }

        File outputDir = outdir != null ? outdir : input.getAbsoluteFile().getParentFile();

        System.out.println("Reading: " + input);
        List<ConversionSummary> summaries;
        try (AcquisitionSource source = AcquisitionSources.open(input.toPath(), sourceType)) {
            System.out.printf("Schema: %s, %d frames%n", source.getSchema(), source.getFrameIds().size());
            summaries = new TimsConverter(source, options).convert(input.toPath(), outputDir.toPath(), outfile);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        for (ConversionSummary summary : summaries) {
            System.out.printf("Wrote %d spectra to %s%n", summary.getEmittedCount(), summary.getOutput());
        }
        System.out.println("Done!");
        return 0;
    }
}
