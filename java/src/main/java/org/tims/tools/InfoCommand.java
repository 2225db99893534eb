package org.tims.tools;

import org.tims.core.MSExperiment;
import org.tims.core.Polarity;
import org.tims.core.Spectrum;
import org.tims.io.MzMLReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Summarize an mzML file written by the convert command.
 */
@Command(
    name = "info",
    description = "Summarize a converted mzML file"
)
public class InfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Converted mzML file")
    private File inputFile;

    @Option(names = {"-d", "--detailed"}, description = "Show precursor linking and spot details")
    private boolean detailed;

    @Override
    public Integer call() throws Exception {
        if (!inputFile.exists()) {
            System.err.println("Error: File not found: " + inputFile);
            return 1;
        }
        if (!inputFile.getName().toLowerCase(Locale.ROOT).endsWith(".mzml")) {
            System.err.println("Error: Unsupported file format. Use .mzML");
            return 1;
        }

        MSExperiment experiment;
        try {
            experiment = new MzMLReader().read(inputFile.toPath());
        } catch (Exception e) {
            System.err.println("Error reading file: " + e.getMessage());
            return 1;
        }

        System.out.println("=== " + inputFile.getName() + " ===");
        System.out.printf("Size: %.1f MB%n", inputFile.length() / (1024.0 * 1024));
        if (experiment.getSoftware() != null) {
            System.out.println("Acquisition software: " + experiment.getSoftware());
        }
        System.out.println("Spectra: " + experiment.getSpectrumCount());
        System.out.println("Declared spectra: " + experiment.getDeclaredSpectrumCount()
            + (experiment.isCountConsistent() ? "" : " (mismatch)"));
        System.out.println("With ion mobility: " + experiment.countSpectraWithMobility());
        System.out.println("Data points: " + experiment.getTotalDataPoints());

        for (Map.Entry<Integer, Integer> level : experiment.countByLevel().entrySet()) {
            System.out.printf("MS%d: %d spectra%n", level.getKey(), level.getValue());
        }
        for (Map.Entry<Polarity, Integer> polarity : experiment.countByPolarity().entrySet()) {
            System.out.printf("Polarity %s: %d spectra%n",
                polarity.getKey().name().toLowerCase(Locale.ROOT), polarity.getValue());
        }

        printRange("m/z", experiment.getMzRange(), "%.4f", "");
        printRange("RT", experiment.getRtRange(), "%.2f", " min");
        printRange("1/K0", experiment.getMobilityRange(), "%.4f", " Vs/cm2");

        if (detailed) {
            System.out.println("MS/MS spectra linked to a parent: " + experiment.countLinkedProducts());
            int standalone = 0;
            int spots = 0;
            for (Spectrum s : experiment.getSpectra()) {
                if (s.getMsLevel() > 1 && s.getParentScanNumber() == null) standalone++;
                if (s.getCoordinate() != null) spots++;
            }
            System.out.println("MS/MS spectra without a parent: " + standalone);
            if (spots > 0) {
                System.out.println("Spectra with a spot or pixel: " + spots);
            }
        }
        return 0;
    }

    private static void printRange(String label, double[] range, String format, String unit) {
        if (range == null) return;
        System.out.printf(Locale.ROOT, label + ": " + format + " - " + format + unit + "%n", range[0], range[1]);
    }
}
