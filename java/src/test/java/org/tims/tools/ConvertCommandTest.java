package org.tims.tools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tims.core.MSExperiment;
import org.tims.io.MzMLReader;
import org.tims.testing.FakeAcquisitionSource;
import org.tims.testing.FakeAcquisitionSourceProvider;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConvertCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    public void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true));
        System.setErr(new PrintStream(err, true));
    }

    @AfterEach
    public void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        FakeAcquisitionSourceProvider.clear();
    }

    private Path registeredRun(FakeAcquisitionSource source) throws IOException {
        Path input = Files.createDirectories(tempDir.resolve("run.d"));
        FakeAcquisitionSourceProvider.register(input, source);
        return input;
    }

    private static FakeAcquisitionSource ms1Run() {
        return FakeAcquisitionSource.tdf()
            .frame(1, 0, 0, 6.0, 4)
            .frame(2, 0, 0, 12.0, 4)
            .frame(3, 0, 0, 18.0, 4)
            .scan(1, 0, new double[]{100.0}, new double[]{1.0})
            .scan(3, 0, new double[]{120.0}, new double[]{2.0});
    }

    private static int execute(String... args) {
        return new CommandLine(new TimsMain()).execute(args);
    }

    @Test
    public void convertsIntoOutputDirectory() throws IOException {
        FakeAcquisitionSource source = ms1Run();
        Path input = registeredRun(source);
        Path outDir = tempDir.resolve("converted");

        int exitCode = execute("convert", input.toString(), "-o", outDir.toString(), "--exclude-mobility");

        assertEquals(0, exitCode);
        String stdout = new String(out.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(stdout.contains("Schema: TDF, 3 frames"));
        assertTrue(stdout.contains("Wrote 2 spectra"));
        assertTrue(stdout.contains("Done!"));
        assertTrue(source.isClosed());

        MSExperiment exp = new MzMLReader().read(outDir.resolve("run.mzML"));
        assertEquals(2, exp.getSpectrumCount());
        assertEquals(2, exp.getDeclaredSpectrumCount());
        assertEquals(0, exp.countSpectraWithMobility());
    }

    @Test
    public void outputDefaultsToInputDirectory() throws IOException {
        Path input = registeredRun(ms1Run());

        int exitCode = execute("convert", input.toString(), "--outfile", "named.mzML",
            "--encoding", "32", "--compression", "none", "--source-type", "fake");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(tempDir.resolve("named.mzML")));
    }

    @Test
    public void missingInputFails() {
        int exitCode = execute("convert", tempDir.resolve("absent.d").toString());

        assertEquals(1, exitCode);
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("Error: Input not found"));
    }

    @Test
    public void invalidOptionValueFails() throws IOException {
        Path input = registeredRun(ms1Run());

        assertEquals(1, execute("convert", input.toString(), "--mode", "smoothed"));
        assertEquals(1, execute("convert", input.toString(), "--encoding", "16"));
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("Error: Invalid option"));
    }

    @Test
    public void unknownSourceProviderFails() throws IOException {
        Path input = registeredRun(ms1Run());

        int exitCode = execute("convert", input.toString(), "--source-type", "thermo");

        assertEquals(1, exitCode);
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8)
            .contains("No acquisition source provider named thermo"));
    }

    @Test
    public void sourceFaultFailsTheCommand() throws IOException {
        Path input = registeredRun(ms1Run().failOn(2));

        int exitCode = execute("convert", input.toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(tempDir.resolve("run.mzML")));
        assertTrue(Files.exists(tempDir.resolve("run_tmp.mzML")));
    }

    @Test
    public void infoSummarizesConvertedFile() throws IOException {
        Path input = registeredRun(ms1Run());
        assertEquals(0, execute("convert", input.toString()));
        out.reset();

        int exitCode = execute("info", tempDir.resolve("run.mzML").toString(), "--detailed");

        assertEquals(0, exitCode);
        String stdout = new String(out.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(stdout.contains("Spectra: 2"));
        assertTrue(stdout.contains("Declared spectra: 2"));
        assertTrue(stdout.contains("With ion mobility: 2"));
        assertTrue(stdout.contains("MS1: 2 spectra"));
        assertTrue(stdout.contains("MS/MS spectra linked to a parent: 0"));
    }

    @Test
    public void infoRejectsOtherFormats() throws IOException {
        Path file = Files.createFile(tempDir.resolve("run.mzXML"));

        assertEquals(1, execute("info", file.toString()));
    }
}
