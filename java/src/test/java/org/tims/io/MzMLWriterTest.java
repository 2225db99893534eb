package org.tims.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tims.core.MSExperiment;
import org.tims.core.Polarity;
import org.tims.core.Precursor;
import org.tims.core.Schema;
import org.tims.core.Spectrum;
import org.tims.core.SpectrumType;
import org.tims.core.SpotCoordinate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MzMLWriterTest {

    private static final double DELTA = 1e-9;

    @TempDir
    Path tempDir;

    private RunMetadata metadata(boolean withSoftware) {
        RunMetadata.Builder b = RunMetadata.builder()
            .sourcePath(tempDir.resolve("sample.d"))
            .schema(Schema.TDF)
            .instrumentSourceType("3");
        if (withSoftware) {
            b.acquisitionSoftware("timsTOF control", "4.1");
        }
        return b.build();
    }

    private static Spectrum ms1(int scan) {
        return Spectrum.builder()
            .frame(scan)
            .polarity(Polarity.POSITIVE)
            .retentionTime(0.5 * scan)
            .data(new double[]{100.0, 200.5, 300.25}, new double[]{10.0, 40.0, 20.0})
            .mobility(new double[]{0.8, 0.9, 1.0})
            .build()
            .withEmission(scan, null);
    }

    private static Spectrum product(int scan, int parentScan) {
        Precursor precursor = Precursor.builder()
            .targetMz(650.3)
            .isolationWidth(2.0)
            .selectedIonMz(650.1)
            .selectedIonIntensity(1000.0)
            .selectedIonMobility(1.2)
            .selectedIonCcs(410.5)
            .charge(2)
            .collisionEnergy(30.0)
            .build();
        return Spectrum.builder()
            .frame(scan)
            .msLevel(2)
            .polarity(Polarity.NEGATIVE)
            .precursor(precursor)
            .data(new double[]{150.0, 250.0}, new double[]{1.0, 2.0})
            .build()
            .withEmission(scan, parentScan);
    }

    @Test
    public void writtenFileReadsBack() throws IOException {
        Path output = tempDir.resolve("sample.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(64, Compression.ZLIB));

        writer.writeMetadata(metadata(true));
        writer.beginSpectrumList(2);
        writer.writeSpectrum(ms1(1));
        writer.writeSpectrum(product(2, 1));
        assertFalse(writer.finish(2));

        assertTrue(Files.exists(output));
        assertFalse(Files.exists(writer.getTempOutput()));

        MSExperiment exp = new MzMLReader().read(output);
        assertEquals(2, exp.getDeclaredSpectrumCount());
        assertEquals(2, exp.getSpectrumCount());
        assertEquals("timsTOF control", exp.getSoftware());

        Spectrum first = exp.getSpectrum(0);
        assertEquals(1, first.getScanNumber());
        assertEquals(1, first.getMsLevel());
        assertEquals(Polarity.POSITIVE, first.getPolarity());
        assertEquals(SpectrumType.CENTROID, first.getType());
        assertEquals(0.5, first.getRetentionTime(), DELTA);
        assertArrayEquals(new double[]{100.0, 200.5, 300.25}, first.getMz(), DELTA);
        assertArrayEquals(new double[]{10.0, 40.0, 20.0}, first.getIntensity(), DELTA);
        assertArrayEquals(new double[]{0.8, 0.9, 1.0}, first.getMobility(), DELTA);

        Spectrum second = exp.getSpectrum(1);
        assertEquals(2, second.getMsLevel());
        assertEquals(Polarity.NEGATIVE, second.getPolarity());
        assertEquals(Integer.valueOf(1), second.getParentScanNumber());
        assertFalse(second.hasMobility());
        Precursor precursor = second.getPrecursor();
        assertEquals(650.3, precursor.getTargetMz(), DELTA);
        assertEquals(1.0, precursor.getIsolationLowerOffset(), DELTA);
        assertEquals(1.0, precursor.getIsolationUpperOffset(), DELTA);
        assertEquals(650.1, precursor.getSelectedIonMz(), DELTA);
        assertEquals(Integer.valueOf(2), precursor.getCharge());
        assertEquals(1.2, precursor.getSelectedIonMobility(), DELTA);
        assertEquals(410.5, precursor.getSelectedIonCcs(), DELTA);
        assertEquals(30.0, precursor.getCollisionEnergy(), DELTA);
    }

    @Test
    public void documentCarriesRunMetadata() throws IOException {
        Path output = tempDir.resolve("meta.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(32, Compression.NONE));
        writer.writeMetadata(metadata(false));
        writer.beginSpectrumList(0);
        writer.finish(0);

        String xml = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertTrue(xml.contains("MS:1000398"));
        assertTrue(xml.contains("MS:1002817"));
        assertTrue(xml.contains("MS:1000544"));
        assertTrue(xml.contains("<spectrumList count=\"0\""));
        assertFalse(xml.contains("MS:1000692"));
        assertNull(new MzMLReader().read(output).getSoftware());
    }

    @Test
    public void precisionAndCompressionAreHonored() throws IOException {
        Path output = tempDir.resolve("float.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(32, Compression.NONE));
        writer.writeMetadata(metadata(false));
        writer.beginSpectrumList(1);
        writer.writeSpectrum(ms1(1));
        writer.finish(1);

        String xml = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertTrue(xml.contains("MS:1000521"));
        assertTrue(xml.contains("MS:1000576"));
        assertFalse(xml.contains("MS:1000574"));

        Spectrum read = new MzMLReader().read(output).getSpectrum(0);
        assertEquals(200.5, read.getMzAt(1), 1e-4);
    }

    @Test
    public void declaredCountIsCorrected() throws IOException {
        Path output = tempDir.resolve("short.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(64, Compression.ZLIB));
        writer.writeMetadata(metadata(true));
        writer.beginSpectrumList(3);
        writer.writeSpectrum(ms1(1));
        writer.writeSpectrum(ms1(2));

        assertTrue(writer.finish(2));

        assertFalse(Files.exists(writer.getTempOutput()));
        MSExperiment exp = new MzMLReader().read(output);
        assertEquals(2, exp.getDeclaredSpectrumCount());
        assertEquals(2, exp.getSpectrumCount());
        assertEquals(2, exp.getSpectrum(1).getScanNumber());
    }

    @Test
    public void failedCountRewriteLeavesOnlyTemporaryFile() throws IOException {
        Path output = tempDir.resolve("blocked.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(64, Compression.ZLIB));
        // a directory in the way makes the rewrite fail
        Files.createDirectories(writer.getRewriteOutput().resolve("occupied"));
        writer.writeMetadata(metadata(true));
        writer.beginSpectrumList(3);
        writer.writeSpectrum(ms1(1));

        assertThrows(IOException.class, () -> writer.finish(1));

        assertFalse(Files.exists(output));
        assertTrue(Files.exists(writer.getTempOutput()));
    }

    @Test
    public void abortLeavesTemporaryFile() throws IOException {
        Path output = tempDir.resolve("aborted.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(64, Compression.ZLIB));
        writer.writeMetadata(metadata(true));
        writer.beginSpectrumList(5);
        writer.writeSpectrum(ms1(1));

        writer.abort();

        assertEquals(tempDir.resolve("aborted_tmp.mzML"), writer.getTempOutput());
        assertTrue(Files.exists(writer.getTempOutput()));
        assertFalse(Files.exists(output));
    }

    @Test
    public void spectraRequireAnOpenList() throws IOException {
        MzMLWriter writer = new MzMLWriter(tempDir.resolve("x.mzML"), new BinaryDataCodec(64, Compression.ZLIB));
        assertThrows(IllegalStateException.class, () -> writer.writeSpectrum(ms1(1)));

        writer.writeMetadata(metadata(false));
        assertThrows(IllegalStateException.class, () -> writer.writeSpectrum(ms1(1)));
        writer.abort();
    }

    @Test
    public void spotNameIsTheTitle() throws IOException {
        Path output = tempDir.resolve("spots.mzML");
        MzMLWriter writer = new MzMLWriter(output, new BinaryDataCodec(64, Compression.ZLIB));
        writer.writeMetadata(metadata(false));
        writer.beginSpectrumList(1);
        writer.writeSpectrum(Spectrum.builder()
            .coordinate(SpotCoordinate.spot("C12"))
            .data(new double[]{500.0}, new double[]{3.0})
            .build()
            .withEmission(1, null));
        writer.finish(1);

        Spectrum read = new MzMLReader().read(output).getSpectrum(0);
        assertEquals("C12", read.getCoordinate().getSpotName());
        assertEquals(Polarity.UNKNOWN, read.getPolarity());
    }
}
