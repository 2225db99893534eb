package org.tims.io;

import com.sun.xml.txw2.output.IndentingXMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.core.Spectrum;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.tims.io.MzMLElements.cvParam;

/**
 * Streams spectra into an mzML 1.1 file.
 * <p>
 * The document is written to {@code <name>_tmp.mzML} next to the output and only
 * moved to its final name by {@link #finish(int)}. When fewer spectra were written
 * than declared, the spectrum list count is rewritten into a second temporary
 * file, which then replaces the output.
 */
public class MzMLWriter implements SpectrumSink {
    private static final Logger LOG = LoggerFactory.getLogger(MzMLWriter.class);

    private final Path output;
    private final Path tempOutput;
    private final BinaryDataCodec codec;

    private OutputStream stream;
    private XMLStreamWriter xml;
    private int declaredCount = -1;
    private int index;

    public MzMLWriter(Path output, BinaryDataCodec codec) {
        this.output = output;
        this.tempOutput = tempPathFor(output);
        this.codec = codec;
    }

    public static Path tempPathFor(Path output) {
        String name = MzMLElements.stem(output.getFileName().toString()) + "_tmp.mzML";
        return output.resolveSibling(name);
    }

    public Path getOutput() { return output; }
    public Path getTempOutput() { return tempOutput; }

    /** Where the temporary document is copied when its spectrum count is corrected. */
    Path getRewriteOutput() {
        return output.resolveSibling(MzMLElements.stem(output.getFileName().toString()) + "_count_tmp.mzML");
    }

    @Override
    public void writeMetadata(RunMetadata metadata) throws IOException {
        if (xml != null) {
            throw new IllegalStateException("Metadata already written");
        }
        stream = new BufferedOutputStream(Files.newOutputStream(tempOutput));
        try {
            xml = new IndentingXMLStreamWriter(XMLOutputFactory.newInstance().createXMLStreamWriter(stream, "UTF-8"));
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("mzML");
            xml.writeDefaultNamespace(MzMLElements.MZML_NAMESPACE);
            xml.writeAttribute("id", MzMLElements.stem(output.getFileName().toString()));
            xml.writeAttribute("version", "1.1.0");

            MzMLElements.cvList(xml, false);
            xml.writeStartElement("fileDescription");
            xml.writeStartElement("fileContent");
            MzMLElements.fileContent(xml, metadata);
            xml.writeEndElement();
            MzMLElements.sourceFileList(xml, metadata);
            xml.writeEndElement();
            MzMLElements.softwareList(xml, metadata);
            MzMLElements.instrumentConfigurationList(xml, metadata);
            MzMLElements.dataProcessingList(xml);
        } catch (XMLStreamException e) {
            throw new IOException("Could not write mzML header to " + tempOutput, e);
        }
    }

    @Override
    public void beginSpectrumList(int declaredCount) throws IOException {
        requireOpen();
        this.declaredCount = declaredCount;
        try {
            xml.writeStartElement("run");
            xml.writeAttribute("id", "run");
            xml.writeAttribute("defaultInstrumentConfigurationRef", MzMLElements.INSTRUMENT_ID);
            xml.writeStartElement("spectrumList");
            xml.writeAttribute("count", Integer.toString(declaredCount));
            xml.writeAttribute("defaultDataProcessingRef", MzMLElements.DATA_PROCESSING_ID);
        } catch (XMLStreamException e) {
            throw new IOException("Could not start spectrum list in " + tempOutput, e);
        }
    }

    @Override
    public void writeSpectrum(Spectrum s) throws IOException {
        requireOpen();
        if (declaredCount < 0) {
            throw new IllegalStateException("Spectrum list not started");
        }
        try {
            xml.writeStartElement("spectrum");
            xml.writeAttribute("index", Integer.toString(index++));
            xml.writeAttribute("id", s.getNativeId());
            xml.writeAttribute("defaultArrayLength", Integer.toString(s.size()));
            MzMLElements.spectrumParams(xml, s);

            xml.writeStartElement("scanList");
            xml.writeAttribute("count", "1");
            cvParam(xml, "MS:1000795", "no combination");
            xml.writeStartElement("scan");
            MzMLElements.scanStartTime(xml, s);
            xml.writeEndElement();
            xml.writeEndElement();

            MzMLElements.precursorList(xml, s);

            xml.writeStartElement("binaryDataArrayList");
            xml.writeAttribute("count", s.hasMobility() ? "3" : "2");
            binaryDataArray(s.getMz(), "MS:1000514", "m/z array", MzMLElements.MZ_UNIT, "m/z");
            binaryDataArray(s.getIntensity(), "MS:1000515", "intensity array",
                MzMLElements.COUNTS_UNIT, "number of detector counts");
            if (s.hasMobility()) {
                binaryDataArray(s.getMobility(), "MS:1002816", "mean inverse reduced ion mobility array",
                    MzMLElements.MOBILITY_UNIT, "volt-second per square centimeter");
            }
            xml.writeEndElement();

            xml.writeEndElement();
        } catch (XMLStreamException e) {
            throw new IOException("Could not write " + s.getNativeId() + " to " + tempOutput, e);
        }
    }

    private void binaryDataArray(double[] values, String accession, String name,
                                 String unitAccession, String unitName) throws XMLStreamException {
        String encoded = codec.encode(values);
        xml.writeStartElement("binaryDataArray");
        xml.writeAttribute("encodedLength", Integer.toString(encoded.length()));
        cvParam(xml, codec.getPrecisionAccession(), codec.getPrecisionName());
        cvParam(xml, codec.getCompression().getAccession(), codec.getCompression().getCvName());
        cvParam(xml, accession, name, null, unitAccession, unitName);
        xml.writeStartElement("binary");
        xml.writeCharacters(encoded);
        xml.writeEndElement();
        xml.writeEndElement();
    }

    @Override
    public boolean finish(int actualCount) throws IOException {
        requireOpen();
        try {
            xml.writeEndElement(); // spectrumList
            xml.writeEndElement(); // run
            xml.writeEndElement(); // mzML
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Could not complete " + tempOutput, e);
        } finally {
            xml = null;
            stream.close();
        }

        if (actualCount == declaredCount) {
            Files.move(tempOutput, output, StandardCopyOption.REPLACE_EXISTING);
            return false;
        }
        rewriteSpectrumCount(actualCount);
        return true;
    }

    private void rewriteSpectrumCount(int actualCount) throws IOException {
        String declared = "<spectrumList count=\"" + declaredCount + "\"";
        String actual = "<spectrumList count=\"" + actualCount + "\"";
        Path rewritten = getRewriteOutput();
        boolean replaced = false;
        try {
            try (BufferedReader in = Files.newBufferedReader(tempOutput, StandardCharsets.UTF_8);
                 BufferedWriter out = Files.newBufferedWriter(rewritten, StandardCharsets.UTF_8)) {
                String line;
                while ((line = in.readLine()) != null) {
                    if (!replaced && line.contains(declared)) {
                        line = line.replace(declared, actual);
                        replaced = true;
                    }
                    out.write(line);
                    out.newLine();
                }
            }
            if (!replaced) {
                throw new IOException("Spectrum list element not found in " + tempOutput);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(rewritten);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        moveIntoPlace(rewritten);
        Files.delete(tempOutput);
    }

    private void moveIntoPlace(Path source) throws IOException {
        try {
            Files.move(source, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void abort() {
        if (xml == null) {
            return;
        }
        try {
            xml.flush();
            xml.close();
            stream.close();
        } catch (XMLStreamException | IOException e) {
            LOG.warn("Could not close {}: {}", tempOutput, e.getMessage());
        } finally {
            xml = null;
        }
        LOG.warn("Conversion stopped, partial output left at {}", tempOutput);
    }

    private void requireOpen() {
        if (xml == null) {
            throw new IllegalStateException("mzML document is not open");
        }
    }
}
