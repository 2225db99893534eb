package org.tims.io;

import com.sun.xml.txw2.output.IndentingXMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.core.Polarity;
import org.tims.core.Precursor;
import org.tims.core.Spectrum;
import org.tims.core.SpectrumType;
import org.tims.core.SpotCoordinate;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import static org.tims.io.MzMLElements.cvParam;

/**
 * Writes imaging spectra as an imzML document with its {@code .ibd} binary companion.
 * <p>
 * Binary arrays are streamed into the {@code .ibd} file as spectra arrive; the XML
 * part only needs offsets and coordinates, so it is written once by
 * {@link #finish(int)} with the exact spectrum count. Both files live under
 * {@code _tmp} names until then.
 */
public class ImzMLWriter implements SpectrumSink {
    private static final Logger LOG = LoggerFactory.getLogger(ImzMLWriter.class);

    private static final String IBD_UUID = "IMS:1000080";
    private static final String IBD_SHA1 = "IMS:1000091";

    private final Path output;
    private final Path binaryOutput;
    private final Path tempOutput;
    private final Path tempBinaryOutput;
    private final BinaryDataCodec codec;
    private final ImzMLMode mode;

    private final List<Entry> entries = new ArrayList<>();
    private RunMetadata metadata;
    private UUID uuid;
    private MessageDigest digest;
    private OutputStream ibd;
    private long offset;
    private int declaredCount = -1;
    private boolean hasMobility;

    // continuous mode shares the first m/z array
    private double[] sharedMz;
    private ArrayRef sharedMzRef;

    public ImzMLWriter(Path output, BinaryDataCodec codec, ImzMLMode mode) {
        String stem = MzMLElements.stem(output.getFileName().toString());
        this.output = output;
        this.binaryOutput = output.resolveSibling(stem + ".ibd");
        this.tempOutput = output.resolveSibling(stem + "_tmp.imzML");
        this.tempBinaryOutput = output.resolveSibling(stem + "_tmp.ibd");
        this.codec = codec;
        this.mode = mode;
    }

    public Path getOutput() { return output; }
    public Path getBinaryOutput() { return binaryOutput; }

    @Override
    public void writeMetadata(RunMetadata metadata) throws IOException {
        if (ibd != null) {
            throw new IllegalStateException("Metadata already written");
        }
        this.metadata = metadata;
        try {
            digest = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("SHA-1 digest unavailable", e);
        }
        uuid = UUID.randomUUID();
        ibd = new DigestOutputStream(new BufferedOutputStream(Files.newOutputStream(tempBinaryOutput)), digest);
        ByteBuffer header = ByteBuffer.allocate(16);
        header.putLong(uuid.getMostSignificantBits());
        header.putLong(uuid.getLeastSignificantBits());
        ibd.write(header.array());
        offset = 16;
    }

    @Override
    public void beginSpectrumList(int declaredCount) {
        requireOpen();
        this.declaredCount = declaredCount;
    }

    @Override
    public void writeSpectrum(Spectrum s) throws IOException {
        requireOpen();
        SpotCoordinate coordinate = s.getCoordinate();
        if (coordinate == null || !coordinate.isPixel()) {
            throw new IOException("Spectrum " + s.getNativeId() + " has no pixel coordinate");
        }

        ArrayRef mzRef;
        if (mode == ImzMLMode.CONTINUOUS) {
            if (sharedMz == null) {
                sharedMz = s.getMz();
                sharedMzRef = append(s.getMz());
            } else if (!Arrays.equals(sharedMz, s.getMz())) {
                throw new IOException("Continuous imzML needs identical m/z arrays, " + s.getNativeId()
                    + " has " + s.size() + " points against " + sharedMz.length);
            }
            mzRef = sharedMzRef;
        } else {
            mzRef = append(s.getMz());
        }
        ArrayRef intensityRef = append(s.getIntensity());
        ArrayRef mobilityRef = null;
        if (s.hasMobility()) {
            mobilityRef = append(s.getMobility());
            hasMobility = true;
        }
        entries.add(new Entry(s, mzRef, intensityRef, mobilityRef));
    }

    private ArrayRef append(double[] values) throws IOException {
        byte[] bytes = codec.toBytes(values);
        ibd.write(bytes);
        ArrayRef ref = new ArrayRef(offset, values.length, bytes.length);
        offset += bytes.length;
        return ref;
    }

    @Override
    public boolean finish(int actualCount) throws IOException {
        requireOpen();
        ibd.close();
        ibd = null;
        String sha1 = HexFormat.of().withUpperCase().formatHex(digest.digest());

        try (OutputStream stream = new BufferedOutputStream(Files.newOutputStream(tempOutput))) {
            XMLStreamWriter xml = new IndentingXMLStreamWriter(
                XMLOutputFactory.newInstance().createXMLStreamWriter(stream, "UTF-8"));
            writeDocument(xml, sha1);
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Could not write imzML to " + tempOutput, e);
        }

        Files.move(tempBinaryOutput, binaryOutput, StandardCopyOption.REPLACE_EXISTING);
        Files.move(tempOutput, output, StandardCopyOption.REPLACE_EXISTING);
        LOG.debug("Wrote {} imaging spectra ({} bytes of binary data)", entries.size(), offset);
        return actualCount != declaredCount;
    }

    private void writeDocument(XMLStreamWriter xml, String sha1) throws XMLStreamException {
        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeStartElement("mzML");
        xml.writeDefaultNamespace(MzMLElements.MZML_NAMESPACE);
        xml.writeAttribute("version", "1.1");

        MzMLElements.cvList(xml, true);

        xml.writeStartElement("fileDescription");
        xml.writeStartElement("fileContent");
        MzMLElements.fileContent(xml, metadata);
        cvParam(xml, IBD_UUID, "universally unique identifier", "{" + uuid + "}");
        cvParam(xml, IBD_SHA1, "ibd SHA-1", sha1);
        cvParam(xml, mode.getAccession(), mode.getCvName());
        xml.writeEndElement();
        MzMLElements.sourceFileList(xml, metadata);
        xml.writeEndElement();

        writeParamGroups(xml);
        MzMLElements.softwareList(xml, metadata);
        writeScanSettings(xml);
        MzMLElements.instrumentConfigurationList(xml, metadata);
        MzMLElements.dataProcessingList(xml);

        xml.writeStartElement("run");
        xml.writeAttribute("id", "run");
        xml.writeAttribute("defaultInstrumentConfigurationRef", MzMLElements.INSTRUMENT_ID);
        xml.writeStartElement("spectrumList");
        xml.writeAttribute("count", Integer.toString(entries.size()));
        xml.writeAttribute("defaultDataProcessingRef", MzMLElements.DATA_PROCESSING_ID);
        for (int i = 0; i < entries.size(); i++) {
            writeSpectrum(xml, i, entries.get(i));
        }
        xml.writeEndElement();
        xml.writeEndElement();

        xml.writeEndElement();
        xml.writeEndDocument();
    }

    private void writeParamGroups(XMLStreamWriter xml) throws XMLStreamException {
        xml.writeStartElement("referenceableParamGroupList");
        xml.writeAttribute("count", hasMobility ? "3" : "2");
        paramGroup(xml, "mzArray", "MS:1000514", "m/z array", MzMLElements.MZ_UNIT, "m/z");
        paramGroup(xml, "intensityArray", "MS:1000515", "intensity array",
            MzMLElements.COUNTS_UNIT, "number of detector counts");
        if (hasMobility) {
            paramGroup(xml, "mobilityArray", "MS:1002816", "mean inverse reduced ion mobility array",
                MzMLElements.MOBILITY_UNIT, "volt-second per square centimeter");
        }
        xml.writeEndElement();
    }

    private void paramGroup(XMLStreamWriter xml, String id, String accession, String name,
                            String unitAccession, String unitName) throws XMLStreamException {
        xml.writeStartElement("referenceableParamGroup");
        xml.writeAttribute("id", id);
        cvParam(xml, accession, name, null, unitAccession, unitName);
        cvParam(xml, codec.getPrecisionAccession(), codec.getPrecisionName());
        cvParam(xml, codec.getCompression().getAccession(), codec.getCompression().getCvName());
        cvParam(xml, "IMS:1000101", "external data", "true");
        xml.writeEndElement();
    }

    private void writeScanSettings(XMLStreamWriter xml) throws XMLStreamException {
        int maxX = 0;
        int maxY = 0;
        for (Entry entry : entries) {
            maxX = Math.max(maxX, entry.coordinate.getX());
            maxY = Math.max(maxY, entry.coordinate.getY());
        }
        xml.writeStartElement("scanSettingsList");
        xml.writeAttribute("count", "1");
        xml.writeStartElement("scanSettings");
        xml.writeAttribute("id", "scanSettings");
        cvParam(xml, "IMS:1000042", "max count of pixels x", maxX);
        cvParam(xml, "IMS:1000043", "max count of pixels y", maxY);
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void writeSpectrum(XMLStreamWriter xml, int index, Entry e) throws XMLStreamException {
        xml.writeStartElement("spectrum");
        xml.writeAttribute("index", Integer.toString(index));
        xml.writeAttribute("id", "scan=" + e.scanNumber);
        xml.writeAttribute("defaultArrayLength", "0");

        cvParam(xml, e.msLevel == 1 ? "MS:1000579" : "MS:1000580", e.msLevel == 1 ? "MS1 spectrum" : "MSn spectrum");
        cvParam(xml, "MS:1000511", "ms level", e.msLevel);
        cvParam(xml, e.type.getAccession(), e.type.getCvName());
        if (e.polarity.getAccession() != null) {
            cvParam(xml, e.polarity.getAccession(), e.polarity.getCvName());
        }
        cvParam(xml, "MS:1000285", "total ion current", e.tic);

        xml.writeStartElement("scanList");
        xml.writeAttribute("count", "1");
        cvParam(xml, "MS:1000795", "no combination");
        xml.writeStartElement("scan");
        xml.writeAttribute("instrumentConfigurationRef", MzMLElements.INSTRUMENT_ID);
        cvParam(xml, "IMS:1000050", "position x", e.coordinate.getX());
        cvParam(xml, "IMS:1000051", "position y", e.coordinate.getY());
        if (e.coordinate.hasZ()) {
            cvParam(xml, "IMS:1000052", "position z", e.coordinate.getZ());
        }
        xml.writeEndElement();
        xml.writeEndElement();

        MzMLElements.precursorList(xml, e.msLevel, e.precursor, e.parentScanNumber, e.ms2NoPrecursor);

        xml.writeStartElement("binaryDataArrayList");
        xml.writeAttribute("count", e.mobility != null ? "3" : "2");
        externalArray(xml, "mzArray", e.mz);
        externalArray(xml, "intensityArray", e.intensity);
        if (e.mobility != null) {
            externalArray(xml, "mobilityArray", e.mobility);
        }
        xml.writeEndElement();

        xml.writeEndElement();
    }

    private void externalArray(XMLStreamWriter xml, String group, ArrayRef ref) throws XMLStreamException {
        xml.writeStartElement("binaryDataArray");
        xml.writeAttribute("encodedLength", "0");
        xml.writeEmptyElement("referenceableParamGroupRef");
        xml.writeAttribute("ref", group);
        cvParam(xml, "IMS:1000102", "external offset", ref.offset);
        cvParam(xml, "IMS:1000103", "external array length", ref.length);
        cvParam(xml, "IMS:1000104", "external encoded length", ref.encodedLength);
        xml.writeEmptyElement("binary");
        xml.writeEndElement();
    }

    @Override
    public void abort() {
        if (ibd == null) {
            return;
        }
        try {
            ibd.close();
        } catch (IOException e) {
            LOG.warn("Could not close {}: {}", tempBinaryOutput, e.getMessage());
        } finally {
            ibd = null;
        }
        LOG.warn("Conversion stopped, partial binary data left at {}", tempBinaryOutput);
    }

    private void requireOpen() {
        if (ibd == null) {
            throw new IllegalStateException("imzML output is not open");
        }
    }

    private static final class ArrayRef {
        final long offset;
        final int length;
        final int encodedLength;

        ArrayRef(long offset, int length, int encodedLength) {
            this.offset = offset;
            this.length = length;
            this.encodedLength = encodedLength;
        }
    }

    /** What the XML part needs once the arrays are on disk. */
    private static final class Entry {
        final int scanNumber;
        final int msLevel;
        final SpectrumType type;
        final Polarity polarity;
        final double tic;
        final SpotCoordinate coordinate;
        final Precursor precursor;
        final Integer parentScanNumber;
        final boolean ms2NoPrecursor;
        final ArrayRef mz;
        final ArrayRef intensity;
        final ArrayRef mobility;

        Entry(Spectrum s, ArrayRef mz, ArrayRef intensity, ArrayRef mobility) {
            this.scanNumber = s.getScanNumber();
            this.msLevel = s.getMsLevel();
            this.type = s.getType();
            this.polarity = s.getPolarity();
            this.tic = s.getTic();
            this.coordinate = s.getCoordinate();
            this.precursor = s.getPrecursor();
            this.parentScanNumber = s.getParentScanNumber();
            this.ms2NoPrecursor = s.isMs2NoPrecursor();
            this.mz = mz;
            this.intensity = intensity;
            this.mobility = mobility;
        }
    }
}
