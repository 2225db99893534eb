package org.tims.io;

import org.tims.core.MSExperiment;
import org.tims.core.Polarity;
import org.tims.core.Precursor;
import org.tims.core.Spectrum;
import org.tims.core.SpectrumType;
import org.tims.core.SpotCoordinate;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reader for the mzML files written by {@link MzMLWriter}.
 */
public class MzMLReader {

    public MSExperiment read(Path file) throws IOException {
        MzMLHandler handler = new MzMLHandler();
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            SAXParser parser = factory.newSAXParser();
            parser.parse(file.toFile(), handler);
        } catch (ParserConfigurationException e) {
            throw new IOException("No XML parser available", e);
        } catch (SAXException e) {
            if (e.getException() instanceof IOException) {
                throw (IOException) e.getException();
            }
            throw new IOException("Malformed mzML " + file + ": " + e.getMessage(), e);
        }

        MSExperiment exp = handler.getExperiment();
        exp.setSourceFile(file.toString());
        return exp;
    }

    private static class MzMLHandler extends DefaultHandler {
        private final MSExperiment experiment;
        private final StringBuilder characterBuffer;

        private Spectrum.Builder currentSpectrum;
        private Precursor.Builder currentPrecursor;
        private Double lowerOffset;
        private Double upperOffset;
        private boolean inSoftware;
        private boolean inBinaryDataArray;

        // Binary data parsing
        private String arrayType;
        private boolean is64Bit;
        private boolean isCompressed;

        private double[] mz;
        private double[] intensity;
        private double[] mobility;

        MzMLHandler() {
            this.experiment = new MSExperiment();
            this.characterBuffer = new StringBuilder();
        }

        MSExperiment getExperiment() {
            return experiment;
        }

        @Override
        public void startElement(String uri, String localName, String qName,
                                 Attributes attributes) throws SAXException {
            characterBuffer.setLength(0);

            switch (localName) {
                case "spectrumList":
                    experiment.setDeclaredSpectrumCount(parseInt(attributes.getValue("count"), -1));
                    break;

                case "software":
                    inSoftware = true;
                    break;

                case "spectrum":
                    currentSpectrum = Spectrum.builder()
                        .scanNumber(scanNumberOf(attributes.getValue("id")));
                    mz = new double[0];
                    intensity = new double[0];
                    mobility = null;
                    break;

                case "precursor":
                    if (currentSpectrum != null) {
                        currentPrecursor = Precursor.builder();
                        lowerOffset = null;
                        upperOffset = null;
                        String ref = attributes.getValue("spectrumRef");
                        if (ref != null) {
                            currentSpectrum.parentScanNumber(scanNumberOf(ref));
                        }
                    }
                    break;

                case "binaryDataArray":
                    inBinaryDataArray = true;
                    arrayType = null;
                    is64Bit = true;
                    isCompressed = false;
                    break;

                case "cvParam":
                    handleCvParam(attributes);
                    break;

                default:
                    break;
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) throws SAXException {
            switch (localName) {
                case "software":
                    inSoftware = false;
                    break;

                case "precursor":
                    if (currentSpectrum != null && currentPrecursor != null) {
                        currentSpectrum.precursor(currentPrecursor.build());
                        currentPrecursor = null;
                    }
                    break;

                case "spectrum":
                    currentSpectrum.data(mz, intensity);
                    if (mobility != null && mobility.length == mz.length) {
                        currentSpectrum.mobility(mobility);
                    }
                    experiment.addSpectrum(currentSpectrum.build());
                    currentSpectrum = null;
                    break;

                case "binaryDataArray":
                    inBinaryDataArray = false;
                    break;

                case "binary":
                    if (inBinaryDataArray && currentSpectrum != null) {
                        storeArray(characterBuffer.toString().replaceAll("\\s", ""));
                    }
                    break;

                default:
                    break;
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            characterBuffer.append(ch, start, length);
        }

        private void storeArray(String base64Data) throws SAXException {
            double[] data;
            try {
                data = base64Data.isEmpty()
                    ? new double[0]
                    : BinaryDataCodec.decode(base64Data, is64Bit, isCompressed);
            } catch (IOException e) {
                throw new SAXException(e);
            }
            if ("MS:1000514".equals(arrayType)) {
                mz = data;
            } else if ("MS:1000515".equals(arrayType)) {
                intensity = data;
            } else if ("MS:1002816".equals(arrayType)) {
                mobility = data;
            }
        }

        private void handleCvParam(Attributes attrs) {
            String accession = attrs.getValue("accession");
            String value = attrs.getValue("value");
            String unitAccession = attrs.getValue("unitAccession");

            if (accession == null) return;

            if (inSoftware && "MS:1000692".equals(accession)) {
                experiment.setSoftware(value);
            } else if (inBinaryDataArray) {
                switch (accession) {
                    case "MS:1000514":
                    case "MS:1000515":
                    case "MS:1002816":
                        arrayType = accession;
                        break;
                    case "MS:1000523": is64Bit = true; break;
                    case "MS:1000521": is64Bit = false; break;
                    case "MS:1000574": isCompressed = true; break;
                    case "MS:1000576": isCompressed = false; break;
                    default: break;
                }
            } else if (currentPrecursor != null) {
                handlePrecursorParam(accession, value);
            } else if (currentSpectrum != null) {
                switch (accession) {
                    case "MS:1000511": // MS level
                        currentSpectrum.msLevel(Integer.parseInt(value));
                        break;
                    case "MS:1000128":
                        currentSpectrum.type(SpectrumType.PROFILE);
                        break;
                    case "MS:1000127":
                        currentSpectrum.type(SpectrumType.CENTROID);
                        break;
                    case "MS:1000130":
                        currentSpectrum.polarity(Polarity.POSITIVE);
                        break;
                    case "MS:1000129":
                        currentSpectrum.polarity(Polarity.NEGATIVE);
                        break;
                    case "MS:1000016": // Scan start time
                        double rt = Double.parseDouble(value);
                        if ("UO:0000010".equals(unitAccession)) {
                            rt /= 60; // seconds to minutes
                        }
                        currentSpectrum.retentionTime(rt);
                        break;
                    case "MS:1000796": // Spectrum title
                        if (value != null && !value.isEmpty()) {
                            currentSpectrum.coordinate(SpotCoordinate.spot(value));
                        }
                        break;
                    default:
                        break;
                }
            }
        }

        private void handlePrecursorParam(String accession, String value) {
            switch (accession) {
                case "MS:1000827":
                    currentPrecursor.targetMz(Double.parseDouble(value));
                    break;
                case "MS:1000828":
                    lowerOffset = Double.parseDouble(value);
                    currentPrecursor.isolationOffsets(lowerOffset, upperOffset);
                    break;
                case "MS:1000829":
                    upperOffset = Double.parseDouble(value);
                    currentPrecursor.isolationOffsets(lowerOffset, upperOffset);
                    break;
                case "MS:1000744":
                    currentPrecursor.selectedIonMz(Double.parseDouble(value));
                    break;
                case "MS:1000041":
                    currentPrecursor.charge(Integer.parseInt(value));
                    break;
                case "MS:1000042":
                    currentPrecursor.selectedIonIntensity(Double.parseDouble(value));
                    break;
                case "MS:1002815":
                    currentPrecursor.selectedIonMobility(Double.parseDouble(value));
                    break;
                case "MS:1002954":
                    currentPrecursor.selectedIonCcs(Double.parseDouble(value));
                    break;
                case "MS:1000045":
                    currentPrecursor.collisionEnergy(Double.parseDouble(value));
                    break;
                default:
                    break;
            }
        }

        private static int scanNumberOf(String nativeId) {
            if (nativeId == null) return 0;
            int eq = nativeId.lastIndexOf('=');
            return parseInt(eq >= 0 ? nativeId.substring(eq + 1) : nativeId, 0);
        }

        private static int parseInt(String value, int fallback) {
            if (value == null) return fallback;
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
    }
}
