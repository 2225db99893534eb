package org.tims.io;

import org.tims.core.Precursor;
import org.tims.core.Spectrum;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Elements shared by the mzML and imzML writers.
 */
final class MzMLElements {
    static final String MZML_NAMESPACE = "http://psi.hupo.org/ms/mzml";
    static final String SOFTWARE_ID = "tims-toolkit";
    static final String SOFTWARE_VERSION = "1.0.0";
    static final String DATA_PROCESSING_ID = "exportation";
    static final String INSTRUMENT_ID = "instrument";

    static final String MZ_UNIT = "MS:1000040";
    static final String COUNTS_UNIT = "MS:1000131";
    static final String MOBILITY_UNIT = "MS:1002814";

    private MzMLElements() {
    }

    static void cvList(XMLStreamWriter w, boolean imaging) throws XMLStreamException {
        w.writeStartElement("cvList");
        w.writeAttribute("count", imaging ? "3" : "2");
        cv(w, "MS", "Proteomics Standards Initiative Mass Spectrometry Ontology", "4.1.30",
            "https://raw.githubusercontent.com/HUPO-PSI/psi-ms-CV/master/psi-ms.obo");
        cv(w, "UO", "Unit Ontology", "09:04:2014",
            "https://raw.githubusercontent.com/bio-ontology-research-group/unit-ontology/master/unit.obo");
        if (imaging) {
            cv(w, "IMS", "Mass Spectrometry Imaging Ontology", "1.1.0",
                "https://raw.githubusercontent.com/imzML/imzML/master/imagingMS.obo");
        }
        w.writeEndElement();
    }

    private static void cv(XMLStreamWriter w, String id, String fullName, String version, String uri)
            throws XMLStreamException {
        w.writeEmptyElement("cv");
        w.writeAttribute("id", id);
        w.writeAttribute("fullName", fullName);
        w.writeAttribute("version", version);
        w.writeAttribute("URI", uri);
    }

    static void cvParam(XMLStreamWriter w, String accession, String name) throws XMLStreamException {
        cvParam(w, accession, name, null, null, null);
    }

    static void cvParam(XMLStreamWriter w, String accession, String name, Object value) throws XMLStreamException {
        cvParam(w, accession, name, value, null, null);
    }

    static void cvParam(XMLStreamWriter w, String accession, String name, Object value,
                        String unitAccession, String unitName) throws XMLStreamException {
        w.writeEmptyElement("cvParam");
        w.writeAttribute("cvRef", accession.substring(0, accession.indexOf(':')));
        w.writeAttribute("accession", accession);
        w.writeAttribute("name", name);
        w.writeAttribute("value", value == null ? "" : String.valueOf(value));
        if (unitAccession != null) {
            w.writeAttribute("unitCvRef", unitAccession.substring(0, unitAccession.indexOf(':')));
            w.writeAttribute("unitAccession", unitAccession);
            w.writeAttribute("unitName", unitName);
        }
    }

    static void fileContent(XMLStreamWriter w, RunMetadata metadata) throws XMLStreamException {
        if (metadata.includesMs1()) {
            cvParam(w, "MS:1000579", "MS1 spectrum");
        }
        cvParam(w, "MS:1000580", "MSn spectrum");
        cvParam(w, metadata.getSpectrumType().getAccession(), metadata.getSpectrumType().getCvName());
    }

    static void sourceFileList(XMLStreamWriter w, RunMetadata metadata) throws XMLStreamException {
        String name = metadata.getSourcePath().getFileName().toString();
        String location = metadata.getSourcePath().toAbsolutePath().getParent() == null
            ? "" : metadata.getSourcePath().toAbsolutePath().getParent().toUri().toString();
        w.writeStartElement("sourceFileList");
        w.writeAttribute("count", "1");
        w.writeStartElement("sourceFile");
        w.writeAttribute("id", stem(name));
        w.writeAttribute("name", name);
        w.writeAttribute("location", location);
        cvParam(w, metadata.getSchema().getNativeIdAccession(), metadata.getSchema().getNativeIdName());
        cvParam(w, metadata.getSchema().getFileFormatAccession(), metadata.getSchema().getFileFormatName());
        w.writeEndElement();
        w.writeEndElement();
    }

    static void softwareList(XMLStreamWriter w, RunMetadata metadata) throws XMLStreamException {
        w.writeStartElement("softwareList");
        w.writeAttribute("count", metadata.hasAcquisitionSoftware() ? "2" : "1");
        if (metadata.hasAcquisitionSoftware()) {
            w.writeStartElement("software");
            w.writeAttribute("id", "acquisition");
            w.writeAttribute("version", nullToEmpty(metadata.getAcquisitionSoftwareVersion()));
            cvParam(w, "MS:1000692", "Bruker software", metadata.getAcquisitionSoftware());
            w.writeEndElement();
        }
        w.writeStartElement("software");
        w.writeAttribute("id", SOFTWARE_ID);
        w.writeAttribute("version", SOFTWARE_VERSION);
        cvParam(w, "MS:1000799", "custom unreleased software tool", SOFTWARE_ID);
        w.writeEndElement();
        w.writeEndElement();
    }

    static void instrumentConfigurationList(XMLStreamWriter w, RunMetadata metadata) throws XMLStreamException {
        String[] ionSource = metadata.getIonSourceTerm();
        w.writeStartElement("instrumentConfigurationList");
        w.writeAttribute("count", "1");
        w.writeStartElement("instrumentConfiguration");
        w.writeAttribute("id", INSTRUMENT_ID);
        w.writeStartElement("componentList");
        w.writeAttribute("count", "3");
        w.writeStartElement("source");
        w.writeAttribute("order", "1");
        cvParam(w, ionSource[0], ionSource[1]);
        w.writeEndElement();
        w.writeStartElement("analyzer");
        w.writeAttribute("order", "2");
        cvParam(w, "MS:1000081", "quadrupole");
        cvParam(w, "MS:1000084", "time-of-flight");
        w.writeEndElement();
        w.writeStartElement("detector");
        w.writeAttribute("order", "3");
        cvParam(w, "MS:1000253", "electron multiplier");
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
    }

    static void dataProcessingList(XMLStreamWriter w) throws XMLStreamException {
        w.writeStartElement("dataProcessingList");
        w.writeAttribute("count", "1");
        w.writeStartElement("dataProcessing");
        w.writeAttribute("id", DATA_PROCESSING_ID);
        w.writeStartElement("processingMethod");
        w.writeAttribute("order", "1");
        w.writeAttribute("softwareRef", SOFTWARE_ID);
        cvParam(w, "MS:1000544", "Conversion to mzML");
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
    }

    /**
     * Spectrum-level parameters: type, MS level, representation, polarity and statistics.
     */
    static void spectrumParams(XMLStreamWriter w, Spectrum s) throws XMLStreamException {
        if (s.getMsLevel() == 1) {
            cvParam(w, "MS:1000579", "MS1 spectrum");
        } else {
            cvParam(w, "MS:1000580", "MSn spectrum");
        }
        cvParam(w, "MS:1000511", "ms level", s.getMsLevel());
        cvParam(w, s.getType().getAccession(), s.getType().getCvName());
        if (s.getPolarity().getAccession() != null) {
            cvParam(w, s.getPolarity().getAccession(), s.getPolarity().getCvName());
        }
        cvParam(w, "MS:1000285", "total ion current", s.getTic());
        cvParam(w, "MS:1000504", "base peak m/z", s.getBasePeakMz(), MZ_UNIT, "m/z");
        cvParam(w, "MS:1000505", "base peak intensity", s.getBasePeakIntensity(),
            COUNTS_UNIT, "number of detector counts");
        cvParam(w, "MS:1000527", "highest observed m/z", s.getMzMax(), MZ_UNIT, "m/z");
        cvParam(w, "MS:1000528", "lowest observed m/z", s.getMzMin(), MZ_UNIT, "m/z");
        if (s.getCoordinate() != null && !s.getCoordinate().isPixel()) {
            cvParam(w, "MS:1000796", "spectrum title", s.getCoordinate().getSpotName());
        }
    }

    static void scanStartTime(XMLStreamWriter w, Spectrum s) throws XMLStreamException {
        cvParam(w, "MS:1000016", "scan start time", s.getRetentionTime(), "UO:0000031", "minute");
    }

    static void precursorList(XMLStreamWriter w, Spectrum s) throws XMLStreamException {
        precursorList(w, s.getMsLevel(), s.getPrecursor(), s.getParentScanNumber(), s.isMs2NoPrecursor());
    }

    static void precursorList(XMLStreamWriter w, int msLevel, Precursor p, Integer parentScanNumber,
                              boolean ms2NoPrecursor) throws XMLStreamException {
        if (msLevel < 2 || p == null) {
            return;
        }
        w.writeStartElement("precursorList");
        w.writeAttribute("count", "1");
        w.writeStartElement("precursor");
        if (parentScanNumber != null) {
            w.writeAttribute("spectrumRef", "scan=" + parentScanNumber);
        }
        if (p.hasIsolationWindow()) {
            w.writeStartElement("isolationWindow");
            cvParam(w, "MS:1000827", "isolation window target m/z", p.getTargetMz(), MZ_UNIT, "m/z");
            if (p.getIsolationLowerOffset() != null) {
                cvParam(w, "MS:1000828", "isolation window lower offset", p.getIsolationLowerOffset(),
                    MZ_UNIT, "m/z");
            }
            if (p.getIsolationUpperOffset() != null) {
                cvParam(w, "MS:1000829", "isolation window upper offset", p.getIsolationUpperOffset(),
                    MZ_UNIT, "m/z");
            }
            w.writeEndElement();
        }
        if (p.getSelectedIonMz() != null && !ms2NoPrecursor) {
            w.writeStartElement("selectedIonList");
            w.writeAttribute("count", "1");
            w.writeStartElement("selectedIon");
            cvParam(w, "MS:1000744", "selected ion m/z", p.getSelectedIonMz(), MZ_UNIT, "m/z");
            if (p.hasCharge()) {
                cvParam(w, "MS:1000041", "charge state", p.getCharge());
            }
            if (p.getSelectedIonIntensity() != null) {
                cvParam(w, "MS:1000042", "peak intensity", p.getSelectedIonIntensity(),
                    COUNTS_UNIT, "number of detector counts");
            }
            if (p.getSelectedIonMobility() != null) {
                cvParam(w, "MS:1002815", "inverse reduced ion mobility", p.getSelectedIonMobility(),
                    MOBILITY_UNIT, "volt-second per square centimeter");
            }
            if (p.getSelectedIonCcs() != null) {
                cvParam(w, "MS:1002954", "collisional cross sectional area", p.getSelectedIonCcs(),
                    "UO:0000324", "square angstrom");
            }
            w.writeEndElement();
            w.writeEndElement();
        }
        w.writeStartElement("activation");
        cvParam(w, "MS:1000133", "collision-induced dissociation");
        if (p.getCollisionEnergy() != null) {
            cvParam(w, "MS:1000045", "collision energy", p.getCollisionEnergy(), "UO:0000266", "electronvolt");
        }
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
