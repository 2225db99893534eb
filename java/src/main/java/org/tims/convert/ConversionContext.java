package org.tims.convert;

import org.tims.source.AcquisitionSource;

/**
 * Collaborators shared by the mode handlers during one run.
 */
public class ConversionContext {
    private final AcquisitionSource source;
    private final ConversionOptions options;
    private final AcquisitionClassifier classifier;
    private final ArrayExtractor extractor;
    private final ScanRecordBuilder recordBuilder;
    private final boolean maldi;

    public ConversionContext(AcquisitionSource source, ConversionOptions options) {
        this.source = source;
        this.options = options;
        this.maldi = source.isMaldi();
        this.classifier = new AcquisitionClassifier(source.getSchema(), maldi);
        this.extractor = new ArrayExtractor(source, options);
        this.recordBuilder = new ScanRecordBuilder(source, options);
    }

    public AcquisitionSource getSource() { return source; }
    public ConversionOptions getOptions() { return options; }
    public AcquisitionClassifier getClassifier() { return classifier; }
    public ArrayExtractor getExtractor() { return extractor; }
    public ScanRecordBuilder getRecordBuilder() { return recordBuilder; }
    public boolean isMaldi() { return maldi; }
}
