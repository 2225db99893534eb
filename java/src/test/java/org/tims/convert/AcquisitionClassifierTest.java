package org.tims.convert;

import org.junit.jupiter.api.Test;
import org.tims.core.AcquisitionMode;
import org.tims.core.Schema;
import org.tims.source.FrameInfo;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AcquisitionClassifierTest {

    private static final AcquisitionClassifier TDF = new AcquisitionClassifier(Schema.TDF, false);
    private static final AcquisitionClassifier TSF = new AcquisitionClassifier(Schema.TSF, false);
    private static final AcquisitionClassifier BAF = new AcquisitionClassifier(Schema.BAF, false);
    private static final AcquisitionClassifier MALDI_TDF = new AcquisitionClassifier(Schema.TDF, true);

    @Test
    public void classifiesTdfModes() {
        assertEquals(Optional.of(AcquisitionMode.MS1), TDF.classify(0, 0));
        assertEquals(Optional.of(AcquisitionMode.MS1), TDF.classify(9, 0));
        assertEquals(Optional.of(AcquisitionMode.DDA_PASEF_PRECURSOR), TDF.classify(8, 0));
        assertEquals(Optional.of(AcquisitionMode.DDA_PASEF_PRODUCT), TDF.classify(8, 8));
        assertEquals(Optional.of(AcquisitionMode.DIA_PASEF), TDF.classify(9, 9));
        assertEquals(Optional.of(AcquisitionMode.PRM_PASEF), TDF.classify(10, 10));
        assertEquals(Optional.of(AcquisitionMode.BBCID), TDF.classify(4, 2));
        assertEquals(Optional.of(AcquisitionMode.ISCID), TDF.classify(3, 2));
        assertEquals(Optional.of(AcquisitionMode.MRM), TDF.classify(2, 2));
    }

    @Test
    public void classifiesTsfAndBafModes() {
        assertEquals(Optional.of(AcquisitionMode.MS1), TSF.classify(2, 0));
        assertEquals(Optional.of(AcquisitionMode.AUTO_MSMS), TSF.classify(1, 2));
        assertEquals(Optional.of(AcquisitionMode.BBCID), TSF.classify(4, 2));

        assertEquals(Optional.of(AcquisitionMode.MS1), BAF.classify(0, 0));
        assertEquals(Optional.of(AcquisitionMode.AUTO_MSMS), BAF.classify(2, 0));
        assertEquals(Optional.of(AcquisitionMode.ISCID), BAF.classify(4, 0));
        assertEquals(Optional.of(AcquisitionMode.BBCID), BAF.classify(5, 0));
    }

    @Test
    public void unknownPairsAreSkipped() {
        assertFalse(TDF.classify(6, 0).isPresent());
        assertFalse(TDF.classify(8, 2).isPresent());
        assertFalse(TSF.classify(9, 9).isPresent());
        assertFalse(BAF.classify(7, 0).isPresent());
    }

    @Test
    public void maldiIgnoresScanMode() {
        assertEquals(Optional.of(AcquisitionMode.MALDI_MS1), MALDI_TDF.classify(20, 0));
        assertEquals(Optional.of(AcquisitionMode.MALDI_MS2), MALDI_TDF.classify(20, 2));
        assertEquals(Optional.of(AcquisitionMode.MALDI_MS2), MALDI_TDF.classify(8, 8));
        assertFalse(MALDI_TDF.classify(0, 5).isPresent());
    }

    @Test
    public void ms1FramesStartWindows() {
        assertTrue(TDF.isWindowBoundary(frame(0, 0)));
        assertTrue(TDF.isWindowBoundary(frame(8, 0)));
        assertFalse(TDF.isWindowBoundary(frame(8, 8)));
        assertFalse(TDF.isWindowBoundary(frame(6, 0)));
        assertFalse(MALDI_TDF.isWindowBoundary(frame(0, 0)));
    }

    private static FrameInfo frame(int scanMode, int msmsType) {
        return new FrameInfo(1, scanMode, msmsType, "+", 0.0, 1, null);
    }
}
