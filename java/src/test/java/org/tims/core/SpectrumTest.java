package org.tims.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpectrumTest {

    @Test
    public void statisticsFollowTheArrays() {
        Spectrum s = Spectrum.builder()
            .data(new double[]{100.0, 200.0, 300.0, 400.0}, new double[]{5.0, 9.0, 9.0, 1.0})
            .build();

        assertEquals(24.0, s.getTic(), 1e-12);
        assertEquals(9.0, s.getBasePeakIntensity(), 1e-12);
        // first index reaching the maximum
        assertEquals(200.0, s.getBasePeakMz(), 1e-12);
        assertEquals(100.0, s.getMzMin(), 1e-12);
        assertEquals(400.0, s.getMzMax(), 1e-12);
        assertTrue(s.isSorted());
    }

    @Test
    public void emptySpectrumHasZeroStatistics() {
        Spectrum s = Spectrum.builder().build();

        assertTrue(s.isEmpty());
        assertEquals(0.0, s.getTic());
        assertEquals(0.0, s.getBasePeakMz());
        assertEquals(0.0, s.getMzMin());
    }

    @Test
    public void rejectsMismatchedArrays() {
        assertThrows(IllegalArgumentException.class, () -> Spectrum.builder()
            .data(new double[]{1.0, 2.0}, new double[]{1.0})
            .build());
        assertThrows(IllegalArgumentException.class, () -> Spectrum.builder()
            .data(new double[]{1.0, 2.0}, new double[]{1.0, 2.0})
            .mobility(new double[]{0.9})
            .build());
    }

    @Test
    public void builderCopiesArrays() {
        double[] mz = {1.0, 2.0};
        Spectrum s = Spectrum.builder().data(mz, new double[]{3.0, 4.0}).build();
        mz[0] = 99.0;

        assertEquals(1.0, s.getMzAt(0));
    }

    @Test
    public void emissionAssignsScanNumberAndParent() {
        Precursor precursor = Precursor.builder().targetMz(500.0).isolationWidth(2.0).build();
        Spectrum product = Spectrum.builder()
            .data(new double[]{150.0}, new double[]{10.0})
            .frame(12)
            .parentFrame(10)
            .msLevel(2)
            .precursor(precursor)
            .build();

        Spectrum emitted = product.withEmission(7, 5);

        assertEquals(7, emitted.getScanNumber());
        assertEquals(Integer.valueOf(5), emitted.getParentScanNumber());
        assertEquals("scan=7", emitted.getNativeId());
        assertEquals(12, emitted.getFrame());
        assertEquals(Integer.valueOf(10), emitted.getParentFrame());
        assertSame(precursor, emitted.getPrecursor());
        assertArrayEquals(product.getMz(), emitted.getMz());
        assertEquals(0, product.getScanNumber());
        assertNull(product.getParentScanNumber());
    }

    @Test
    public void scanTypeDefaultsFromMsLevel() {
        assertEquals("MS1 spectrum", Spectrum.builder().msLevel(1).build().getScanType());
        assertEquals("MSn spectrum", Spectrum.builder().msLevel(2).build().getScanType());
    }

    @Test
    public void isolationWidthIsSplitEvenly() {
        Precursor p = Precursor.builder().targetMz(600.0).isolationWidth(3.0).charge(0).build();

        assertEquals(1.5, p.getIsolationLowerOffset(), 1e-12);
        assertEquals(1.5, p.getIsolationUpperOffset(), 1e-12);
        assertTrue(p.hasIsolationWindow());
        assertFalse(p.hasCharge());
    }
}
