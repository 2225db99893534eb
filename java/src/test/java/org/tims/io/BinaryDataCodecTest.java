package org.tims.io;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BinaryDataCodecTest {

    private static final double[] VALUES = {100.0, 250.125, 1699.9876, 0.0};

    @Test
    public void uncompressedDoublesAreLittleEndian() {
        byte[] bytes = new BinaryDataCodec(64, Compression.NONE).toBytes(new double[]{1.0});

        assertArrayEquals(new byte[]{0, 0, 0, 0, 0, 0, (byte) 0xF0, 0x3F}, bytes);
    }

    @Test
    public void floatsUseFourBytes() {
        assertEquals(VALUES.length * 4, new BinaryDataCodec(32, Compression.NONE).toBytes(VALUES).length);
        assertEquals(VALUES.length * 8, new BinaryDataCodec(64, Compression.NONE).toBytes(VALUES).length);
    }

    @Test
    public void compressedDataDecodes() throws IOException {
        String encoded = new BinaryDataCodec(64, Compression.ZLIB).encode(VALUES);

        assertArrayEquals(VALUES, BinaryDataCodec.decode(encoded, true, true), 0.0);
    }

    @Test
    public void floatPrecisionIsLossy() throws IOException {
        String encoded = new BinaryDataCodec(32, Compression.NONE).encode(VALUES);

        assertArrayEquals(VALUES, BinaryDataCodec.decode(encoded, false, false), 1e-3);
    }

    @Test
    public void precisionTerms() {
        assertEquals("MS:1000523", new BinaryDataCodec(64, Compression.NONE).getPrecisionAccession());
        assertEquals("MS:1000521", new BinaryDataCodec(32, Compression.NONE).getPrecisionAccession());
        assertThrows(IllegalArgumentException.class, () -> new BinaryDataCodec(16, Compression.NONE));
    }

    @Test
    public void corruptZlibIsAnIOException() {
        String garbage = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3, 4, 5});

        assertThrows(IOException.class, () -> BinaryDataCodec.decode(garbage, true, true));
    }
}
