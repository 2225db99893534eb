package org.tims.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Little-endian binary encoding of numeric arrays with optional zlib compression.
 */
public final class BinaryDataCodec {
    private final boolean is64Bit;
    private final Compression compression;

    public BinaryDataCodec(int encoding, Compression compression) {
        if (encoding != 32 && encoding != 64) {
            throw new IllegalArgumentException("Encoding must be 32 or 64, got " + encoding);
        }
        this.is64Bit = encoding == 64;
        this.compression = compression;
    }

    public boolean is64Bit() { return is64Bit; }
    public Compression getCompression() { return compression; }

    public String getPrecisionAccession() {
        return is64Bit ? "MS:1000523" : "MS:1000521";
    }

    public String getPrecisionName() {
        return is64Bit ? "64-bit float" : "32-bit float";
    }

    /**
     * Raw (possibly compressed) bytes of the array.
     */
    public byte[] toBytes(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * (is64Bit ? 8 : 4)).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            if (is64Bit) {
                buffer.putDouble(v);
            } else {
                buffer.putFloat((float) v);
            }
        }
        byte[] bytes = buffer.array();
        return compression == Compression.ZLIB ? compress(bytes) : bytes;
    }

    public String encode(double[] values) {
        return Base64.getEncoder().encodeToString(toBytes(values));
    }

    public static double[] decode(String base64, boolean is64Bit, boolean isCompressed) throws IOException {
        byte[] decoded = Base64.getDecoder().decode(base64);

        if (isCompressed) {
            decoded = decompress(decoded);
        }

        ByteBuffer buffer = ByteBuffer.wrap(decoded).order(ByteOrder.LITTLE_ENDIAN);
        int elementSize = is64Bit ? 8 : 4;
        int count = decoded.length / elementSize;
        double[] result = new double[count];
        for (int i = 0; i < count; i++) {
            result[i] = is64Bit ? buffer.getDouble() : buffer.getFloat();
        }
        return result;
    }

    private static byte[] compress(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        byte[] buffer = new byte[4096];
        while (!deflater.finished()) {
            int count = deflater.deflate(buffer);
            outputStream.write(buffer, 0, count);
        }
        deflater.end();
        return outputStream.toByteArray();
    }

    private static byte[] decompress(byte[] data) throws IOException {
        Inflater inflater = new Inflater();
        inflater.setInput(data);

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(data.length * 4);
        byte[] buffer = new byte[1024];
        try {
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && inflater.needsInput()) {
                    throw new IOException("Truncated zlib stream");
                }
                outputStream.write(buffer, 0, count);
            }
        } catch (DataFormatException e) {
            throw new IOException("Invalid zlib stream", e);
        } finally {
            inflater.end();
        }
        return outputStream.toByteArray();
    }
}
