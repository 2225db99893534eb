package org.tims.convert;

import org.junit.jupiter.api.Test;
import org.tims.core.ExtractionMode;
import org.tims.core.Schema;
import org.tims.io.Compression;
import org.tims.io.ImzMLMode;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversionOptionsTest {

    @Test
    public void defaults() {
        ConversionOptions options = ConversionOptions.defaults();

        assertEquals(ExtractionMode.CENTROID, options.getExtractionMode());
        assertEquals(64, options.getEncoding());
        assertEquals(Compression.ZLIB, options.getCompression());
        assertEquals(ConversionOptions.DEFAULT_CHUNK_SIZE, options.getChunkSize());
        assertEquals(MaldiOutputMode.COMBINED, options.getMaldiOutputMode());
        assertEquals(ImzMLMode.PROCESSED, options.getImzmlMode());
        assertEquals(0, options.getProfileBins());
        assertEquals(0, options.getBafPositivePolarityCode());
        assertFalse(options.isMs2Only());
        assertFalse(options.isBarebonesMetadata());
        assertNull(options.getPlateMap());
    }

    @Test
    public void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().encoding(16).build());
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().chunkSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().profileBins(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().extractionMode(null).build());
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().compression(null).build());
    }

    @Test
    public void mobilityOnlyForTdfAndNonProfileData() {
        ConversionOptions centroid = ConversionOptions.defaults();
        assertFalse(centroid.isMobilityExcluded(Schema.TDF));
        assertTrue(centroid.isMobilityExcluded(Schema.TSF));
        assertTrue(centroid.isMobilityExcluded(Schema.BAF));

        assertTrue(ConversionOptions.builder().extractionMode(ExtractionMode.PROFILE).build()
            .isMobilityExcluded(Schema.TDF));
        assertTrue(ConversionOptions.builder().excludeMobility(true).build()
            .isMobilityExcluded(Schema.TDF));
    }

    @Test
    public void toBuilderCopiesEverySetting() {
        ConversionOptions original = ConversionOptions.builder()
            .extractionMode(ExtractionMode.RAW)
            .ms2Only(true)
            .encoding(32)
            .compression(Compression.NONE)
            .chunkSize(3)
            .maldiOutputMode(MaldiOutputMode.SAMPLE)
            .plateMap(Paths.get("plate.csv"))
            .imzmlMode(ImzMLMode.CONTINUOUS)
            .bafPositivePolarityCode(1)
            .barebonesMetadata(true)
            .build();

        ConversionOptions copy = original.toBuilder().ms2Only(false).build();

        assertFalse(copy.isMs2Only());
        assertTrue(original.isMs2Only());
        assertEquals(ExtractionMode.RAW, copy.getExtractionMode());
        assertEquals(32, copy.getEncoding());
        assertEquals(Compression.NONE, copy.getCompression());
        assertEquals(3, copy.getChunkSize());
        assertEquals(MaldiOutputMode.SAMPLE, copy.getMaldiOutputMode());
        assertEquals(Paths.get("plate.csv"), copy.getPlateMap());
        assertEquals(ImzMLMode.CONTINUOUS, copy.getImzmlMode());
        assertEquals(1, copy.getBafPositivePolarityCode());
        assertTrue(copy.isBarebonesMetadata());
    }

    @Test
    public void enumValuesParseCaseInsensitively() {
        assertEquals(ExtractionMode.PROFILE, ExtractionMode.parse(" Profile "));
        assertEquals(Compression.NONE, Compression.parse("none"));
        assertEquals(ImzMLMode.CONTINUOUS, ImzMLMode.parse("CONTINUOUS"));
        assertEquals(MaldiOutputMode.INDIVIDUAL, MaldiOutputMode.parse("individual"));
        assertThrows(IllegalArgumentException.class, () -> Compression.parse("gzip"));
    }
}
