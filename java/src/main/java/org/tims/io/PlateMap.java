package org.tims.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sample labels of a MALDI target plate, read from a headerless CSV grid.
 * <p>
 * The cell in row {@code r} (from 0) and column {@code c} (from 1) labels the spot
 * {@code <'A' + r><c>}, so the first cell names spot "A1". Empty cells and
 * {@code nan} leave a spot unlabeled.
 */
public final class PlateMap {
    public static final CSVFormat PLATE_MAP_FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(false)
        .setTrim(true)
        .build();

    private final Map<String, String> labels;

    private PlateMap(Map<String, String> labels) {
        this.labels = Collections.unmodifiableMap(labels);
    }

    public static PlateMap read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static PlateMap parse(Reader reader) throws IOException {
        Map<String, String> labels = new LinkedHashMap<>();
        try (CSVParser parser = new CSVParser(reader, PLATE_MAP_FORMAT)) {
            int row = 0;
            for (CSVRecord record : parser) {
                char rowName = (char) ('A' + row);
                for (int column = 0; column < record.size(); column++) {
                    String value = record.get(column);
                    if (isLabel(value)) {
                        labels.put(rowName + Integer.toString(column + 1), value);
                    }
                }
                row++;
            }
        }
        return new PlateMap(labels);
    }

    private static boolean isLabel(String value) {
        return value != null && !value.isEmpty() && !value.equalsIgnoreCase("nan");
    }

    public Optional<String> labelOf(String spot) {
        return Optional.ofNullable(labels.get(spot));
    }

    /** Distinct labels in plate order. */
    public Set<String> getLabels() {
        return new LinkedHashSet<>(labels.values());
    }

    public Map<String, String> asMap() {
        return labels;
    }

    public int size() {
        return labels.size();
    }
}
