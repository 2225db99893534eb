package org.tims.testing;

import org.tims.source.AcquisitionSource;
import org.tims.source.AcquisitionSourceProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider that opens sources registered for a path by a test.
 */
public class FakeAcquisitionSourceProvider implements AcquisitionSourceProvider {
    private static final Map<Path, FakeAcquisitionSource> SOURCES = new ConcurrentHashMap<>();

    public static void register(Path input, FakeAcquisitionSource source) {
        SOURCES.put(input.toAbsolutePath().normalize(), source);
    }

    public static void clear() {
        SOURCES.clear();
    }

    @Override
    public String getName() {
        return "fake";
    }

    @Override
    public boolean accepts(Path input) {
        return SOURCES.containsKey(input.toAbsolutePath().normalize());
    }

    @Override
    public AcquisitionSource open(Path input) throws IOException {
        FakeAcquisitionSource source = SOURCES.get(input.toAbsolutePath().normalize());
        if (source == null) {
            throw new IOException("Nothing registered for " + input);
        }
        return source;
    }
}
