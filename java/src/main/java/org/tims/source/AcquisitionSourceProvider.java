package org.tims.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Service provider that opens acquisitions of a vendor format.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} through
 * {@code META-INF/services/org.tims.source.AcquisitionSourceProvider}.
 */
public interface AcquisitionSourceProvider {

    /**
     * Short name used to select this provider on the command line.
     */
    String getName();

    /**
     * Tests whether this provider can open the given acquisition path.
     */
    boolean accepts(Path input);

    AcquisitionSource open(Path input) throws IOException;
}
