package org.tims.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Lookup of registered {@link AcquisitionSourceProvider}s.
 */
public final class AcquisitionSources {
    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionSources.class);

    private AcquisitionSources() {
    }

    public static List<AcquisitionSourceProvider> providers() {
        List<AcquisitionSourceProvider> providers = new ArrayList<>();
        for (AcquisitionSourceProvider provider : ServiceLoader.load(AcquisitionSourceProvider.class)) {
            providers.add(provider);
        }
        return providers;
    }

    /**
     * Opens {@code input} with the named provider, or with the first provider that
     * accepts it when {@code providerName} is null.
     */
    public static AcquisitionSource open(Path input, String providerName) throws IOException {
        List<AcquisitionSourceProvider> providers = providers();
        for (AcquisitionSourceProvider provider : providers) {
            if (providerName != null) {
                if (provider.getName().equalsIgnoreCase(providerName)) {
                    LOG.info("Opening {} with source provider {}", input, provider.getName());
                    return provider.open(input);
                }
            } else if (provider.accepts(input)) {
                LOG.info("Opening {} with source provider {}", input, provider.getName());
                return provider.open(input);
            }
        }
        if (providerName != null) {
            throw new IOException("No acquisition source provider named " + providerName);
        }
        throw new IOException("No acquisition source provider accepts " + input
            + " (" + providers.size() + " registered)");
    }
}
