package org.tims.io;

import org.tims.core.Spectrum;

import java.io.IOException;

/**
 * Output container accepting canonical spectra in emission order.
 * <p>
 * Calls arrive in the order {@link #writeMetadata}, {@link #beginSpectrumList},
 * any number of {@link #writeSpectrum}, then exactly one of {@link #finish} or
 * {@link #abort}.
 */
public interface SpectrumSink {

    void writeMetadata(RunMetadata metadata) throws IOException;

    /**
     * Opens the spectrum list with the count expected from metadata.
     */
    void beginSpectrumList(int declaredCount) throws IOException;

    /**
     * Writes one spectrum; its scan number and parent reference are already assigned.
     */
    void writeSpectrum(Spectrum spectrum) throws IOException;

    /**
     * Completes the output under its final name, correcting the declared spectrum
     * count when it differs from {@code actualCount}.
     *
     * @return whether the declared count had to be corrected
     */
    boolean finish(int actualCount) throws IOException;

    /**
     * Stops writing and leaves the output under its temporary name.
     */
    void abort();
}
