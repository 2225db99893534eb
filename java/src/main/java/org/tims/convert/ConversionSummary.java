package org.tims.convert;

import java.nio.file.Path;

/**
 * Outcome of one finalized output file.
 */
public final class ConversionSummary {
    private final Path output;
    private final int declaredCount;
    private final int emittedCount;
    private final boolean countCorrected;

    public ConversionSummary(Path output, int declaredCount, int emittedCount, boolean countCorrected) {
        this.output = output;
        this.declaredCount = declaredCount;
        this.emittedCount = emittedCount;
        this.countCorrected = countCorrected;
    }

    public Path getOutput() { return output; }

    /** Spectrum count declared before streaming. */
    public int getDeclaredCount() { return declaredCount; }
    public int getEmittedCount() { return emittedCount; }

    /** Whether the written output had its declared count rewritten. */
    public boolean isCountCorrected() { return countCorrected; }

    @Override
    public String toString() {
        return String.format("ConversionSummary(output=%s, declared=%d, emitted=%d, corrected=%s)",
            output, declaredCount, emittedCount, countCorrected);
    }
}
