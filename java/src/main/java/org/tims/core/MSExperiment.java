package org.tims.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Spectra read back from a converted file, with the count its spectrum list declares.
 */
public class MSExperiment {
    private final List<Spectrum> spectra = new ArrayList<>();
    private String sourceFile;
    private String software;
    private int declaredSpectrumCount = -1;

    public int getSpectrumCount() { return spectra.size(); }
    public boolean hasSpectra() { return !spectra.isEmpty(); }

    public Spectrum getSpectrum(int index) { return spectra.get(index); }
    public List<Spectrum> getSpectra() { return Collections.unmodifiableList(spectra); }

    public void addSpectrum(Spectrum spectrum) {
        spectra.add(spectrum);
    }

    /** Count attribute of the spectrum list, or -1 when the file carries none. */
    public int getDeclaredSpectrumCount() { return declaredSpectrumCount; }
    public void setDeclaredSpectrumCount(int count) { this.declaredSpectrumCount = count; }

    /**
     * True when the declared count matches the spectra actually present.
     */
    public boolean isCountConsistent() {
        return declaredSpectrumCount == spectra.size();
    }

    public Optional<Spectrum> findByScanNumber(int scanNumber) {
        for (Spectrum s : spectra) {
            if (s.getScanNumber() == scanNumber) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public SortedMap<Integer, Integer> countByLevel() {
        SortedMap<Integer, Integer> counts = new TreeMap<>();
        for (Spectrum s : spectra) {
            counts.merge(s.getMsLevel(), 1, Integer::sum);
        }
        return counts;
    }

    public Map<Polarity, Integer> countByPolarity() {
        Map<Polarity, Integer> counts = new EnumMap<>(Polarity.class);
        for (Spectrum s : spectra) {
            counts.merge(s.getPolarity(), 1, Integer::sum);
        }
        return counts;
    }

    public int countSpectraWithMobility() {
        int count = 0;
        for (Spectrum s : spectra) {
            if (s.hasMobility()) count++;
        }
        return count;
    }

    /** MS/MS spectra whose precursor references a parent scan in this file. */
    public int countLinkedProducts() {
        int count = 0;
        for (Spectrum s : spectra) {
            if (s.getMsLevel() > 1 && s.getParentScanNumber() != null) count++;
        }
        return count;
    }

    /** Smallest and largest m/z over all non-empty spectra, or null when there are none. */
    public double[] getMzRange() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Spectrum s : spectra) {
            if (!s.isEmpty()) {
                min = Math.min(min, s.getMzMin());
                max = Math.max(max, s.getMzMax());
            }
        }
        return min > max ? null : new double[]{min, max};
    }

    /** Retention time range in minutes, or null for an empty file. */
    public double[] getRtRange() {
        if (spectra.isEmpty()) return null;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Spectrum s : spectra) {
            min = Math.min(min, s.getRetentionTime());
            max = Math.max(max, s.getRetentionTime());
        }
        return new double[]{min, max};
    }

    /** Inverse reduced ion mobility range, or null when no spectrum has a mobility array. */
    public double[] getMobilityRange() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Spectrum s : spectra) {
            if (!s.hasMobility()) continue;
            for (double k0 : s.getMobility()) {
                min = Math.min(min, k0);
                max = Math.max(max, k0);
            }
        }
        return min > max ? null : new double[]{min, max};
    }

    public long getTotalDataPoints() {
        long total = 0;
        for (Spectrum s : spectra) {
            total += s.size();
        }
        return total;
    }

    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }

    public String getSoftware() { return software; }
    public void setSoftware(String software) { this.software = software; }

    @Override
    public String toString() {
        return String.format("MSExperiment(spectra=%d, declared=%d, source=%s)",
            spectra.size(), declaredSpectrumCount, sourceFile);
    }
}
