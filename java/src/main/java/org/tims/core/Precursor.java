package org.tims.core;

/**
 * Precursor ion information for MS/MS spectra. Every field is optional; which
 * ones are present depends on the acquisition mode that produced the spectrum.
 */
public final class Precursor {
    private final Double targetMz;
    private final Double isolationLowerOffset;
    private final Double isolationUpperOffset;
    private final Double selectedIonMz;
    private final Double selectedIonIntensity;
    private final Double selectedIonMobility;
    private final Double selectedIonCcs;
    private final Integer charge;
    private final Double collisionEnergy;

    private Precursor(Builder b) {
        this.targetMz = b.targetMz;
        this.isolationLowerOffset = b.isolationLowerOffset;
        this.isolationUpperOffset = b.isolationUpperOffset;
        this.selectedIonMz = b.selectedIonMz;
        this.selectedIonIntensity = b.selectedIonIntensity;
        this.selectedIonMobility = b.selectedIonMobility;
        this.selectedIonCcs = b.selectedIonCcs;
        this.charge = b.charge;
        this.collisionEnergy = b.collisionEnergy;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public Double getTargetMz() { return targetMz; }
    public Double getIsolationLowerOffset() { return isolationLowerOffset; }
    public Double getIsolationUpperOffset() { return isolationUpperOffset; }
    public Double getSelectedIonMz() { return selectedIonMz; }
    public Double getSelectedIonIntensity() { return selectedIonIntensity; }
    public Double getSelectedIonMobility() { return selectedIonMobility; }
    public Double getSelectedIonCcs() { return selectedIonCcs; }
    public Integer getCharge() { return charge; }
    public Double getCollisionEnergy() { return collisionEnergy; }

    public boolean hasCharge() { return charge != null && charge != 0; }
    public boolean hasIsolationWindow() { return targetMz != null; }

    @Override
    public String toString() {
        return String.format("Precursor(target=%s, selected=%s, charge=%s)", targetMz, selectedIonMz, charge);
    }

    public static final class Builder {
        private Double targetMz;
        private Double isolationLowerOffset;
        private Double isolationUpperOffset;
        private Double selectedIonMz;
        private Double selectedIonIntensity;
        private Double selectedIonMobility;
        private Double selectedIonCcs;
        private Integer charge;
        private Double collisionEnergy;

        private Builder() {
        }

        public Builder targetMz(Double targetMz) { this.targetMz = targetMz; return this; }

        /**
         * Sets a symmetric isolation window of the given total width.
         */
        public Builder isolationWidth(double width) {
            this.isolationLowerOffset = width / 2;
            this.isolationUpperOffset = width / 2;
            return this;
        }

        public Builder selectedIonMz(Double mz) { this.selectedIonMz = mz; return this; }
        public Builder selectedIonIntensity(Double intensity) { this.selectedIonIntensity = intensity; return this; }
        public Builder selectedIonMobility(Double mobility) { this.selectedIonMobility = mobility; return this; }
        public Builder selectedIonCcs(Double ccs) { this.selectedIonCcs = ccs; return this; }
        public Builder charge(Integer charge) { this.charge = charge; return this; }
        public Builder collisionEnergy(Double energy) { this.collisionEnergy = energy; return this; }

        public Builder isolationOffsets(Double lower, Double upper) {
            this.isolationLowerOffset = lower;
            this.isolationUpperOffset = upper;
            return this;
        }

        public Precursor build() {
            return new Precursor(this);
        }
    }
}
