package org.tims.core;

/**
 * Ion polarity mode, with its scan polarity term.
 */
public enum Polarity {
    UNKNOWN("", null, null),
    POSITIVE("+", "MS:1000130", "positive scan"),
    NEGATIVE("-", "MS:1000129", "negative scan");

    private final String symbol;
    private final String accession;
    private final String cvName;

    Polarity(String symbol, String accession, String cvName) {
        this.symbol = symbol;
        this.accession = accession;
        this.cvName = cvName;
    }

    public String getSymbol() {
        return symbol;
    }

    /** Scan polarity accession, or null for {@link #UNKNOWN}. */
    public String getAccession() {
        return accession;
    }

    public String getCvName() {
        return cvName;
    }

    /**
     * Resolve the "+" / "-" notation used by the frame tables.
     */
    public static Polarity fromSymbol(String symbol) {
        if (symbol == null) return UNKNOWN;
        for (Polarity p : values()) {
            if (p != UNKNOWN && p.symbol.equals(symbol.trim())) return p;
        }
        return UNKNOWN;
    }
}
