package com.questrail.aviationwx.model;

/**
 * Kind of a TAF forecast change group.
 */
public enum ChangeKind
{
    /** {@code FMDDHHMM}: conditions change completely from the given instant. */
    FROM("FROM"),
    /** {@code BECMG DDHH/DDHH}: gradual change during the period. */
    BECOMING("BECOMING"),
    /** {@code TEMPO DDHH/DDHH}: temporary fluctuations during the period. */
    TEMPORARY("TEMPORARY"),
    /** {@code PROB30|PROB40 TEMPO DDHH/DDHH}: temporary fluctuations with a stated probability. */
    PROBABLE_TEMPORARY("TEMPORARY");

    private final String label;

    ChangeKind(String label) {
        this.label = label;
    }

    /**
     * Display label without any probability prefix.
     */
    public String label() {
        return label;
    }
}
