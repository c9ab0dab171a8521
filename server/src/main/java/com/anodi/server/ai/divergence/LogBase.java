package com.anodi.server.ai.divergence;

/**
 * Logarithm base used by the divergence. Fixed for a whole evaluation.
 */
public enum LogBase {
    /** Natural log, divergence bounded by ln 2. */
    NATURAL(1.0),
    /** Base 2, divergence bounded by 1. */
    BASE_2(Math.log(2.0));

    private final double lnOfBase;

    LogBase(double lnOfBase) {
        this.lnOfBase = lnOfBase;
    }

    public double log(double x) {
        return Math.log(x) / lnOfBase;
    }

    /**
     * Largest possible Jensen-Shannon divergence in this base.
     */
    public double upperBound() {
        return Math.log(2.0) / lnOfBase;
    }
}
