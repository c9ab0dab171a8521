package com.anodi.server.ai;

import java.util.Arrays;

/**
 * Multipoint histogram indexed by pattern id. Always backed by integer
 * pattern counts; a normalized histogram shares the counts of the raw one and
 * reports count / total as the value of each bin.
 */
public class Histogram {

    private final int patchSize;
    private final int[] counts;
    private final long patchTotal;
    private final boolean normalized;

    Histogram(int patchSize, int[] counts, boolean normalized) {
        this.patchSize = patchSize;
        this.counts = counts;
        this.normalized = normalized;
        long sum = 0;
        for (int c : counts) {
            sum += c;
        }
        this.patchTotal = sum;
    }

    /**
     * Wraps a copy of raw counts, e.g. ones loaded from the histogram cache.
     */
    public static Histogram ofCounts(int patchSize, int[] counts) {
        int expected = PatternEncoder.patternCount(patchSize);
        if (counts == null || counts.length != expected) {
            throw new ValidationException("Histogram for patch size " + patchSize + " needs " + expected
                    + " bins, got " + (counts == null ? "null" : String.valueOf(counts.length)));
        }
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] < 0) {
                throw new ValidationException("Count at id " + i + " is " + counts[i]);
            }
        }
        return new Histogram(patchSize, counts.clone(), false);
    }

    public int getPatchSize() {
        return patchSize;
    }

    public int length() {
        return counts.length;
    }

    /**
     * Count of the pattern, or its probability when normalized.
     */
    public double get(int patternId) {
        return normalized ? (double) counts[patternId] / patchTotal : counts[patternId];
    }

    public int getCount(int patternId) {
        return counts[patternId];
    }

    /**
     * Number of windows counted, whichever view this is.
     */
    public long getPatchTotal() {
        return patchTotal;
    }

    public boolean isNormalized() {
        return normalized;
    }

    public double total() {
        if (!normalized) {
            return patchTotal;
        }
        double sum = 0.0;
        for (int i = 0; i < counts.length; i++) {
            sum += get(i);
        }
        return sum;
    }

    public double[] toArray() {
        double[] out = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    public int[] countsArray() {
        return counts.clone();
    }

    public Histogram normalize() {
        if (normalized) {
            return this;
        }
        if (patchTotal <= 0) {
            throw new ValidationException("Cannot normalize an empty histogram");
        }
        return new Histogram(patchSize, counts, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Histogram))
            return false;
        Histogram other = (Histogram) o;
        return patchSize == other.patchSize && normalized == other.normalized
                && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(counts) + patchSize;
    }
}
