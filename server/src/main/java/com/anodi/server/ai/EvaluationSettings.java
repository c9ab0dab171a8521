package com.anodi.server.ai;

import com.anodi.server.ai.divergence.LevelCombinationPolicy;
import com.anodi.server.ai.divergence.LogBase;
import com.anodi.server.ai.divergence.MeanLevelCombination;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable parameters of one evaluation. Every evaluator carries its own
 * instance, so evaluations with different settings can run side by side.
 */
public class EvaluationSettings {

    public static final int DEFAULT_PATCH_SIZE = 2;

    private final int patchSize;
    private final int[] factors;
    private final TieBreak tieBreak;
    private final LogBase logBase;
    private final LevelCombinationPolicy combinationPolicy;
    private final boolean parallel;

    public EvaluationSettings(int patchSize, int[] factors, TieBreak tieBreak, LogBase logBase,
            LevelCombinationPolicy combinationPolicy, boolean parallel) {
        PatternEncoder.checkPatchSize(patchSize);
        checkFactors(factors);
        if (tieBreak == null || logBase == null || combinationPolicy == null) {
            throw new ConfigurationException("Tie-break, log base and combination policy are required");
        }
        this.patchSize = patchSize;
        this.factors = factors.clone();
        this.tieBreak = tieBreak;
        this.logBase = logBase;
        this.combinationPolicy = combinationPolicy;
        this.parallel = parallel;
    }

    /**
     * Single resolution, natural log, ties to 0, mean combination.
     */
    public static EvaluationSettings of(int patchSize) {
        return of(patchSize, 1);
    }

    public static EvaluationSettings of(int patchSize, int... factors) {
        return new EvaluationSettings(patchSize, factors, TieBreak.ZERO, LogBase.NATURAL,
                MeanLevelCombination.INSTANCE, true);
    }

    public static EvaluationSettings defaults() {
        return of(DEFAULT_PATCH_SIZE);
    }

    private static void checkFactors(int[] factors) {
        if (factors == null || factors.length == 0) {
            throw new ConfigurationException("At least one resolution factor is required");
        }
        Set<Integer> seen = new HashSet<>();
        for (int f : factors) {
            if (f <= 0) {
                throw new ConfigurationException("Resolution factors must be positive, got " + f);
            }
            if (!seen.add(f)) {
                throw new ConfigurationException("Resolution factor " + f + " listed twice");
            }
        }
    }

    public int getPatchSize() {
        return patchSize;
    }

    public int[] getFactors() {
        return factors.clone();
    }

    public TieBreak getTieBreak() {
        return tieBreak;
    }

    public LogBase getLogBase() {
        return logBase;
    }

    public LevelCombinationPolicy getCombinationPolicy() {
        return combinationPolicy;
    }

    public boolean isParallel() {
        return parallel;
    }

    public EvaluationSettings withPatchSize(int newPatchSize) {
        return new EvaluationSettings(newPatchSize, factors, tieBreak, logBase, combinationPolicy, parallel);
    }

    public EvaluationSettings withFactors(List<Integer> newFactors) {
        if (newFactors == null) {
            throw new ConfigurationException("At least one resolution factor is required");
        }
        int[] f = new int[newFactors.size()];
        for (int i = 0; i < f.length; i++) {
            Integer v = newFactors.get(i);
            if (v == null) {
                throw new ConfigurationException("Resolution factor at position " + i + " is null");
            }
            f[i] = v;
        }
        return new EvaluationSettings(patchSize, f, tieBreak, logBase, combinationPolicy, parallel);
    }

    public EvaluationSettings withParallel(boolean newParallel) {
        return new EvaluationSettings(patchSize, factors, tieBreak, logBase, combinationPolicy, newParallel);
    }

    /**
     * Identifies everything that shapes a histogram bundle. Used as the
     * persistent cache key together with the image hash.
     */
    public String histogramSignature() {
        StringBuilder sb = new StringBuilder();
        sb.append("n=").append(patchSize).append(";f=");
        for (int i = 0; i < factors.length; i++) {
            if (i > 0)
                sb.append(',');
            sb.append(factors[i]);
        }
        sb.append(";tie=").append(tieBreak.name());
        return sb.toString();
    }

    @Override
    public String toString() {
        return "EvaluationSettings{patchSize=" + patchSize + ", factors=" + Arrays.toString(factors)
                + ", tieBreak=" + tieBreak + ", logBase=" + logBase + ", combination="
                + combinationPolicy.getName() + ", parallel=" + parallel + "}";
    }
}
