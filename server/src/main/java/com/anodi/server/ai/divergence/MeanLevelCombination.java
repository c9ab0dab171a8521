package com.anodi.server.ai.divergence;

/**
 * Arithmetic mean over levels. With a single level this is that level's
 * divergence.
 */
public class MeanLevelCombination implements LevelCombinationPolicy {

    public static final MeanLevelCombination INSTANCE = new MeanLevelCombination();

    @Override
    public String getName() {
        return "mean";
    }

    @Override
    public double combine(int[] factors, double[] divergences) {
        if (divergences.length == 0) {
            throw new IllegalArgumentException("No resolution levels to combine");
        }
        return MathUtil.mean(divergences);
    }
}
