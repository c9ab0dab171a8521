package com.anodi.server.ai.divergence;

/**
 * Folds the per-resolution divergences between two images into one distance.
 */
public interface LevelCombinationPolicy {

    String getName();

    /**
     * @param factors     resolution factors present in both images, ascending order of the settings
     * @param divergences divergence at each of those factors
     */
    double combine(int[] factors, double[] divergences);
}
